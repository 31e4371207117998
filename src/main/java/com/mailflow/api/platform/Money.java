package com.mailflow.api.platform;

import lombok.NonNull;
import lombok.val;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Currency;

/**
 * Rounding and unit conversion helpers for monetary amounts. All amounts in this project are
 * {@link BigDecimal}s in the major unit of their ISO 4217 currency.
 */
public final class Money {

    private static final int DEFAULT_FRACTION_DIGITS = 2;

    private Money() {
    }

    /**
     * @return the number of minor unit digits of the given currency, or {@literal 2} if the
     * currency is unknown or has no minor units defined (e.g. {@code XAU}).
     */
    public static int fractionDigits(String currencyCode) {
        if (currencyCode == null) {
            return DEFAULT_FRACTION_DIGITS;
        }

        try {
            val digits = Currency.getInstance(currencyCode.toUpperCase()).getDefaultFractionDigits();
            return digits < 0 ? DEFAULT_FRACTION_DIGITS : digits;
        } catch (IllegalArgumentException e) {
            return DEFAULT_FRACTION_DIGITS;
        }
    }

    /**
     * Rounds the amount half-up to the precision of its currency.
     */
    @NonNull
    public static BigDecimal round(@NonNull BigDecimal amount, String currencyCode) {
        return amount.setScale(fractionDigits(currencyCode), RoundingMode.HALF_UP);
    }

    /**
     * @return the amount in minor currency units, e.g. {@code 79.99 USD -> 7999}.
     * @throws ArithmeticException if the amount doesn't fit in a {@code long}.
     */
    public static long toMinorUnits(@NonNull BigDecimal amount, String currencyCode) {
        return round(amount, currencyCode).movePointRight(fractionDigits(currencyCode)).longValueExact();
    }

    @NonNull
    public static BigDecimal fromMinorUnits(long amount, String currencyCode) {
        val digits = fractionDigits(currencyCode);
        return BigDecimal.valueOf(amount, digits);
    }

    /**
     * @return whether the given code is a known ISO 4217 currency code.
     */
    public static boolean isKnownCurrency(String currencyCode) {
        if (currencyCode == null || currencyCode.length() != 3) {
            return false;
        }

        try {
            Currency.getInstance(currencyCode.toUpperCase());
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}

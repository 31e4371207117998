package com.mailflow.api.subscription;

import com.mailflow.api.platform.Money;
import lombok.NonNull;
import lombok.val;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Time-based proration of plan prices within a billing period.
 */
final class Proration {

    private static final int FRACTION_SCALE = 10;

    private Proration() {
    }

    /**
     * @return the fraction of {@code [periodStart, periodEnd)} that lies after {@code from},
     * clamped to {@code [0, 1]}.
     */
    @NonNull
    static BigDecimal remainingFraction(
        @NonNull OffsetDateTime from,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd
    ) {
        if (!periodEnd.isAfter(periodStart)) {
            throw new IllegalArgumentException("billing period must end after it starts");
        }

        if (!from.isAfter(periodStart)) {
            return BigDecimal.ONE;
        }

        if (!from.isBefore(periodEnd)) {
            return BigDecimal.ZERO;
        }

        val remaining = Duration.between(from, periodEnd).toMillis();
        val total = Duration.between(periodStart, periodEnd).toMillis();
        return BigDecimal.valueOf(remaining).divide(BigDecimal.valueOf(total), FRACTION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @return {@code fraction * (newPrice - oldPrice)}, rounded to the currency's precision.
     * Negative results are credits.
     */
    @NonNull
    static BigDecimal amount(
        @NonNull BigDecimal fraction,
        @NonNull BigDecimal oldPrice,
        @NonNull BigDecimal newPrice,
        @NonNull String currency
    ) {
        return Money.round(fraction.multiply(newPrice.subtract(oldPrice)), currency);
    }
}

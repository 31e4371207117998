package com.mailflow.api.subscription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NonNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties used by various components in the subscription package.
 */
@Validated
@ConfigurationProperties("app.subscriptions")
@Data
class SubscriptionConfiguration {

    /**
     * How long after its creation an invoice is due.
     */
    @NotNull
    private final Duration invoiceDueAfter;

    /**
     * Delays of the automatic payment retries after the first failed attempt on an invoice. The
     * invoice fails for good once every retry has failed.
     */
    @NotEmpty
    private final List<Duration> paymentRetryIntervals;

    /**
     * Price of a single unit of usage beyond the plan quota, keyed by resource type. Resources
     * without a price aren't billed for overage.
     */
    @NotNull
    private final Map<String, BigDecimal> overageUnitPrices;

    /**
     * Tax rate (as a fraction) for subscriptions that don't carry their own.
     */
    @NotNull
    private final BigDecimal defaultTaxRate;

    /**
     * Percent off, keyed by discount reference.
     */
    @NotNull
    private final Map<String, BigDecimal> discounts;

    @NotNull
    private final Duration cacheTtl;

    @NotBlank
    private final String invoiceNumberPrefix;

    /**
     * @return the total number of payment attempts an invoice gets.
     */
    int getMaxPaymentAttempts() {
        return paymentRetryIntervals.size() + 1;
    }

    /**
     * @return the delay before the attempt that follows {@code failedAttempts} failures, or
     * {@literal null} if no attempts remain.
     */
    Duration getRetryDelayAfter(int failedAttempts) {
        if (failedAttempts < 1 || failedAttempts > paymentRetryIntervals.size()) {
            return null;
        }

        return paymentRetryIntervals.get(failedAttempts - 1);
    }

    @NonNull
    BigDecimal getOverageUnitPrice(@NonNull String resourceType) {
        return overageUnitPrices.getOrDefault(resourceType, BigDecimal.ZERO);
    }
}

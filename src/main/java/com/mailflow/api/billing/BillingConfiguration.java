package com.mailflow.api.billing;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the billing package.
 */
@Validated
@ConfigurationProperties("app.billing")
@Data
class BillingConfiguration {

    /**
     * Interval between two scheduled billing passes.
     */
    @NotNull
    private final Duration schedulerInterval;

    /**
     * Whether the billing scheduler starts with the application context.
     */
    private final boolean schedulerAutoStartup;

    /**
     * Whether each billing pass also bills unbilled overage of all billable tenants.
     */
    private final boolean billOverageOnEachPass;

    /**
     * Whether invoice charges that the fraud screen recommends for review go through.
     */
    private final boolean proceedOnFraudReview;
}

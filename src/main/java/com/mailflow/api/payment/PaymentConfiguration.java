package com.mailflow.api.payment;

import com.mailflow.api.payment.models.PaymentProviderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Configuration properties used by various components in the payment package.
 */
@Validated
@ConfigurationProperties("app.payments")
@Data
class PaymentConfiguration {

    /**
     * The longest that a single charge attempt may block before it counts as a provider outage.
     */
    @NotNull
    private final Duration chargeTimeout;

    @Valid
    @NotNull
    private final List<Provider> providers;

    @Valid
    @NotNull
    private final FraudPolicy fraud;

    @Data
    static class Provider {

        @NotNull
        private final PaymentProviderType type;

        /**
         * Lower values take precedence.
         */
        private final int priority;

        private final boolean active;

        @NotBlank
        private final String apiKey;

        @NotBlank
        private final String webhookSecret;

        /**
         * Api base url. Only used by Square.
         */
        private final String baseUrl;

        /**
         * Square location that receives the payments. Only used by Square.
         */
        private final String locationId;

        /**
         * The url that the provider delivers webhooks to. Only used by Square.
         */
        private final String webhookNotificationUrl;
    }

    @Data
    static class FraudPolicy {

        /**
         * Scores at or above it are recommended for review.
         */
        @Positive
        private final int reviewThreshold;

        /**
         * Scores at or above it are in the high risk band.
         */
        @Positive
        private final int highRiskThreshold;

        /**
         * Scores at or above it are declined.
         */
        @Positive
        private final int declineThreshold;

        /**
         * Charges strictly above this amount are declined regardless of their score.
         */
        @NotNull
        @Positive
        private final BigDecimal amountCeiling;

        /**
         * Default for requests that don't state whether to proceed on a review recommendation.
         */
        private final boolean proceedOnReview;
    }
}

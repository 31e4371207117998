package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A request to charge a customer through one of the registered payment providers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @NonNull
    private BigDecimal amount;

    @NonNull
    private String currency;

    /**
     * Provider assigned customer id of the payer.
     */
    private String customerRef;

    /**
     * Provider assigned id of a stored payment method, e.g. a Stripe PaymentMethod or a Square
     * card on file.
     */
    private String paymentMethodRef;

    private String description;

    /**
     * Forwarded to the provider's native idempotency mechanism. Retrying a charge with the same
     * key never charges the customer twice.
     */
    @NonNull
    private String idempotencyKey;

    /**
     * Risk signals and references (tenant, subscription and invoice ids) attached to the charge.
     */
    private Map<String, String> metadata;

    /**
     * Whether to proceed with a charge that the fraud screen recommends for manual review. If
     * {@literal null}, the configured default applies.
     */
    private Boolean proceedOnFraudReview;
}

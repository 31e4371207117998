package com.mailflow.api.billing.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * A parsed payment provider webhook event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderEvent {

    @NonNull
    private Kind kind;

    /**
     * Provider assigned id of the event.
     */
    private String eventId;

    /**
     * Id of the invoice that the payment settles, from the metadata attached to the charge.
     */
    private Long invoiceId;

    private String tenantId;

    private String paymentId;

    private String providerSubscriptionRef;

    /**
     * Provider side status of the subscription, for {@link Kind#SUBSCRIPTION_UPDATED} events.
     */
    private String subscriptionStatus;

    private BigDecimal amount;

    private String currency;

    private String failureMessage;

    public enum Kind {
        PAYMENT_SUCCEEDED,
        PAYMENT_FAILED,
        SUBSCRIPTION_CREATED,
        SUBSCRIPTION_UPDATED,
        SUBSCRIPTION_CANCELLED,
        INVOICE_PAYMENT_SUCCEEDED,
        INVOICE_PAYMENT_FAILED,
    }
}

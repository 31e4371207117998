package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Map;

/**
 * A request to mirror a subscription at a payment provider, for providers that manage recurring
 * collection on their side.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderSubscriptionRequest {

    @NonNull
    private String customerRef;

    /**
     * Provider assigned id of the recurring price (Stripe) or plan variation (Square).
     */
    @NonNull
    private String providerPlanRef;

    @NonNull
    private String idempotencyKey;

    private Integer trialDays;

    private Map<String, String> metadata;
}

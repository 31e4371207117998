package com.mailflow.api.subscription.models;

import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * Outcome of an upgrade or a downgrade.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanChangeResult {

    @NonNull
    private Subscription subscription;

    /**
     * Signed proration amount. Positive amounts are charges, negative amounts are credits.
     */
    @NonNull
    private BigDecimal prorationAmount;

    /**
     * Out-of-cycle invoice for the proration, if it is billed immediately.
     */
    private Invoice prorationInvoice;
}

package com.mailflow.api.subscription.models;

import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.Subscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of closing one elapsed billing period of a subscription.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeriodCloseResult {

    /**
     * The subscription after the period was closed.
     */
    private Subscription subscription;

    /**
     * The invoice for the closed period. {@literal null} if the period had nothing to bill.
     */
    private Invoice invoice;

    /**
     * Whether the period was already invoiced before this call.
     */
    private boolean invoiceExisted;

    /**
     * Whether the subscription was cancelled at the closed boundary.
     */
    private boolean cancelled;

    /**
     * Whether the next period has already elapsed too.
     */
    private boolean moreDue;

    /**
     * Whether no period was closed because none had elapsed.
     */
    public boolean isNothingDue() {
        return subscription == null;
    }

    public static PeriodCloseResult nothingDue() {
        return new PeriodCloseResult();
    }
}

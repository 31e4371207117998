package com.mailflow.api.billing.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of a single billing pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "BillingPassSummary")
public class BillingPassSummary {

    @Schema(description = "open invoices whose payment was retried")
    private int retriedInvoices;

    @Schema(description = "subscriptions with at least one elapsed period")
    private int dueSubscriptions;

    @Schema(description = "billing periods closed")
    private int closedPeriods;

    @Schema(description = "cycle invoices created")
    private int invoicesCreated;

    @Schema(description = "overage invoices created")
    private int overageInvoicesCreated;

    @Schema(description = "invoices paid during the pass")
    private int paymentsSucceeded;

    @Schema(description = "failed payment attempts during the pass")
    private int paymentsFailed;

    @Schema(description = "subscriptions cancelled at a period boundary")
    private int subscriptionsCancelled;

    @Schema(description = "subscriptions or invoices that failed with an unexpected error")
    private int errors;
}

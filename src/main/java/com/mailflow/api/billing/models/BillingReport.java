package com.mailflow.api.billing.models;

import com.mailflow.api.subscription.payload.InvoiceResponse;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "BillingReport")
public class BillingReport {

    @NonNull
    private String tenantId;

    @NonNull
    private OffsetDateTime start;

    @NonNull
    private OffsetDateTime end;

    @Schema(description = "invoices created in the range, void ones included")
    private int invoicesGenerated;

    @Schema(description = "sum of invoice totals, void invoices excluded")
    @NonNull
    private BigDecimal totalBilled;

    @Schema(description = "sum of amounts paid")
    @NonNull
    private BigDecimal totalCollected;

    @Schema(description = "sum of amounts due on open and failed invoices")
    @NonNull
    private BigDecimal totalOutstanding;

    @Schema(description = "sum of overage line items, void invoices excluded")
    @NonNull
    private BigDecimal overageCharges;

    @Schema(description = "invoices that failed for good or were voided")
    private int failedPayments;

    @Schema(description = "percentage of generated invoices that were paid")
    @NonNull
    private BigDecimal paymentSuccessRate;

    @NonNull
    private List<InvoiceResponse> invoices;
}

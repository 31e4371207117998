package com.mailflow.api.subscription.payload;

import com.mailflow.api.subscription.entities.Invoice;
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
@Schema(name = "Invoice")
public class InvoiceResponse {

    @Schema(required = true)
    @NonNull
    private Long id;

    @Schema(required = true, description = "tenant scoped, monotonically increasing invoice number")
    @NonNull
    private String invoiceNumber;

    @Schema(required = true, allowableValues = {"CYCLE", "PRORATION", "OVERAGE"})
    @NonNull
    private String kind;

    @Schema(required = true, allowableValues = {"OPEN", "PAID", "PAYMENT_FAILED", "VOID"})
    @NonNull
    private String status;

    @Schema(required = true)
    @NonNull
    private String currency;

    @NonNull
    private BigDecimal subtotal;

    @NonNull
    private BigDecimal discountAmount;

    @NonNull
    private BigDecimal taxAmount;

    @NonNull
    private BigDecimal total;

    @NonNull
    private BigDecimal amountPaid;

    @NonNull
    private BigDecimal amountDue;

    @NonNull
    private OffsetDateTime periodStart;

    @NonNull
    private OffsetDateTime periodEnd;

    @NonNull
    private OffsetDateTime dueDate;

    private OffsetDateTime paidAt;

    @Schema(required = true, description = "number of payment attempts made so far")
    @NonNull
    private Integer paymentAttempts;

    private OffsetDateTime nextPaymentAttemptAt;

    private String lastPaymentError;

    @Schema(required = true)
    @NonNull
    private List<LineItem> lineItems;

    @NonNull
    public static InvoiceResponse from(@NonNull Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .kind(invoice.getKind().name())
            .status(invoice.getStatus().name())
            .currency(invoice.getCurrency())
            .subtotal(invoice.getSubtotal())
            .discountAmount(invoice.getDiscountAmount())
            .taxAmount(invoice.getTaxAmount())
            .total(invoice.getTotal())
            .amountPaid(invoice.getAmountPaid())
            .amountDue(invoice.getAmountDue())
            .periodStart(invoice.getPeriodStart())
            .periodEnd(invoice.getPeriodEnd())
            .dueDate(invoice.getDueDate())
            .paidAt(invoice.getPaidAt())
            .paymentAttempts(invoice.getPaymentAttempts())
            .nextPaymentAttemptAt(invoice.getNextPaymentAttemptAt())
            .lastPaymentError(invoice.getLastPaymentError())
            .lineItems(invoice.getLineItems().stream()
                .map(l -> LineItem.builder()
                    .description(l.getDescription())
                    .quantity(l.getQuantity())
                    .unitPrice(l.getUnitPrice())
                    .amount(l.getAmount())
                    .kind(l.getKind().name())
                    .build())
                .toList())
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "InvoiceLineItem")
    public static class LineItem {

        @NonNull
        private String description;

        @NonNull
        private BigDecimal quantity;

        @NonNull
        private BigDecimal unitPrice;

        @NonNull
        private BigDecimal amount;

        @Schema(required = true, allowableValues = {"SUBSCRIPTION", "SETUP_FEE", "PRORATION", "OVERAGE"})
        @NonNull
        private String kind;
    }
}

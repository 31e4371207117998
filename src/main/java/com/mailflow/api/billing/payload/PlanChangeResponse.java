package com.mailflow.api.billing.payload;

import com.mailflow.api.subscription.models.PlanChangeResult;
import com.mailflow.api.subscription.payload.InvoiceResponse;
import com.mailflow.api.subscription.payload.SubscriptionResponse;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "PlanChange")
public class PlanChangeResponse {

    @Schema(required = true, description = "the subscription after the plan change")
    @NonNull
    private SubscriptionResponse subscription;

    @Schema(required = true, description = "signed proration amount. negative amounts are credits towards the next invoice.")
    @NonNull
    private BigDecimal prorationAmount;

    @Schema(description = "the proration invoice, if the proration was charged immediately")
    private InvoiceResponse prorationInvoice;

    @NonNull
    public static PlanChangeResponse from(@NonNull PlanChangeResult result) {
        return PlanChangeResponse.builder()
            .subscription(SubscriptionResponse.from(result.getSubscription()))
            .prorationAmount(result.getProrationAmount())
            .prorationInvoice(result.getProrationInvoice() == null ? null : InvoiceResponse.from(result.getProrationInvoice()))
            .build();
    }
}

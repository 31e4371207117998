package com.mailflow.api.subscription.payload;

import com.mailflow.api.subscription.entities.SubscriptionPlan;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "SubscriptionPlan")
public class SubscriptionPlanResponse {

    @Schema(required = true, description = "id of the subscription plan")
    @NonNull
    private Long id;

    @Schema(required = true, description = "display name of the plan")
    @NonNull
    private String name;

    @Schema(required = true, description = "price charged per billing cycle")
    @NonNull
    private BigDecimal price;

    @Schema(required = true, description = "ISO 4217 currency code of the price")
    @NonNull
    private String currency;

    @Schema(required = true, allowableValues = {"WEEKLY", "MONTHLY", "YEARLY"})
    @NonNull
    private String billingCycle;

    @Schema(required = true, description = "number of free trial days for new subscriptions")
    @NonNull
    private Integer trialDays;

    @Schema(required = true, description = "one-time fee billed on the first invoice")
    @NonNull
    private BigDecimal setupFee;

    @Schema(required = true)
    @NonNull
    private Map<String, String> features;

    @Schema(required = true, description = "per-period usage limits keyed by resource type. resources " +
        "without an entry are unlimited.")
    @NonNull
    private Map<String, Long> quotas;

    @NonNull
    public static SubscriptionPlanResponse from(@NonNull SubscriptionPlan plan) {
        return SubscriptionPlanResponse.builder()
            .id(plan.getId())
            .name(plan.getName())
            .price(plan.getPrice())
            .currency(plan.getCurrency())
            .billingCycle(plan.getBillingCycle().name())
            .trialDays(plan.getTrialDays())
            .setupFee(plan.getSetupFee())
            .features(Map.copyOf(plan.getFeatures()))
            .quotas(Map.copyOf(plan.getQuotas()))
            .build();
    }
}

package com.mailflow.api.subscription.payload;

import com.mailflow.api.subscription.entities.Subscription;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "Subscription")
public class SubscriptionResponse {

    @Schema(required = true, description = "id of the subscription")
    @NonNull
    private Long id;

    @Schema(required = true)
    @NonNull
    private String tenantId;

    @Schema(required = true, description = "plan associated with this subscription")
    @NonNull
    private SubscriptionPlanResponse plan;

    @Schema(required = true, allowableValues = {"TRIALING", "ACTIVE", "PAST_DUE", "CANCELLED"})
    @NonNull
    private String status;

    @Schema(required = true, description = "start of the current billing period (inclusive)")
    @NonNull
    private OffsetDateTime currentPeriodStart;

    @Schema(required = true, description = "end of the current billing period (exclusive)")
    @NonNull
    private OffsetDateTime currentPeriodEnd;

    @Schema(description = "when the trial ends. only present for subscriptions that started with a trial.")
    private OffsetDateTime trialEnd;

    @Schema(required = true, description = "whether the subscription ends at a future billing period boundary")
    @NonNull
    private Boolean cancelAtPeriodEnd;

    private OffsetDateTime cancelAt;

    private OffsetDateTime cancelledAt;

    @Schema(description = "id of the plan that replaces the current plan at a future period boundary")
    private Long pendingPlanId;

    private OffsetDateTime pendingPlanEffectiveAt;

    @Schema(required = true, description = "signed proration amount that the next invoice settles")
    @NonNull
    private BigDecimal deferredProration;

    @NonNull
    public static SubscriptionResponse from(@NonNull Subscription subscription) {
        return SubscriptionResponse.builder()
            .id(subscription.getId())
            .tenantId(subscription.getTenantId())
            .plan(SubscriptionPlanResponse.from(subscription.getPlan()))
            .status(subscription.getStatus().name())
            .currentPeriodStart(subscription.getCurrentPeriodStart())
            .currentPeriodEnd(subscription.getCurrentPeriodEnd())
            .trialEnd(subscription.getTrialEnd())
            .cancelAtPeriodEnd(subscription.isCancelAtPeriodEnd())
            .cancelAt(subscription.getCancelAt())
            .cancelledAt(subscription.getCancelledAt())
            .pendingPlanId(subscription.getPendingPlan() == null ? null : subscription.getPendingPlan().getId())
            .pendingPlanEffectiveAt(subscription.getPendingPlanEffectiveAt())
            .deferredProration(subscription.getDeferredProration())
            .build();
    }
}

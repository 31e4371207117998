package com.mailflow.api.subscription.entities;

import com.mailflow.api.payment.models.PaymentProviderType;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * A data access object that maps to the {@code subscription} table in the database. A tenant has
 * at most one subscription that isn't {@link Status#CANCELLED cancelled}, and plan changes update
 * that subscription in place.
 */
@Entity
@Table(indexes = {
    @Index(name = "subscription_tenant_id_idx", columnList = "tenantId"),
    @Index(name = "subscription_current_period_end_idx", columnList = "currentPeriodEnd"),
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Version
    private long version;

    @NonNull
    @Column(updatable = false)
    private String tenantId;

    @NonNull
    @ManyToOne(optional = false, fetch = FetchType.EAGER)
    private SubscriptionPlan plan;

    @NonNull
    @Enumerated(EnumType.STRING)
    private Status status;

    /**
     * Period boundaries are {@code billingAnchor + n} billing cycles, so they never drift.
     */
    @NonNull
    private OffsetDateTime billingAnchor;

    /**
     * Index of the current period relative to {@link #billingAnchor}.
     */
    private int periodIndex;

    @NonNull
    private OffsetDateTime currentPeriodStart;

    @NonNull
    private OffsetDateTime currentPeriodEnd;

    /**
     * The plan price that the current period is billed at. Upgrades in the middle of the period
     * don't change it; their difference is billed as proration.
     */
    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal periodPrice;

    private OffsetDateTime trialEnd;

    private boolean cancelAtPeriodEnd;

    private OffsetDateTime cancelAt;

    private OffsetDateTime cancelledAt;

    /**
     * Provider assigned customer id of the tenant.
     */
    @NonNull
    private String customerRef;

    private String paymentMethodRef;

    @NonNull
    @Enumerated(EnumType.STRING)
    private PaymentProviderType providerType;

    /**
     * Provider assigned id of a mirrored provider side subscription, if any.
     */
    private String providerSubscriptionRef;

    /**
     * Plan that replaces {@link #plan} at the first period boundary at or after {@link
     * #pendingPlanEffectiveAt}.
     */
    @ManyToOne(fetch = FetchType.EAGER)
    private SubscriptionPlan pendingPlan;

    private OffsetDateTime pendingPlanEffectiveAt;

    /**
     * Credit that scheduling {@link #pendingPlan} added to {@link #deferredProration}. It is taken
     * back if the pending plan change is withdrawn.
     */
    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal pendingPlanCredit = BigDecimal.ZERO;

    /**
     * Signed proration amount that the next cycle invoice settles.
     */
    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal deferredProration = BigDecimal.ZERO;

    private boolean setupFeeInvoiced;

    private String discountRef;

    /**
     * Tax rate as a fraction, e.g. {@code 0.18}. If {@literal null}, the configured default rate
     * applies.
     */
    @Column(precision = 9, scale = 6)
    private BigDecimal taxRate;

    @Embedded
    private BillingAddress billingAddress;

    /**
     * @return whether the subscription is in its trial at the given instant.
     */
    public boolean isTrialingAt(@NonNull OffsetDateTime instant) {
        return status == Status.TRIALING && trialEnd != null && trialEnd.isAfter(instant);
    }

    /**
     * Moves the subscription to the given status. Transitions to the current status are no-ops.
     *
     * @throws IllegalStateException if the state machine doesn't allow the transition.
     */
    public void transitionTo(@NonNull Status target) {
        if (status == target) {
            return;
        }

        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format("subscription %d can't transition from %s to %s", id, status, target));
        }

        status = target;
    }

    public enum Status {
        TRIALING,
        ACTIVE,
        PAST_DUE,
        CANCELLED;

        private Set<Status> successors() {
            switch (this) {
                case TRIALING:
                    return EnumSet.of(ACTIVE, CANCELLED);
                case ACTIVE:
                    return EnumSet.of(PAST_DUE, CANCELLED);
                case PAST_DUE:
                    return EnumSet.of(ACTIVE, CANCELLED);
                default:
                    return EnumSet.noneOf(Status.class);
            }
        }

        public boolean canTransitionTo(@NonNull Status target) {
            return successors().contains(target);
        }
    }
}

package com.mailflow.api.subscription.entities;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A data access object that maps to the {@code subscription_plan} table in the database. Plans
 * are immutable; changing a plan's terms means creating a new plan.
 */
@Entity
@Immutable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @NonNull
    @Column(updatable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @NonNull
    private String name;

    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal price;

    @NonNull
    @Column(length = 3)
    private String currency;

    @NonNull
    @Enumerated(EnumType.STRING)
    private BillingCycle billingCycle;

    private int trialDays;

    @NonNull
    @Column(precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal setupFee = BigDecimal.ZERO;

    @Builder.Default
    private boolean active = true;

    @NonNull
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_plan_feature", joinColumns = @JoinColumn(name = "plan_id"))
    @MapKeyColumn(name = "feature_name")
    @Column(name = "feature_value")
    @Builder.Default
    private Map<String, String> features = new HashMap<>();

    /**
     * Per-period usage limits keyed by resource type, e.g. {@code emails -> 10000}. Resources
     * without an entry are unlimited.
     */
    @NonNull
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_plan_quota", joinColumns = @JoinColumn(name = "plan_id"))
    @MapKeyColumn(name = "resource_type")
    @Column(name = "quota_limit")
    @Builder.Default
    private Map<String, Long> quotas = new HashMap<>();

    public enum BillingCycle {
        WEEKLY,
        MONTHLY,
        YEARLY;

        /**
         * Computes the boundary that lies {@code periods} billing cycles after {@code anchor}.
         * Boundaries are always derived from the anchor, so a subscription anchored on the 31st
         * bills on the last day of shorter months and returns to the 31st afterwards.
         */
        @NonNull
        public OffsetDateTime advance(@NonNull OffsetDateTime anchor, long periods) {
            switch (this) {
                case WEEKLY:
                    return anchor.plusWeeks(periods);
                case MONTHLY:
                    return anchor.plusMonths(periods);
                default:
                    return anchor.plusYears(periods);
            }
        }
    }
}

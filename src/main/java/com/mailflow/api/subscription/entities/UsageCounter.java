package com.mailflow.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * A data access object that maps to the {@code usage_counter} table in the database. It counts a
 * subscription's consumption of one resource in the current billing period.
 */
@Entity
@Table(uniqueConstraints = @UniqueConstraint(
    name = "usage_counter_subscription_resource_key",
    columnNames = {"subscriptionId", "resourceType"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private long id;

    @Column(updatable = false)
    private long subscriptionId;

    @NonNull
    @Column(updatable = false)
    private String resourceType;

    private long used;

    /**
     * Units beyond the quota that an out-of-cycle overage invoice has already billed in the
     * current period.
     */
    private long billedOverage;
}

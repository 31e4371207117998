package com.mailflow.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link UsageCounter} entity.
 */
@Repository
public interface UsageCounterRepository extends CrudRepository<UsageCounter, Long> {

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from UsageCounter e where e.subscriptionId = ?1 and e.resourceType = ?2")
    Optional<UsageCounter> findBySubscriptionIdAndResourceType(long subscriptionId, @NonNull String resourceType);

    /**
     * @return a guaranteed to be not {@literal null} list of counters of the subscription.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from UsageCounter e where e.subscriptionId = ?1 order by e.resourceType")
    List<UsageCounter> findAllBySubscriptionId(long subscriptionId);

    /**
     * Atomically adds {@code amount} to a counter.
     *
     * @return the number of updated rows, {@code 0} if the counter doesn't exist.
     */
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update UsageCounter e set e.used = e.used + ?3 where e.subscriptionId = ?1 and e.resourceType = ?2")
    int increment(long subscriptionId, @NonNull String resourceType, long amount);

    /**
     * Atomically records {@code units} of overage as billed.
     */
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update UsageCounter e set e.billedOverage = e.billedOverage + ?3 where e.subscriptionId = ?1 and e.resourceType = ?2")
    int addBilledOverage(long subscriptionId, @NonNull String resourceType, long units);

    /**
     * Zeroes all counters of the subscription.
     */
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update UsageCounter e set e.used = 0, e.billedOverage = 0 where e.subscriptionId = ?1")
    int resetAll(long subscriptionId);

    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update UsageCounter e set e.used = 0, e.billedOverage = 0 where e.subscriptionId = ?1 and e.resourceType = ?2")
    int reset(long subscriptionId, @NonNull String resourceType);

    /**
     * Atomically subtracts the {@code closedUsage} billed with a closed period from a counter and
     * clears its billed overage. Usage recorded after the closed period was read stays on the
     * counter.
     *
     * @return the number of updated rows, {@code 0} if the counter doesn't exist.
     */
    @Modifying(flushAutomatically = true)
    @Transactional
    @Query("update UsageCounter e set e.used = e.used - ?3, e.billedOverage = 0 where e.subscriptionId = ?1 and e.resourceType = ?2")
    int rollOver(long subscriptionId, @NonNull String resourceType, long closedUsage);
}

package com.mailflow.api.subscription.entities;

import jakarta.persistence.LockModeType;
import lombok.NonNull;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Subscription} entity.
 */
@Repository
public interface SubscriptionRepository extends CrudRepository<Subscription, Long> {

    /**
     * Finds the subscription of a tenant that isn't {@link Subscription.Status#CANCELLED
     * cancelled}.
     *
     * @param tenantId a not {@literal null} tenant id.
     * @return a not {@literal null} {@link Optional} of the {@link Subscription}.
     */
    @NonNull
    default Optional<Subscription> findCurrentByTenantId(@NonNull String tenantId) {
        return findByTenantIdAndStatusNot(tenantId, Subscription.Status.CANCELLED);
    }

    default boolean existsCurrentByTenantId(@NonNull String tenantId) {
        return existsByTenantIdAndStatusNot(tenantId, Subscription.Status.CANCELLED);
    }

    /**
     * Same as {@link #findCurrentByTenantId(String)}, but acquires a write lock on the row until
     * the surrounding transaction ends.
     */
    @NonNull
    default Optional<Subscription> lockCurrentByTenantId(@NonNull String tenantId) {
        return lockByTenantIdAndStatusNot(tenantId, Subscription.Status.CANCELLED);
    }

    /**
     * Lists subscriptions that aren't cancelled and whose current period ended at or before the
     * given instant, most overdue first.
     *
     * @param now a not {@literal null} timestamp.
     * @return a guaranteed to be not {@literal null} list of subscription ids.
     */
    @NonNull
    default List<Long> findAllDueIds(@NonNull OffsetDateTime now) {
        return findAllIdsWithPeriodEndedBy(now, Subscription.Status.CANCELLED);
    }

    /**
     * @return a guaranteed to be not {@literal null} list of tenant ids whose subscriptions are
     * active or past due.
     */
    @NonNull
    default List<String> findAllBillableTenantIds() {
        return findAllTenantIdsByStatusIn(List.of(Subscription.Status.ACTIVE, Subscription.Status.PAST_DUE));
    }

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.tenantId = ?1 and e.status <> ?2")
    Optional<Subscription> findByTenantIdAndStatusNot(@NonNull String tenantId, @NonNull Subscription.Status status);

    @Transactional(readOnly = true)
    @Query("select case when count(e) > 0 then true else false end from Subscription e where e.tenantId = ?1 and e.status <> ?2")
    boolean existsByTenantIdAndStatusNot(@NonNull String tenantId, @NonNull Subscription.Status status);

    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query("select e from Subscription e where e.tenantId = ?1 and e.status <> ?2")
    Optional<Subscription> lockByTenantIdAndStatusNot(@NonNull String tenantId, @NonNull Subscription.Status status);

    /**
     * Finds a subscription by its id and acquires a write lock on its row until the surrounding
     * transaction ends.
     */
    @NonNull
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Transactional(propagation = Propagation.MANDATORY)
    @Query("select e from Subscription e where e.id = ?1")
    Optional<Subscription> lockById(long id);

    /**
     * @param providerSubscriptionRef a not {@literal null} provider assigned subscription id.
     * @return a not {@literal null} {@link Optional} of the {@link Subscription}.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Subscription e where e.providerSubscriptionRef = ?1")
    Optional<Subscription> findByProviderSubscriptionRef(@NonNull String providerSubscriptionRef);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Subscription e where e.currentPeriodEnd <= ?1 and e.status <> ?2 order by e.currentPeriodEnd, e.id")
    List<Long> findAllIdsWithPeriodEndedBy(@NonNull OffsetDateTime now, @NonNull Subscription.Status excludedStatus);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.tenantId from Subscription e where e.status in ?1 order by e.tenantId")
    List<String> findAllTenantIdsByStatusIn(@NonNull List<Subscription.Status> statuses);
}

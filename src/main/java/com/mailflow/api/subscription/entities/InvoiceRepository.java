package com.mailflow.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link Invoice} entity.
 */
@Repository
public interface InvoiceRepository extends CrudRepository<Invoice, Long> {

    /**
     * Finds the invoice of the given kind that a subscription was issued for the given period.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.subscription.id = ?1 and e.kind = ?2 and e.periodStart = ?3 and e.periodEnd = ?4")
    Optional<Invoice> findBySubscriptionIdAndKindAndPeriod(
        long subscriptionId,
        @NonNull Invoice.Kind kind,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd);

    /**
     * @return the highest invoice sequence number issued to the tenant, or {@code 0} if it has no
     * invoices.
     */
    @Transactional(readOnly = true)
    @Query("select coalesce(max(e.sequenceNumber), 0) from Invoice e where e.tenantId = ?1")
    long findMaxSequenceNumberByTenantId(@NonNull String tenantId);

    /**
     * Lists open invoices whose next automatic payment attempt is due at the given instant,
     * earliest first.
     *
     * @return a guaranteed to be not {@literal null} list of invoice ids.
     */
    @NonNull
    default List<Long> findAllIdsDueForPaymentAttempt(@NonNull OffsetDateTime now) {
        return findAllIdsByStatusAndNextPaymentAttemptBy(Invoice.Status.OPEN, now);
    }

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from Invoice e where e.status = ?1 and e.nextPaymentAttemptAt <= ?2 order by e.nextPaymentAttemptAt, e.id")
    List<Long> findAllIdsByStatusAndNextPaymentAttemptBy(@NonNull Invoice.Status status, @NonNull OffsetDateTime now);

    /**
     * @return a guaranteed to be not {@literal null} list of invoices created for the tenant in
     * {@code [start, end)}, oldest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.tenantId = ?1 and e.createdAt >= ?2 and e.createdAt < ?3 order by e.createdAt, e.id")
    List<Invoice> findAllByTenantIdCreatedBetween(
        @NonNull String tenantId,
        @NonNull OffsetDateTime start,
        @NonNull OffsetDateTime end);

    /**
     * @return a guaranteed to be not {@literal null} list of open invoices of the subscription,
     * oldest first.
     */
    @NonNull
    default List<Invoice> findAllOpenBySubscriptionId(long subscriptionId) {
        return findAllBySubscriptionIdAndStatus(subscriptionId, Invoice.Status.OPEN);
    }

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.subscription.id = ?1 and e.status = ?2 order by e.createdAt, e.id")
    List<Invoice> findAllBySubscriptionIdAndStatus(long subscriptionId, @NonNull Invoice.Status status);

    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from Invoice e where e.providerReference = ?1")
    Optional<Invoice> findByProviderReference(@NonNull String providerReference);
}

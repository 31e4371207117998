package com.mailflow.api.subscription.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link SubscriptionPlan}
 * entity.
 */
@Repository
public interface SubscriptionPlanRepository extends CrudRepository<SubscriptionPlan, Long> {

    /**
     * @param id id of the plan.
     * @return the plan with the given id, if it exists and is still offered.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from SubscriptionPlan e where e.id = ?1 and e.active = true")
    Optional<SubscriptionPlan> findActiveById(long id);

    /**
     * @return a guaranteed to be not {@literal null} list of plans that are offered to tenants,
     * cheapest first.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e from SubscriptionPlan e where e.active = true order by e.price, e.id")
    List<SubscriptionPlan> findAllActive();
}

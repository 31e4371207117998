package com.mailflow.api.subscription.entities;

import jakarta.persistence.EntityManager;
import lombok.val;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@Transactional
public class UsageCounterRepositoryTest {

    private static final long SUBSCRIPTION_ID = 9_001L;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private UsageCounterRepository usageCounterRepository;

    @Test
    void increment() {
        assertEquals(0, usageCounterRepository.increment(SUBSCRIPTION_ID, "emails", 10));

        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("emails").build());
        assertEquals(1, usageCounterRepository.increment(SUBSCRIPTION_ID, "emails", 10));
        assertEquals(1, usageCounterRepository.increment(SUBSCRIPTION_ID, "emails", 5));
        entityManager.clear();

        val counter = usageCounterRepository.findBySubscriptionIdAndResourceType(SUBSCRIPTION_ID, "emails").orElseThrow();
        assertEquals(15, counter.getUsed());
    }

    @Test
    void resetAll() {
        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("emails").used(12_000).build());
        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("contacts").used(300).build());
        usageCounterRepository.addBilledOverage(SUBSCRIPTION_ID, "emails", 2_000);

        assertEquals(2, usageCounterRepository.resetAll(SUBSCRIPTION_ID));
        entityManager.clear();
        usageCounterRepository.findAllBySubscriptionId(SUBSCRIPTION_ID).forEach(c -> {
            assertEquals(0, c.getUsed());
            assertEquals(0, c.getBilledOverage());
        });
    }

    @Test
    void reset() {
        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("emails").used(12_000).build());
        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("contacts").used(300).build());

        assertEquals(1, usageCounterRepository.reset(SUBSCRIPTION_ID, "contacts"));
        entityManager.clear();

        val counters = usageCounterRepository.findAllBySubscriptionId(SUBSCRIPTION_ID);
        assertEquals(2, counters.size());
        assertEquals("contacts", counters.get(0).getResourceType());
        assertEquals(0, counters.get(0).getUsed());
        assertEquals(12_000, counters.get(1).getUsed());
    }

    @Test
    void rollOver() {
        usageCounterRepository.save(UsageCounter.builder().subscriptionId(SUBSCRIPTION_ID).resourceType("emails").used(10_400).build());
        usageCounterRepository.addBilledOverage(SUBSCRIPTION_ID, "emails", 200);
        entityManager.clear();

        // usage recorded between reading the closed period and rolling it over.
        val closed = usageCounterRepository.findBySubscriptionIdAndResourceType(SUBSCRIPTION_ID, "emails").orElseThrow().getUsed();
        assertEquals(1, usageCounterRepository.increment(SUBSCRIPTION_ID, "emails", 5));

        assertEquals(1, usageCounterRepository.rollOver(SUBSCRIPTION_ID, "emails", closed));
        assertEquals(0, usageCounterRepository.rollOver(SUBSCRIPTION_ID, "contacts", 0));
        entityManager.clear();

        val counter = usageCounterRepository.findBySubscriptionIdAndResourceType(SUBSCRIPTION_ID, "emails").orElseThrow();
        assertEquals(5, counter.getUsed());
        assertEquals(0, counter.getBilledOverage());
    }
}

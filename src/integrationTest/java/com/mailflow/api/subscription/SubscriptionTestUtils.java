package com.mailflow.api.subscription;

import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.Subscription;
import com.mailflow.api.subscription.entities.SubscriptionPlan;
import jakarta.persistence.EntityManager;
import lombok.NonNull;
import lombok.val;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;

public class SubscriptionTestUtils {

    @NonNull
    public static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    @NonNull
    public static SubscriptionPlan buildSubscriptionPlan(@NonNull String name, @NonNull String price, @NonNull Map<String, Long> quotas) {
        return SubscriptionPlan.builder()
            .name(name)
            .price(new BigDecimal(price))
            .currency("USD")
            .billingCycle(SubscriptionPlan.BillingCycle.MONTHLY)
            .quotas(new HashMap<>(quotas))
            .build();
    }

    @NonNull
    public static SubscriptionPlan buildSubscriptionPlan(
        @NonNull EntityManager entityManager,
        @NonNull String name,
        @NonNull String price,
        @NonNull Map<String, Long> quotas
    ) {
        return entityManager.merge(buildSubscriptionPlan(name, price, quotas));
    }

    /**
     * Builds a monthly subscription whose first billing period starts at {@code periodStart}.
     */
    @NonNull
    public static Subscription buildSubscription(
        @NonNull String tenantId,
        @NonNull SubscriptionPlan plan,
        @NonNull Subscription.Status status,
        @NonNull OffsetDateTime periodStart
    ) {
        return Subscription.builder()
            .createdAt(periodStart)
            .tenantId(tenantId)
            .plan(plan)
            .status(status)
            .billingAnchor(periodStart)
            .periodIndex(0)
            .currentPeriodStart(periodStart)
            .currentPeriodEnd(plan.getBillingCycle().advance(periodStart, 1))
            .periodPrice(plan.getPrice())
            .customerRef("cus_" + tenantId)
            .paymentMethodRef("pm_" + tenantId)
            .providerType(PaymentProviderType.STRIPE)
            .build();
    }

    @NonNull
    public static Subscription buildSubscription(
        @NonNull EntityManager entityManager,
        @NonNull String tenantId,
        @NonNull SubscriptionPlan plan,
        @NonNull Subscription.Status status,
        @NonNull OffsetDateTime periodStart
    ) {
        return entityManager.merge(buildSubscription(tenantId, plan, status, periodStart));
    }

    @NonNull
    public static Invoice buildInvoice(
        @NonNull EntityManager entityManager,
        @NonNull Subscription subscription,
        long sequenceNumber,
        @NonNull Invoice.Status status,
        @NonNull String total,
        OffsetDateTime nextPaymentAttemptAt
    ) {
        val invoice = Invoice.builder()
            .createdAt(now())
            .tenantId(subscription.getTenantId())
            .subscription(subscription)
            .kind(Invoice.Kind.CYCLE)
            .sequenceNumber(sequenceNumber)
            .invoiceNumber(String.format("TEST-%s-%06d", subscription.getTenantId(), sequenceNumber))
            .status(status)
            .currency("USD")
            .subtotal(new BigDecimal(total))
            .total(new BigDecimal(total))
            .amountPaid(status == Invoice.Status.PAID ? new BigDecimal(total) : BigDecimal.ZERO)
            .dueDate(now().plusDays(14))
            .periodStart(subscription.getCurrentPeriodStart().minusMonths(sequenceNumber))
            .periodEnd(subscription.getCurrentPeriodStart().minusMonths(sequenceNumber - 1))
            .nextPaymentAttemptAt(nextPaymentAttemptAt)
            .build();

        return entityManager.merge(invoice);
    }
}

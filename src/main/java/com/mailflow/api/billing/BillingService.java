package com.mailflow.api.billing;

import com.mailflow.api.billing.exceptions.InvoiceNotPayableException;
import com.mailflow.api.billing.exceptions.WebhookSignatureException;
import com.mailflow.api.billing.models.BillingPassSummary;
import com.mailflow.api.billing.models.BillingReport;
import com.mailflow.api.billing.models.ProviderEvent;
import com.mailflow.api.contracts.NotificationServiceContract;
import com.mailflow.api.contracts.NotificationServiceContract.BillingNotification;
import com.mailflow.api.contracts.NotificationServiceContract.NotificationType;
import com.mailflow.api.payment.PaymentDispatcher;
import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.models.PaymentResult;
import com.mailflow.api.platform.Money;
import com.mailflow.api.subscription.SubscriptionService;
import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.InvoiceLineItem;
import com.mailflow.api.subscription.entities.Subscription;
import com.mailflow.api.subscription.exceptions.InvoiceNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionStateException;
import com.mailflow.api.subscription.models.PeriodCloseResult;
import com.mailflow.api.subscription.models.PlanChangeResult;
import com.mailflow.api.subscription.models.ProrationBehavior;
import com.mailflow.api.subscription.payload.InvoiceResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BillingService} settles the invoices that {@link SubscriptionService} builds. It charges
 * them through the {@link PaymentDispatcher}, runs billing passes over elapsed billing periods and
 * due payment retries, and applies payment provider webhook events.
 */
@Service
@Slf4j
class BillingService {

    static final String INVOICE_ID_METADATA_KEY = "invoiceId";
    static final String TENANT_ID_METADATA_KEY = "tenantId";

    private final SubscriptionService subscriptionService;
    private final PaymentDispatcher paymentDispatcher;
    private final NotificationServiceContract notificationService;
    private final BillingConfiguration billingConfig;

    @Autowired
    BillingService(
        @NonNull SubscriptionService subscriptionService,
        @NonNull PaymentDispatcher paymentDispatcher,
        @NonNull NotificationServiceContract notificationService,
        @NonNull BillingConfiguration billingConfig
    ) {
        this.subscriptionService = subscriptionService;
        this.paymentDispatcher = paymentDispatcher;
        this.notificationService = notificationService;
        this.billingConfig = billingConfig;
    }

    /**
     * <p>
     * Charges the amount due on an open invoice through the subscription's payment provider.</p>
     *
     * <p>
     * On success, the invoice is paid and a past due subscription becomes active. On failure, the
     * invoice stays open with a retry scheduled, or fails for good once retries run out, and an
     * active subscription becomes past due. The tenant is notified either way.</p>
     *
     * @return the invoice after the attempt.
     * @throws InvoiceNotPayableException if the invoice isn't open or has nothing due.
     */
    @NonNull
    Invoice processInvoicePayment(@NonNull Invoice invoice, @NonNull Subscription subscription) throws InvoiceNotPayableException {
        if (!invoice.isPayable()) {
            throw new InvoiceNotPayableException(String.format("invoice %s is %s with %s due",
                invoice.getInvoiceNumber(), invoice.getStatus(), invoice.getAmountDue()));
        }

        return charge(invoice, subscription);
    }

    /**
     * Same as {@link #processInvoicePayment(Invoice, Subscription)}, but loads the invoice first.
     *
     * @throws InvoiceNotFoundException   if the invoice doesn't exist.
     * @throws InvoiceNotPayableException if the invoice isn't open or has nothing due.
     */
    @NonNull
    Invoice processInvoicePayment(long invoiceId) throws InvoiceNotFoundException, InvoiceNotPayableException {
        val invoice = subscriptionService.getInvoice(invoiceId);
        return processInvoicePayment(invoice, invoice.getSubscription());
    }

    /**
     * Bills the tenant's unbilled usage beyond plan quotas on an out-of-cycle invoice and charges
     * it right away.
     *
     * @return the overage invoice after the payment attempt, or empty if there was nothing to
     * bill.
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    @NonNull
    Optional<Invoice> processOverageBilling(@NonNull String tenantId) throws SubscriptionNotFoundException {
        val invoice = subscriptionService.createOverageInvoice(tenantId);
        if (invoice.isEmpty()) {
            return invoice;
        }

        notifyInvoiceGenerated(invoice.get());
        return Optional.of(chargeIfPayable(invoice.get()));
    }

    /**
     * Aggregates the tenant's invoices created in {@code [start, end)}.
     */
    @NonNull
    BillingReport generateBillingReport(@NonNull String tenantId, @NonNull OffsetDateTime start, @NonNull OffsetDateTime end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("report range must end after it starts");
        }

        val invoices = subscriptionService.listInvoices(tenantId, start, end);
        BigDecimal billed = BigDecimal.ZERO;
        BigDecimal collected = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        BigDecimal overage = BigDecimal.ZERO;
        int paid = 0;
        int failed = 0;
        for (val invoice : invoices) {
            collected = collected.add(invoice.getAmountPaid());
            switch (invoice.getStatus()) {
                case PAID:
                    paid++;
                    break;
                case OPEN:
                    outstanding = outstanding.add(invoice.getAmountDue());
                    break;
                case PAYMENT_FAILED:
                    outstanding = outstanding.add(invoice.getAmountDue());
                    failed++;
                    break;
                case VOID:
                    failed++;
                    continue;
            }

            billed = billed.add(invoice.getTotal());
            overage = overage.add(invoice.getLineItems().stream()
                .filter(l -> l.getKind() == InvoiceLineItem.Kind.OVERAGE)
                .map(InvoiceLineItem::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        }

        val successRate = invoices.isEmpty()
            ? BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP)
            : BigDecimal.valueOf(paid * 100L).divide(BigDecimal.valueOf(invoices.size()), 2, RoundingMode.HALF_UP);

        return BillingReport.builder()
            .tenantId(tenantId)
            .start(start)
            .end(end)
            .invoicesGenerated(invoices.size())
            .totalBilled(billed)
            .totalCollected(collected)
            .totalOutstanding(outstanding)
            .overageCharges(overage)
            .failedPayments(failed)
            .paymentSuccessRate(successRate)
            .invoices(invoices.stream().map(InvoiceResponse::from).toList())
            .build();
    }

    /**
     * Upgrades the tenant's subscription and charges the immediate proration invoice, if the
     * upgrade created one.
     *
     * @see SubscriptionService#upgrade(String, long, ProrationBehavior)
     */
    @NonNull
    PlanChangeResult upgradeSubscription(
        @NonNull String tenantId,
        long planId,
        @NonNull ProrationBehavior prorationBehavior
    ) throws SubscriptionPlanNotFoundException, SubscriptionNotFoundException, SubscriptionStateException {
        val result = subscriptionService.upgrade(tenantId, planId, prorationBehavior);
        if (result.getProrationInvoice() != null) {
            notifyInvoiceGenerated(result.getProrationInvoice());
            result.setProrationInvoice(chargeIfPayable(result.getProrationInvoice()));
        }

        notifyPlanChanged(result, "upgraded to " + result.getSubscription().getPlan().getName());
        return result;
    }

    /**
     * @see SubscriptionService#downgrade(String, long, OffsetDateTime)
     */
    @NonNull
    PlanChangeResult downgradeSubscription(
        @NonNull String tenantId,
        long planId,
        OffsetDateTime downgradeAt
    ) throws SubscriptionPlanNotFoundException, SubscriptionNotFoundException, SubscriptionStateException {
        val result = subscriptionService.downgrade(tenantId, planId, downgradeAt);
        val pendingPlan = result.getSubscription().getPendingPlan();
        notifyPlanChanged(result, String.format("scheduled to move to %s at %s",
            pendingPlan == null ? "another plan" : pendingPlan.getName(), result.getSubscription().getPendingPlanEffectiveAt()));
        return result;
    }

    /**
     * Cancels the tenant's subscription, and the provider side subscription that mirrors it if
     * the cancellation is immediate.
     *
     * @see SubscriptionService#cancelSubscription(String, OffsetDateTime)
     */
    @NonNull
    Subscription cancelSubscription(@NonNull String tenantId, OffsetDateTime cancelAt) throws SubscriptionNotFoundException {
        val subscription = subscriptionService.cancelSubscription(tenantId, cancelAt);
        if (subscription.getStatus() == Subscription.Status.CANCELLED) {
            cancelProviderSubscription(subscription);
            notify(BillingNotification.builder()
                .type(NotificationType.SUBSCRIPTION_CANCELLED)
                .tenantId(subscription.getTenantId())
                .subscriptionId(subscription.getId())
                .build());
        }

        return subscription;
    }

    /**
     * <p>
     * Runs a billing pass.</p>
     *
     * <ol>
     *     <li>Retries payments of open invoices whose next attempt is due.</li>
     *     <li>Closes every elapsed billing period of subscriptions that aren't cancelled, oldest
     *     first, and charges each new invoice.</li>
     *     <li>Bills unbilled overage of all billable tenants, if configured.</li>
     * </ol>
     *
     * <p>
     * An invoice is charged at most once per pass. A failure with one subscription or invoice
     * doesn't stop the pass; it is logged and counted.</p>
     */
    @NonNull
    BillingPassSummary runBillingPass() {
        val summary = new BillingPassSummary();
        for (val invoiceId : subscriptionService.findInvoicesDueForPaymentAttempt()) {
            try {
                val invoice = subscriptionService.getInvoice(invoiceId);
                if (!invoice.isPayable()) {
                    continue;
                }

                summary.setRetriedInvoices(summary.getRetriedInvoices() + 1);
                count(summary, charge(invoice, invoice.getSubscription()));
            } catch (Exception e) {
                summary.setErrors(summary.getErrors() + 1);
                log.error("failed to retry payment of invoice {}", invoiceId, e);
            }
        }

        for (val subscriptionId : subscriptionService.findSubscriptionsWithElapsedPeriod()) {
            summary.setDueSubscriptions(summary.getDueSubscriptions() + 1);
            try {
                closeElapsedPeriods(subscriptionId, summary);
            } catch (Exception e) {
                summary.setErrors(summary.getErrors() + 1);
                log.error("failed to close billing periods of subscription {}", subscriptionId, e);
            }
        }

        if (billingConfig.isBillOverageOnEachPass()) {
            for (val tenantId : subscriptionService.findBillableTenantIds()) {
                try {
                    val invoice = processOverageBilling(tenantId);
                    if (invoice.isPresent()) {
                        summary.setOverageInvoicesCreated(summary.getOverageInvoicesCreated() + 1);
                        count(summary, invoice.get());
                    }
                } catch (Exception e) {
                    summary.setErrors(summary.getErrors() + 1);
                    log.error("failed to bill overage of tenant {}", tenantId, e);
                }
            }
        }

        log.info("billing pass finished: {}", summary);
        return summary;
    }

    /**
     * Verifies a webhook event's signature with the provider that sent it and applies the event.
     * Events that refer to unknown invoices or subscriptions are logged and ignored.
     *
     * @throws WebhookSignatureException if the signature doesn't match the raw payload.
     */
    void handleWebhookEvent(
        @NonNull PaymentProviderType provider,
        @NonNull String rawPayload,
        String signature,
        @NonNull ProviderEvent event
    ) throws WebhookSignatureException {
        if (!paymentDispatcher.validateWebhook(rawPayload, signature, provider)) {
            throw new WebhookSignatureException("invalid " + provider + " webhook signature");
        }

        log.debug("applying {} webhook event {} of kind {}", provider, event.getEventId(), event.getKind());
        switch (event.getKind()) {
            case PAYMENT_SUCCEEDED:
            case INVOICE_PAYMENT_SUCCEEDED:
                if (event.getInvoiceId() == null) {
                    log.info("ignoring {} event {} without an invoice reference", event.getKind(), event.getEventId());
                    break;
                }

                applyProviderPaymentSuccess(provider, event);
                break;
            case PAYMENT_FAILED:
            case INVOICE_PAYMENT_FAILED:
                if (event.getInvoiceId() != null) {
                    recordProviderPaymentFailure(event);
                }

                if (event.getKind() == ProviderEvent.Kind.INVOICE_PAYMENT_FAILED && event.getProviderSubscriptionRef() != null) {
                    subscriptionService.markPastDueByProviderRef(event.getProviderSubscriptionRef());
                }

                break;
            case SUBSCRIPTION_CREATED:
                linkProviderSubscription(event);
                break;
            case SUBSCRIPTION_UPDATED:
                applyProviderSubscriptionStatus(event);
                break;
            case SUBSCRIPTION_CANCELLED:
                if (event.getProviderSubscriptionRef() != null) {
                    subscriptionService.cancelByProviderRef(event.getProviderSubscriptionRef())
                        .ifPresent(this::notifyCancelled);
                }

                break;
        }
    }

    private void closeElapsedPeriods(long subscriptionId, @NonNull BillingPassSummary summary) throws SubscriptionNotFoundException {
        PeriodCloseResult result;
        do {
            result = closeElapsedPeriod(subscriptionId);
            if (result.isNothingDue()) {
                return;
            }

            summary.setClosedPeriods(summary.getClosedPeriods() + 1);
            val invoice = result.getInvoice();
            if (invoice != null && !result.isInvoiceExisted()) {
                summary.setInvoicesCreated(summary.getInvoicesCreated() + 1);
                notifyInvoiceGenerated(invoice);
                if (invoice.isPayable()) {
                    count(summary, charge(invoice, result.getSubscription()));
                }
            }

            if (result.isCancelled()) {
                summary.setSubscriptionsCancelled(summary.getSubscriptionsCancelled() + 1);
                cancelProviderSubscription(result.getSubscription());
                notifyCancelled(result.getSubscription());
            }
        } while (result.isMoreDue());
    }

    @NonNull
    private PeriodCloseResult closeElapsedPeriod(long subscriptionId) throws SubscriptionNotFoundException {
        try {
            return subscriptionService.closeElapsedPeriod(subscriptionId);
        } catch (DataIntegrityViolationException e) {
            // the period's invoice was created concurrently; closing again reads it.
            log.warn("invoice of subscription {} was created concurrently, retrying", subscriptionId);
            return subscriptionService.closeElapsedPeriod(subscriptionId);
        }
    }

    @NonNull
    private Invoice chargeIfPayable(@NonNull Invoice invoice) {
        return invoice.isPayable() ? charge(invoice, invoice.getSubscription()) : invoice;
    }

    @NonNull
    private Invoice charge(@NonNull Invoice invoice, @NonNull Subscription subscription) {
        val attempt = invoice.getPaymentAttempts() + 1;
        val request = PaymentRequest.builder()
            .amount(invoice.getAmountDue())
            .currency(invoice.getCurrency())
            .customerRef(subscription.getCustomerRef())
            .paymentMethodRef(subscription.getPaymentMethodRef())
            .description("Invoice " + invoice.getInvoiceNumber())
            .idempotencyKey(String.format("invoice-%d-attempt-%d", invoice.getId(), attempt))
            .metadata(Map.of(
                INVOICE_ID_METADATA_KEY, String.valueOf(invoice.getId()),
                TENANT_ID_METADATA_KEY, invoice.getTenantId()))
            .proceedOnFraudReview(billingConfig.isProceedOnFraudReview())
            .build();

        val result = paymentDispatcher.processPayment(request, subscription.getProviderType());
        final Invoice updated;
        try {
            updated = subscriptionService.applyPaymentResult(invoice.getId(), result);
        } catch (InvoiceNotFoundException e) {
            throw new IllegalStateException("invoice " + invoice.getId() + " disappeared while it was being charged", e);
        }

        if (result.isSuccess()) {
            log.info("invoice {} paid through {}", invoice.getInvoiceNumber(), result.getProvider());
            notifyPayment(updated, NotificationType.PAYMENT_SUCCEEDED, null);
        } else if (updated.getStatus() == Invoice.Status.PAYMENT_FAILED) {
            log.warn("payment of invoice {} failed for good after {} attempts: {}", invoice.getInvoiceNumber(), updated.getPaymentAttempts(), result.getErrorKind());
            notifyPayment(updated, NotificationType.PAYMENT_RETRIES_EXHAUSTED, result.getErrorMessage());
        } else {
            log.warn("payment of invoice {} failed: {} ({})", invoice.getInvoiceNumber(), result.getErrorKind(), result.getErrorMessage());
            notifyPayment(updated, NotificationType.PAYMENT_FAILED, result.getErrorMessage());
        }

        return updated;
    }

    private void applyProviderPaymentSuccess(@NonNull PaymentProviderType provider, @NonNull ProviderEvent event) {
        try {
            val invoice = subscriptionService.getInvoice(event.getInvoiceId());
            val result = PaymentResult.builder()
                .success(true)
                .provider(provider)
                .paymentId(event.getPaymentId())
                .amount(event.getAmount() == null ? invoice.getAmountDue() : event.getAmount())
                .currency(event.getCurrency() == null ? invoice.getCurrency() : event.getCurrency())
                .build();

            val wasOpen = invoice.getStatus() == Invoice.Status.OPEN;
            val updated = subscriptionService.applyPaymentResult(invoice.getId(), result);
            if (wasOpen && updated.getStatus() == Invoice.Status.PAID) {
                notifyPayment(updated, NotificationType.PAYMENT_SUCCEEDED, null);
            }
        } catch (InvoiceNotFoundException e) {
            log.warn("ignoring {} event {} for unknown invoice {}", event.getKind(), event.getEventId(), event.getInvoiceId());
        }
    }

    private void recordProviderPaymentFailure(@NonNull ProviderEvent event) {
        try {
            subscriptionService.recordProviderPaymentFailure(event.getInvoiceId(), event.getFailureMessage());
        } catch (InvoiceNotFoundException e) {
            log.warn("ignoring {} event {} for unknown invoice {}", event.getKind(), event.getEventId(), event.getInvoiceId());
        }
    }

    private void linkProviderSubscription(@NonNull ProviderEvent event) {
        if (event.getTenantId() == null || event.getProviderSubscriptionRef() == null) {
            log.info("ignoring {} event {} without tenant or subscription reference", event.getKind(), event.getEventId());
            return;
        }

        try {
            subscriptionService.linkProviderSubscription(event.getTenantId(), event.getProviderSubscriptionRef());
        } catch (SubscriptionNotFoundException e) {
            log.warn("ignoring {} event {} for tenant {} without a subscription", event.getKind(), event.getEventId(), event.getTenantId());
        }
    }

    private void applyProviderSubscriptionStatus(@NonNull ProviderEvent event) {
        val ref = event.getProviderSubscriptionRef();
        val status = event.getSubscriptionStatus() == null ? "" : event.getSubscriptionStatus().toLowerCase();
        if (ref == null) {
            return;
        }

        switch (status) {
            case "canceled":
            case "cancelled":
                subscriptionService.cancelByProviderRef(ref).ifPresent(this::notifyCancelled);
                break;
            case "past_due":
            case "unpaid":
                subscriptionService.markPastDueByProviderRef(ref);
                break;
            default:
                log.debug("no local change for provider subscription {} in status {}", ref, status);
        }
    }

    private void cancelProviderSubscription(@NonNull Subscription subscription) {
        if (subscription.getProviderSubscriptionRef() == null) {
            return;
        }

        try {
            paymentDispatcher.cancelProviderSubscription(subscription.getProviderType(), subscription.getProviderSubscriptionRef());
        } catch (PaymentProviderException e) {
            log.warn("failed to cancel provider subscription {} of subscription {}",
                subscription.getProviderSubscriptionRef(), subscription.getId(), e);
        }
    }

    private static void count(@NonNull BillingPassSummary summary, @NonNull Invoice invoice) {
        if (invoice.getStatus() == Invoice.Status.PAID) {
            summary.setPaymentsSucceeded(summary.getPaymentsSucceeded() + 1);
        } else {
            summary.setPaymentsFailed(summary.getPaymentsFailed() + 1);
        }
    }

    private void notifyInvoiceGenerated(@NonNull Invoice invoice) {
        notify(BillingNotification.builder()
            .type(NotificationType.INVOICE_GENERATED)
            .tenantId(invoice.getTenantId())
            .subscriptionId(invoice.getSubscription().getId())
            .invoiceId(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .amount(invoice.getTotal())
            .currency(invoice.getCurrency())
            .build());
    }

    private void notifyPayment(@NonNull Invoice invoice, @NonNull NotificationType type, String message) {
        notify(BillingNotification.builder()
            .type(type)
            .tenantId(invoice.getTenantId())
            .subscriptionId(invoice.getSubscription().getId())
            .invoiceId(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .amount(type == NotificationType.PAYMENT_SUCCEEDED ? invoice.getAmountPaid() : invoice.getAmountDue())
            .currency(invoice.getCurrency())
            .message(message)
            .metadata(invoice.getNextPaymentAttemptAt() == null
                ? Map.of()
                : Map.of("nextPaymentAttemptAt", invoice.getNextPaymentAttemptAt().toString()))
            .build());
    }

    private void notifyPlanChanged(@NonNull PlanChangeResult result, @NonNull String message) {
        val subscription = result.getSubscription();
        notify(BillingNotification.builder()
            .type(NotificationType.SUBSCRIPTION_PLAN_CHANGED)
            .tenantId(subscription.getTenantId())
            .subscriptionId(subscription.getId())
            .amount(result.getProrationAmount())
            .currency(subscription.getPlan().getCurrency())
            .message(message)
            .build());
    }

    private void notifyCancelled(@NonNull Subscription subscription) {
        notify(BillingNotification.builder()
            .type(NotificationType.SUBSCRIPTION_CANCELLED)
            .tenantId(subscription.getTenantId())
            .subscriptionId(subscription.getId())
            .build());
    }

    private void notify(@NonNull BillingNotification notification) {
        try {
            notificationService.sendBillingNotification(notification);
        } catch (RuntimeException e) {
            log.warn("failed to send {} notification to tenant {}", notification.getType(), notification.getTenantId(), e);
        }
    }
}

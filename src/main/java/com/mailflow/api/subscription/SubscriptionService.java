package com.mailflow.api.subscription;

import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentResult;
import com.mailflow.api.platform.Money;
import com.mailflow.api.platform.transaction.annotations.ReasonablyTransactional;
import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.InvoiceLineItem;
import com.mailflow.api.subscription.entities.InvoiceRepository;
import com.mailflow.api.subscription.entities.Subscription;
import com.mailflow.api.subscription.entities.SubscriptionPlan;
import com.mailflow.api.subscription.entities.SubscriptionPlanRepository;
import com.mailflow.api.subscription.entities.SubscriptionRepository;
import com.mailflow.api.subscription.entities.UsageCounter;
import com.mailflow.api.subscription.entities.UsageCounterRepository;
import com.mailflow.api.subscription.exceptions.DuplicateSubscriptionException;
import com.mailflow.api.subscription.exceptions.InvoiceNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionStateException;
import com.mailflow.api.subscription.models.PeriodCloseResult;
import com.mailflow.api.subscription.models.PlanChangeResult;
import com.mailflow.api.subscription.models.ProrationBehavior;
import com.mailflow.api.subscription.models.QuotaCheckResult;
import com.mailflow.api.subscription.payload.CreateSubscriptionParams;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNullElse;

/**
 * {@link SubscriptionService} implements the subscription lifecycle of tenants: plan changes and
 * their proration, usage quotas and invoice construction. It never talks to payment providers;
 * the billing package settles the invoices that it builds.
 */
@Service
@Slf4j
public class SubscriptionService {

    private static final DateTimeFormatter LINE_ITEM_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final SubscriptionConfiguration subscriptionConfig;
    private final SubscriptionPlanRepository subscriptionPlanRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final InvoiceRepository invoiceRepository;
    private final UsageCounterRepository usageCounterRepository;
    private final Cache cache;
    private final Clock clock;

    @Autowired
    SubscriptionService(
        @NonNull SubscriptionConfiguration subscriptionConfig,
        @NonNull SubscriptionPlanRepository subscriptionPlanRepository,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull InvoiceRepository invoiceRepository,
        @NonNull UsageCounterRepository usageCounterRepository,
        @NonNull @Qualifier(SubscriptionBeans.CACHE_NAME) Cache cache,
        @NonNull Clock clock
    ) {
        this.subscriptionConfig = subscriptionConfig;
        this.subscriptionPlanRepository = subscriptionPlanRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.invoiceRepository = invoiceRepository;
        this.usageCounterRepository = usageCounterRepository;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * @return a guaranteed to be not {@literal null} list of plans offered to tenants, cheapest
     * first.
     */
    @NonNull
    public List<SubscriptionPlan> getPlans() {
        return subscriptionPlanRepository.findAllActive();
    }

    /**
     * @throws SubscriptionNotFoundException if the tenant has no subscription that isn't
     *                                       cancelled.
     */
    @NonNull
    public Subscription getSubscription(@NonNull String tenantId) throws SubscriptionNotFoundException {
        return subscriptionRepository.findCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));
    }

    /**
     * @throws InvoiceNotFoundException if the invoice doesn't exist.
     */
    @NonNull
    public Invoice getInvoice(long invoiceId) throws InvoiceNotFoundException {
        return invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new InvoiceNotFoundException(invoiceId));
    }

    /**
     * @return a guaranteed to be not {@literal null} list of invoices created for the tenant in
     * {@code [start, end)}.
     */
    @NonNull
    public List<Invoice> listInvoices(@NonNull String tenantId, @NonNull OffsetDateTime start, @NonNull OffsetDateTime end) {
        return invoiceRepository.findAllByTenantIdCreatedBetween(tenantId, start, end);
    }

    /**
     * <p>
     * Subscribes a tenant to a plan.</p>
     *
     * <p>
     * The first billing period starts now and lasts one billing cycle of the plan. The subscription
     * starts {@link Subscription.Status#TRIALING trialing} if the effective trial length (the
     * explicit {@code trialDays} parameter, or else the plan's) is positive, and {@link
     * Subscription.Status#ACTIVE active} otherwise.</p>
     *
     * @param tenantId a not {@literal null} tenant id.
     * @param params   a not {@literal null} set of subscription parameters.
     * @return the new subscription.
     * @throws SubscriptionPlanNotFoundException if the plan doesn't exist or is no longer offered.
     * @throws DuplicateSubscriptionException    if the tenant already has a subscription that isn't
     *                                           cancelled.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription createSubscription(
        @NonNull String tenantId,
        @NonNull CreateSubscriptionParams params
    ) throws SubscriptionPlanNotFoundException, DuplicateSubscriptionException {
        val plan = findActivePlan(params.getPlanId());
        if (subscriptionRepository.existsCurrentByTenantId(tenantId)) {
            throw new DuplicateSubscriptionException(tenantId);
        }

        val now = now();
        val trialDays = requireNonNullElse(params.getTrialDays(), plan.getTrialDays());
        val subscription = subscriptionRepository.save(
            Subscription.builder()
                .createdAt(now)
                .tenantId(tenantId)
                .plan(plan)
                .status(trialDays > 0 ? Subscription.Status.TRIALING : Subscription.Status.ACTIVE)
                .billingAnchor(now)
                .periodIndex(0)
                .currentPeriodStart(now)
                .currentPeriodEnd(plan.getBillingCycle().advance(now, 1))
                .periodPrice(plan.getPrice())
                .trialEnd(trialDays > 0 ? now.plusDays(trialDays) : null)
                .customerRef(params.getCustomerRef())
                .paymentMethodRef(params.getPaymentMethodRef())
                .providerType(params.getProvider())
                .billingAddress(params.getBillingAddress())
                .discountRef(params.getDiscountRef())
                .taxRate(params.getTaxRate())
                .build());

        ensureUsageCounters(subscription.getId(), plan);
        evictQuotaCache(tenantId);
        log.info("created subscription {} for tenant {} on plan {}", subscription.getId(), tenantId, plan.getId());
        return subscription;
    }

    /**
     * <p>
     * Moves the tenant's subscription to another plan right away.</p>
     *
     * <p>
     * The price difference for the rest of the current period ({@code remaining fraction * (new
     * price - old price)}) is billed on an out-of-cycle {@link Invoice.Kind#PRORATION proration}
     * invoice if {@code prorationBehavior} is {@link ProrationBehavior#IMMEDIATE_CHARGE} and the
     * difference is positive. Otherwise, the next cycle invoice settles it. Subscriptions in their
     * trial switch plans without proration. Upgrading withdraws any scheduled downgrade.</p>
     *
     * <p>
     * The returned proration invoice is open. The caller is responsible for paying it.</p>
     *
     * @throws SubscriptionPlanNotFoundException if the plan doesn't exist or is no longer offered.
     * @throws SubscriptionNotFoundException     if the tenant has no subscription.
     * @throws SubscriptionStateException        if the tenant is already on the plan, or the plan's
     *                                           currency differs from the current plan's.
     */
    @NonNull
    @ReasonablyTransactional
    public PlanChangeResult upgrade(
        @NonNull String tenantId,
        long newPlanId,
        @NonNull ProrationBehavior prorationBehavior
    ) throws SubscriptionPlanNotFoundException, SubscriptionNotFoundException, SubscriptionStateException {
        val plan = findActivePlan(newPlanId);
        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        requirePlanChangeAllowed(subscription, plan);
        withdrawPendingPlan(subscription);

        val now = now();
        val currency = plan.getCurrency();
        BigDecimal proration = Money.round(BigDecimal.ZERO, currency);
        BigDecimal fraction = BigDecimal.ZERO;
        if (subscription.isTrialingAt(now)) {
            subscription.setPeriodPrice(plan.getPrice());
        } else {
            fraction = Proration.remainingFraction(now, subscription.getCurrentPeriodStart(), subscription.getCurrentPeriodEnd());
            proration = Proration.amount(fraction, subscription.getPlan().getPrice(), plan.getPrice(), currency);
        }

        val previousPlan = subscription.getPlan();
        subscription.setPlan(plan);

        Invoice prorationInvoice = null;
        if (proration.signum() > 0 && prorationBehavior == ProrationBehavior.IMMEDIATE_CHARGE) {
            prorationInvoice = createProrationInvoice(subscription, previousPlan, fraction, proration, now);
        } else if (proration.signum() != 0) {
            subscription.setDeferredProration(subscription.getDeferredProration().add(proration));
        }

        val saved = subscriptionRepository.save(subscription);
        ensureUsageCounters(saved.getId(), plan);
        evictQuotaCache(tenantId);
        log.info("upgraded subscription {} from plan {} to {} with proration {}", saved.getId(), previousPlan.getId(), plan.getId(), proration);
        return PlanChangeResult.builder()
            .subscription(saved)
            .prorationAmount(proration)
            .prorationInvoice(prorationInvoice)
            .build();
    }

    /**
     * <p>
     * Schedules the tenant's subscription to move to another plan at the first period boundary at
     * or after {@code downgradeAt} (the end of the current period if {@literal null}).</p>
     *
     * <p>
     * The price difference for the part of the current period after {@code downgradeAt} is
     * credited to the next cycle invoice. It is zero when the downgrade takes effect at the end of
     * the period. A new downgrade replaces a previously scheduled one.</p>
     *
     * @throws SubscriptionPlanNotFoundException if the plan doesn't exist or is no longer offered.
     * @throws SubscriptionNotFoundException     if the tenant has no subscription.
     * @throws SubscriptionStateException        if the tenant is already on the plan, or the plan's
     *                                           currency differs from the current plan's.
     */
    @NonNull
    @ReasonablyTransactional
    public PlanChangeResult downgrade(
        @NonNull String tenantId,
        long newPlanId,
        OffsetDateTime downgradeAt
    ) throws SubscriptionPlanNotFoundException, SubscriptionNotFoundException, SubscriptionStateException {
        val plan = findActivePlan(newPlanId);
        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        requirePlanChangeAllowed(subscription, plan);
        withdrawPendingPlan(subscription);

        val now = now();
        OffsetDateTime effectiveAt = downgradeAt == null ? subscription.getCurrentPeriodEnd() : downgradeAt.truncatedTo(ChronoUnit.MICROS);
        if (effectiveAt.isBefore(now)) {
            effectiveAt = now;
        }

        BigDecimal credit = Money.round(BigDecimal.ZERO, plan.getCurrency());
        if (!subscription.isTrialingAt(now)) {
            val fraction = Proration.remainingFraction(effectiveAt, subscription.getCurrentPeriodStart(), subscription.getCurrentPeriodEnd());
            credit = Proration.amount(fraction, subscription.getPlan().getPrice(), plan.getPrice(), plan.getCurrency());
        }

        subscription.setPendingPlan(plan);
        subscription.setPendingPlanEffectiveAt(effectiveAt);
        subscription.setPendingPlanCredit(credit);
        subscription.setDeferredProration(subscription.getDeferredProration().add(credit));
        val saved = subscriptionRepository.save(subscription);
        log.info("scheduled subscription {} to move to plan {} at {} with proration {}", saved.getId(), plan.getId(), effectiveAt, credit);
        return PlanChangeResult.builder()
            .subscription(saved)
            .prorationAmount(credit)
            .build();
    }

    /**
     * Cancels the tenant's subscription immediately if {@code cancelAt} is absent or not in the
     * future. Otherwise, schedules it to end at the first period boundary at or after {@code
     * cancelAt}. Cancellation never refunds already paid invoices.
     *
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription cancelSubscription(@NonNull String tenantId, OffsetDateTime cancelAt) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        val now = now();
        if (cancelAt == null || !cancelAt.isAfter(now)) {
            cancelNow(subscription, now);
        } else {
            subscription.setCancelAtPeriodEnd(true);
            subscription.setCancelAt(cancelAt.truncatedTo(ChronoUnit.MICROS));
            log.info("scheduled subscription {} to cancel at {}", subscription.getId(), cancelAt);
        }

        return subscriptionRepository.save(subscription);
    }

    /**
     * Checks whether the tenant may consume {@code requestedAmount} more units of a resource in
     * the current period. Resources that the plan has no quota for are unlimited. Tenants without
     * a subscription may not consume anything.
     */
    @NonNull
    public QuotaCheckResult checkQuotaLimit(@NonNull String tenantId, @NonNull String resourceType, long requestedAmount) {
        if (requestedAmount < 0) {
            throw new IllegalArgumentException("requested amount must not be negative");
        }

        val quotas = findQuotaSnapshot(tenantId);
        if (quotas == null) {
            return QuotaCheckResult.denied();
        }

        val used = usageCounterRepository.findBySubscriptionIdAndResourceType(quotas.getSubscriptionId(), resourceType)
            .map(UsageCounter::getUsed)
            .orElse(0L);

        val limit = quotas.getQuotas().get(resourceType);
        if (limit == null) {
            return QuotaCheckResult.builder()
                .allowed(true)
                .used(used)
                .build();
        }

        return QuotaCheckResult.builder()
            .allowed(used + requestedAmount <= limit)
            .used(used)
            .remaining(Math.max(0, limit - used))
            .limit(limit)
            .build();
    }

    /**
     * <p>
     * Adds {@code increment} units to the tenant's usage of a resource in the current period.</p>
     *
     * <p>
     * The increment is a single atomic update in the database, so concurrent calls never lose
     * updates. The counter is created if it doesn't exist yet.</p>
     *
     * @throws IllegalArgumentException      if {@code increment} isn't positive.
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    public void updateUsage(@NonNull String tenantId, @NonNull String resourceType, long increment) throws SubscriptionNotFoundException {
        if (increment <= 0) {
            throw new IllegalArgumentException("usage increment must be positive");
        }

        val subscriptionId = requireSubscriptionId(tenantId);
        if (usageCounterRepository.increment(subscriptionId, resourceType, increment) > 0) {
            return;
        }

        try {
            usageCounterRepository.save(
                UsageCounter.builder()
                    .subscriptionId(subscriptionId)
                    .resourceType(resourceType)
                    .used(increment)
                    .build());
        } catch (DataIntegrityViolationException e) {
            // a concurrent call created the counter first.
            log.trace("usage counter for subscription {} and resource {} already exists", subscriptionId, resourceType);
            usageCounterRepository.increment(subscriptionId, resourceType, increment);
        }
    }

    /**
     * Zeroes the tenant's usage of a resource, or of all resources if {@code resourceType} is
     * {@literal null}.
     *
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    public void resetUsage(@NonNull String tenantId, String resourceType) throws SubscriptionNotFoundException {
        val subscriptionId = requireSubscriptionId(tenantId);
        if (resourceType == null) {
            usageCounterRepository.resetAll(subscriptionId);
        } else {
            usageCounterRepository.reset(subscriptionId, resourceType);
        }
    }

    /**
     * <p>
     * Returns the tenant's cycle invoice for {@code [periodStart, periodEnd)}, building it if it
     * doesn't exist yet.</p>
     *
     * <p>
     * The invoice bills the period price (only for the part of the period after the trial), the
     * plan's setup fee if it hasn't been billed yet, the deferred proration, and unbilled usage
     * beyond the plan quotas. Invoices whose total is zero are created paid. If the subtotal is
     * negative, the invoice total is zero and the remaining credit carries over to the next
     * invoice.</p>
     *
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     * @throws IllegalArgumentException      if the period doesn't end after it starts.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice generateInvoice(
        @NonNull String tenantId,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd
    ) throws SubscriptionNotFoundException {
        if (!periodEnd.isAfter(periodStart)) {
            throw new IllegalArgumentException("billing period must end after it starts");
        }

        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        val start = periodStart.truncatedTo(ChronoUnit.MICROS);
        val end = periodEnd.truncatedTo(ChronoUnit.MICROS);
        val existing = invoiceRepository.findBySubscriptionIdAndKindAndPeriod(subscription.getId(), Invoice.Kind.CYCLE, start, end);
        if (existing.isPresent()) {
            return existing.get();
        }

        val invoice = buildInvoice(subscription, Invoice.Kind.CYCLE, start, end, now(), true);
        subscriptionRepository.save(subscription);
        return invoice;
    }

    /**
     * <p>
     * Closes the oldest elapsed billing period of a subscription.</p>
     *
     * <ol>
     *     <li>Invoices the period, unless the trial covers it entirely, it has nothing to bill, or
     *     it has been invoiced already.</li>
     *     <li>Applies a scheduled plan change or cancellation that is due at the period's end.</li>
     *     <li>Advances the subscription to the next period, which is computed from the billing
     *     anchor, ends a finished trial and zeroes the usage counters.</li>
     * </ol>
     *
     * <p>
     * The returned invoice is open unless its total is zero. The caller is responsible for paying
     * it.</p>
     *
     * @throws SubscriptionNotFoundException if the subscription doesn't exist.
     */
    @NonNull
    @ReasonablyTransactional
    public PeriodCloseResult closeElapsedPeriod(long subscriptionId) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.lockById(subscriptionId)
            .orElseThrow(() -> new SubscriptionNotFoundException("subscription not found: " + subscriptionId));

        val now = now();
        if (subscription.getStatus() == Subscription.Status.CANCELLED || subscription.getCurrentPeriodEnd().isAfter(now)) {
            return PeriodCloseResult.nothingDue();
        }

        val start = subscription.getCurrentPeriodStart();
        val end = subscription.getCurrentPeriodEnd();
        val closedUsage = usageCounterRepository.findAllBySubscriptionId(subscriptionId);
        Invoice invoice = null;
        boolean invoiceExisted = false;
        val trialCoversPeriod = subscription.getStatus() == Subscription.Status.TRIALING
            && subscription.getTrialEnd() != null
            && !subscription.getTrialEnd().isBefore(end);

        if (!trialCoversPeriod) {
            val existing = invoiceRepository.findBySubscriptionIdAndKindAndPeriod(subscriptionId, Invoice.Kind.CYCLE, start, end);
            invoiceExisted = existing.isPresent();
            invoice = invoiceExisted ? existing.get() : buildInvoice(subscription, Invoice.Kind.CYCLE, start, end, now, false, closedUsage);
        }

        val planChanged = applyPendingPlan(subscription, end);
        val cancelled = subscription.isCancelAtPeriodEnd()
            && subscription.getCancelAt() != null
            && !end.isBefore(subscription.getCancelAt());

        if (cancelled) {
            subscription.transitionTo(Subscription.Status.CANCELLED);
            subscription.setCancelledAt(end);
            subscription.setCancelAtPeriodEnd(false);
        } else {
            advancePeriod(subscription);
            if (subscription.getStatus() == Subscription.Status.TRIALING && !subscription.isTrialingAt(subscription.getCurrentPeriodStart())) {
                subscription.transitionTo(Subscription.Status.ACTIVE);
            }
        }

        // increments committed after the snapshot carry over to the next period.
        for (val counter : closedUsage) {
            usageCounterRepository.rollOver(subscriptionId, counter.getResourceType(), counter.getUsed());
        }

        val saved = subscriptionRepository.save(subscription);
        if (planChanged || cancelled) {
            evictQuotaCache(saved.getTenantId());
        }

        log.debug("closed period [{}, {}) of subscription {}", start, end, subscriptionId);
        return PeriodCloseResult.builder()
            .subscription(saved)
            .invoice(invoice)
            .invoiceExisted(invoiceExisted)
            .cancelled(cancelled)
            .moreDue(!cancelled && !saved.getCurrentPeriodEnd().isAfter(now))
            .build();
    }

    /**
     * Bills the tenant's usage beyond plan quotas in the current period that no invoice has billed
     * yet, on an out-of-cycle {@link Invoice.Kind#OVERAGE overage} invoice. Billed units aren't
     * billed again by later invoices of the same period.
     *
     * @return the open overage invoice, or empty if there is no unbilled overage.
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    @NonNull
    @ReasonablyTransactional
    public Optional<Invoice> createOverageInvoice(@NonNull String tenantId) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        val now = now();
        if (!now.isAfter(subscription.getCurrentPeriodStart())) {
            return Optional.empty();
        }

        return Optional.ofNullable(buildInvoice(subscription, Invoice.Kind.OVERAGE, subscription.getCurrentPeriodStart(), now, now, false));
    }

    /**
     * <p>
     * Records the outcome of a payment attempt on an open invoice.</p>
     *
     * <p>
     * On success, the invoice is paid in full and a past due subscription becomes active again.
     * On failure, the invoice stays open with its next attempt scheduled from the configured retry
     * intervals, or fails for good if no retries remain, and an active subscription becomes past
     * due. Invoices that aren't open are returned unchanged.</p>
     *
     * @throws InvoiceNotFoundException if the invoice doesn't exist.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice applyPaymentResult(long invoiceId, @NonNull PaymentResult result) throws InvoiceNotFoundException {
        val invoice = getInvoice(invoiceId);
        if (invoice.getStatus() != Invoice.Status.OPEN) {
            log.debug("ignoring payment result for invoice {} in status {}", invoiceId, invoice.getStatus());
            return invoice;
        }

        val subscription = subscriptionRepository.lockById(invoice.getSubscription().getId())
            .orElseThrow(() -> new IllegalStateException("invoice " + invoiceId + " has no subscription"));

        val now = now();
        invoice.setPaymentAttempts(invoice.getPaymentAttempts() + 1);
        if (result.isSuccess()) {
            invoice.markPaid(result.getProvider(), result.getPaymentId(), now);
            if (subscription.getStatus() == Subscription.Status.PAST_DUE) {
                subscription.transitionTo(Subscription.Status.ACTIVE);
            }
        } else {
            val errorKind = requireNonNullElse(result.getErrorKind(), PaymentErrorKind.UNKNOWN);
            invoice.setLastPaymentError(result.getErrorMessage() == null ? errorKind.name() : errorKind + ": " + result.getErrorMessage());
            invoice.setPaymentProvider(result.getProvider());
            val retryDelay = subscriptionConfig.getRetryDelayAfter(invoice.getPaymentAttempts());
            if (retryDelay == null) {
                invoice.setStatus(Invoice.Status.PAYMENT_FAILED);
                invoice.setNextPaymentAttemptAt(null);
            } else {
                invoice.setNextPaymentAttemptAt(now.plus(retryDelay));
            }

            if (subscription.getStatus() == Subscription.Status.ACTIVE) {
                subscription.transitionTo(Subscription.Status.PAST_DUE);
            }
        }

        subscriptionRepository.save(subscription);
        return invoiceRepository.save(invoice);
    }

    /**
     * Records a payment failure that a provider reported asynchronously. It doesn't count as a
     * payment attempt.
     *
     * @throws InvoiceNotFoundException if the invoice doesn't exist.
     */
    @ReasonablyTransactional
    public void recordProviderPaymentFailure(long invoiceId, String message) throws InvoiceNotFoundException {
        val invoice = getInvoice(invoiceId);
        if (invoice.getStatus() != Invoice.Status.OPEN) {
            return;
        }

        invoice.setLastPaymentError(message);
        invoiceRepository.save(invoice);
    }

    /**
     * Voids an invoice that hasn't been paid. Void invoices are never charged.
     *
     * @throws InvoiceNotFoundException   if the invoice doesn't exist.
     * @throws SubscriptionStateException if the invoice has been paid.
     */
    @NonNull
    @ReasonablyTransactional
    public Invoice voidInvoice(long invoiceId) throws InvoiceNotFoundException, SubscriptionStateException {
        val invoice = getInvoice(invoiceId);
        if (invoice.getStatus() == Invoice.Status.PAID) {
            throw new SubscriptionStateException("paid invoices can't be voided");
        }

        invoice.setStatus(Invoice.Status.VOID);
        invoice.setNextPaymentAttemptAt(null);
        return invoiceRepository.save(invoice);
    }

    /**
     * @return ids of open invoices whose next payment attempt is due, earliest first.
     */
    @NonNull
    public List<Long> findInvoicesDueForPaymentAttempt() {
        return invoiceRepository.findAllIdsDueForPaymentAttempt(now());
    }

    /**
     * @return ids of subscriptions whose current period has elapsed, most overdue first.
     */
    @NonNull
    public List<Long> findSubscriptionsWithElapsedPeriod() {
        return subscriptionRepository.findAllDueIds(now());
    }

    @NonNull
    public List<String> findBillableTenantIds() {
        return subscriptionRepository.findAllBillableTenantIds();
    }

    /**
     * @return the cycle invoice of the subscription for the given period, if it exists.
     */
    @NonNull
    public Optional<Invoice> findCycleInvoice(long subscriptionId, @NonNull OffsetDateTime periodStart, @NonNull OffsetDateTime periodEnd) {
        return invoiceRepository.findBySubscriptionIdAndKindAndPeriod(subscriptionId, Invoice.Kind.CYCLE, periodStart, periodEnd);
    }

    /**
     * Links the provider side subscription that mirrors the tenant's subscription.
     *
     * @throws SubscriptionNotFoundException if the tenant has no subscription.
     */
    @NonNull
    @ReasonablyTransactional
    public Subscription linkProviderSubscription(@NonNull String tenantId, @NonNull String providerSubscriptionRef) throws SubscriptionNotFoundException {
        val subscription = subscriptionRepository.lockCurrentByTenantId(tenantId)
            .orElseThrow(() -> noSubscription(tenantId));

        subscription.setProviderSubscriptionRef(providerSubscriptionRef);
        return subscriptionRepository.save(subscription);
    }

    /**
     * Marks the subscription that mirrors the given provider subscription as past due, if it is
     * active.
     */
    @NonNull
    @ReasonablyTransactional
    public Optional<Subscription> markPastDueByProviderRef(@NonNull String providerSubscriptionRef) {
        return subscriptionRepository.findByProviderSubscriptionRef(providerSubscriptionRef)
            .flatMap(s -> subscriptionRepository.lockById(s.getId()))
            .map(s -> {
                if (s.getStatus() == Subscription.Status.ACTIVE) {
                    s.transitionTo(Subscription.Status.PAST_DUE);
                }

                return subscriptionRepository.save(s);
            });
    }

    /**
     * Cancels the subscription that mirrors the given provider subscription right away.
     */
    @NonNull
    @ReasonablyTransactional
    public Optional<Subscription> cancelByProviderRef(@NonNull String providerSubscriptionRef) {
        return subscriptionRepository.findByProviderSubscriptionRef(providerSubscriptionRef)
            .flatMap(s -> subscriptionRepository.lockById(s.getId()))
            .map(s -> {
                if (s.getStatus() != Subscription.Status.CANCELLED) {
                    cancelNow(s, now());
                }

                return subscriptionRepository.save(s);
            });
    }

    private void cancelNow(@NonNull Subscription subscription, @NonNull OffsetDateTime now) {
        subscription.transitionTo(Subscription.Status.CANCELLED);
        subscription.setCancelledAt(now);
        subscription.setCancelAt(now);
        subscription.setCancelAtPeriodEnd(false);
        withdrawPendingPlan(subscription);
        evictQuotaCache(subscription.getTenantId());
        log.info("cancelled subscription {} of tenant {}", subscription.getId(), subscription.getTenantId());
    }

    @NonNull
    private Invoice createProrationInvoice(
        @NonNull Subscription subscription,
        @NonNull SubscriptionPlan previousPlan,
        @NonNull BigDecimal fraction,
        @NonNull BigDecimal proration,
        @NonNull OffsetDateTime now
    ) {
        val plan = subscription.getPlan();
        val line = InvoiceLineItem.builder()
            .description(String.format("Upgrade from %s to %s (%s - %s)", previousPlan.getName(), plan.getName(),
                LINE_ITEM_DATE_FORMAT.format(now), LINE_ITEM_DATE_FORMAT.format(subscription.getCurrentPeriodEnd())))
            .quantity(fraction.setScale(4, RoundingMode.HALF_UP))
            .unitPrice(plan.getPrice().subtract(previousPlan.getPrice()))
            .amount(proration)
            .kind(InvoiceLineItem.Kind.PRORATION)
            .build();

        val invoice = newInvoice(subscription, Invoice.Kind.PRORATION, now, subscription.getCurrentPeriodEnd(), now);
        invoice.getLineItems().add(line);
        applyTotals(invoice, subscription, now);
        return invoiceRepository.save(invoice);
    }

    /**
     * Builds, saves and returns an invoice of the given kind. Cycle invoices bill the period price,
     * the setup fee and the deferred proration. All kinds bill unbilled overage.
     *
     * @return {@literal null} if the invoice would have no lines and {@code keepEmpty} is false.
     */
    private Invoice buildInvoice(
        @NonNull Subscription subscription,
        @NonNull Invoice.Kind kind,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd,
        @NonNull OffsetDateTime now,
        boolean keepEmpty
    ) {
        val counters = usageCounterRepository.findAllBySubscriptionId(subscription.getId());
        return buildInvoice(subscription, kind, periodStart, periodEnd, now, keepEmpty, counters);
    }

    /**
     * Same as {@link #buildInvoice(Subscription, Invoice.Kind, OffsetDateTime, OffsetDateTime,
     * OffsetDateTime, boolean)}, but bills overage from an already read snapshot of the usage
     * counters.
     */
    private Invoice buildInvoice(
        @NonNull Subscription subscription,
        @NonNull Invoice.Kind kind,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd,
        @NonNull OffsetDateTime now,
        boolean keepEmpty,
        @NonNull List<UsageCounter> counters
    ) {
        val plan = subscription.getPlan();
        val currency = plan.getCurrency();
        val lines = new ArrayList<InvoiceLineItem>();
        boolean billsSetupFee = false;
        boolean billsDeferredProration = false;

        if (kind == Invoice.Kind.CYCLE) {
            val trialEnd = subscription.getTrialEnd();
            val fraction = trialEnd != null && trialEnd.isAfter(periodStart)
                ? Proration.remainingFraction(trialEnd, periodStart, periodEnd)
                : BigDecimal.ONE;

            val baseAmount = Money.round(subscription.getPeriodPrice().multiply(fraction), currency);
            if (baseAmount.signum() > 0) {
                lines.add(InvoiceLineItem.builder()
                    .description(String.format("%s (%s - %s)", plan.getName(),
                        LINE_ITEM_DATE_FORMAT.format(periodStart), LINE_ITEM_DATE_FORMAT.format(periodEnd)))
                    .quantity(fraction.setScale(4, RoundingMode.HALF_UP))
                    .unitPrice(subscription.getPeriodPrice())
                    .amount(baseAmount)
                    .kind(InvoiceLineItem.Kind.SUBSCRIPTION)
                    .build());
            }

            if (!subscription.isSetupFeeInvoiced() && plan.getSetupFee().signum() > 0) {
                billsSetupFee = true;
                lines.add(InvoiceLineItem.builder()
                    .description(String.format("%s setup fee", plan.getName()))
                    .quantity(BigDecimal.ONE)
                    .unitPrice(plan.getSetupFee())
                    .amount(Money.round(plan.getSetupFee(), currency))
                    .kind(InvoiceLineItem.Kind.SETUP_FEE)
                    .build());
            }

            if (subscription.getDeferredProration().signum() != 0) {
                billsDeferredProration = true;
                val deferred = Money.round(subscription.getDeferredProration(), currency);
                lines.add(InvoiceLineItem.builder()
                    .description(deferred.signum() > 0 ? "Proration for plan changes" : "Credit for plan changes")
                    .quantity(BigDecimal.ONE)
                    .unitPrice(deferred)
                    .amount(deferred)
                    .kind(InvoiceLineItem.Kind.PRORATION)
                    .build());
            }
        }

        val overages = findUnbilledOverage(subscription, counters);
        for (val overage : overages) {
            lines.add(InvoiceLineItem.builder()
                .description(String.format("%s beyond the %d quota", overage.getResourceType(), overage.getQuota()))
                .quantity(BigDecimal.valueOf(overage.getUnits()))
                .unitPrice(overage.getUnitPrice())
                .amount(Money.round(overage.getUnitPrice().multiply(BigDecimal.valueOf(overage.getUnits())), currency))
                .kind(InvoiceLineItem.Kind.OVERAGE)
                .build());
        }

        if (lines.isEmpty() && !keepEmpty) {
            return null;
        }

        val invoice = newInvoice(subscription, kind, periodStart, periodEnd, now);
        invoice.getLineItems().addAll(lines);
        if (billsDeferredProration) {
            subscription.setDeferredProration(BigDecimal.ZERO);
            subscription.setPendingPlanCredit(BigDecimal.ZERO);
        }

        val carriedCredit = applyTotals(invoice, subscription, now);
        subscription.setDeferredProration(subscription.getDeferredProration().add(carriedCredit));
        if (billsSetupFee) {
            subscription.setSetupFeeInvoiced(true);
        }

        val saved = invoiceRepository.save(invoice);
        for (val overage : overages) {
            usageCounterRepository.addBilledOverage(subscription.getId(), overage.getResourceType(), overage.getUnits());
        }

        log.debug("created {} invoice {} for subscription {} with total {}", kind, saved.getInvoiceNumber(), subscription.getId(), saved.getTotal());
        return saved;
    }

    @NonNull
    private Invoice newInvoice(
        @NonNull Subscription subscription,
        @NonNull Invoice.Kind kind,
        @NonNull OffsetDateTime periodStart,
        @NonNull OffsetDateTime periodEnd,
        @NonNull OffsetDateTime now
    ) {
        val tenantId = subscription.getTenantId();
        val sequenceNumber = invoiceRepository.findMaxSequenceNumberByTenantId(tenantId) + 1;
        return Invoice.builder()
            .createdAt(now)
            .tenantId(tenantId)
            .subscription(subscription)
            .kind(kind)
            .sequenceNumber(sequenceNumber)
            .invoiceNumber(String.format("%s-%s-%06d", subscriptionConfig.getInvoiceNumberPrefix(), tenantId, sequenceNumber))
            .status(Invoice.Status.OPEN)
            .currency(subscription.getPlan().getCurrency())
            .subtotal(BigDecimal.ZERO)
            .total(BigDecimal.ZERO)
            .dueDate(now.plus(subscriptionConfig.getInvoiceDueAfter()))
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .nextPaymentAttemptAt(now)
            .build();
    }

    /**
     * Computes subtotal, discount, tax and total of the invoice from its lines. Invoices with a
     * zero total are marked paid.
     *
     * @return the credit that the invoice couldn't absorb, as a negative amount, or zero.
     */
    @NonNull
    private BigDecimal applyTotals(@NonNull Invoice invoice, @NonNull Subscription subscription, @NonNull OffsetDateTime now) {
        val currency = invoice.getCurrency();
        val subtotal = Money.round(
            invoice.getLineItems().stream()
                .map(InvoiceLineItem::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add),
            currency);

        invoice.setSubtotal(subtotal);
        BigDecimal carriedCredit = BigDecimal.ZERO;
        if (subtotal.signum() < 0) {
            carriedCredit = subtotal;
            invoice.setDiscountAmount(Money.round(BigDecimal.ZERO, currency));
            invoice.setTaxAmount(Money.round(BigDecimal.ZERO, currency));
            invoice.setTotal(Money.round(BigDecimal.ZERO, currency));
        } else {
            val percentOff = subscription.getDiscountRef() == null
                ? BigDecimal.ZERO
                : subscriptionConfig.getDiscounts().getOrDefault(subscription.getDiscountRef(), BigDecimal.ZERO);

            val discount = Money.round(subtotal.multiply(percentOff).movePointLeft(2), currency).min(subtotal);
            val taxRate = requireNonNullElse(subscription.getTaxRate(), subscriptionConfig.getDefaultTaxRate());
            val tax = Money.round(subtotal.subtract(discount).multiply(taxRate), currency);
            invoice.setDiscountAmount(discount);
            invoice.setTaxAmount(tax);
            invoice.setTotal(subtotal.subtract(discount).add(tax));
        }

        invoice.setAmountPaid(Money.round(BigDecimal.ZERO, currency));
        if (invoice.getTotal().signum() == 0) {
            invoice.markPaid(null, null, now);
        }

        return carriedCredit;
    }

    @NonNull
    private List<Overage> findUnbilledOverage(@NonNull Subscription subscription, @NonNull List<UsageCounter> counters) {
        val quotas = subscription.getPlan().getQuotas();
        val overages = new ArrayList<Overage>();
        for (val counter : counters) {
            val quota = quotas.get(counter.getResourceType());
            if (quota == null) {
                continue;
            }

            val unitPrice = subscriptionConfig.getOverageUnitPrice(counter.getResourceType());
            val units = Math.max(0, counter.getUsed() - quota) - counter.getBilledOverage();
            if (units > 0 && unitPrice.signum() > 0) {
                overages.add(new Overage(counter.getResourceType(), quota, units, unitPrice));
            }
        }

        return overages;
    }

    /**
     * Moves the subscription to the period that follows the current one. Boundaries are computed
     * from the billing anchor. If the current period doesn't line up with the plan's billing cycle
     * (the cycle changed with the plan), the subscription is re-anchored at the boundary.
     */
    private void advancePeriod(@NonNull Subscription subscription) {
        val cycle = subscription.getPlan().getBillingCycle();
        val boundary = subscription.getCurrentPeriodEnd();
        OffsetDateTime anchor = subscription.getBillingAnchor();
        int index = subscription.getPeriodIndex() + 1;
        if (!cycle.advance(anchor, index).isEqual(boundary)) {
            anchor = boundary;
            index = 0;
        }

        subscription.setBillingAnchor(anchor);
        subscription.setPeriodIndex(index);
        subscription.setCurrentPeriodStart(boundary);
        subscription.setCurrentPeriodEnd(cycle.advance(anchor, index + 1L));
        subscription.setPeriodPrice(subscription.getPlan().getPrice());
    }

    private boolean applyPendingPlan(@NonNull Subscription subscription, @NonNull OffsetDateTime boundary) {
        val pendingPlan = subscription.getPendingPlan();
        if (pendingPlan == null || boundary.isBefore(subscription.getPendingPlanEffectiveAt())) {
            return false;
        }

        log.info("moving subscription {} from plan {} to {}", subscription.getId(), subscription.getPlan().getId(), pendingPlan.getId());
        subscription.setPlan(pendingPlan);
        subscription.setPendingPlan(null);
        subscription.setPendingPlanEffectiveAt(null);
        subscription.setPendingPlanCredit(BigDecimal.ZERO);
        ensureUsageCounters(subscription.getId(), pendingPlan);
        return true;
    }

    private void withdrawPendingPlan(@NonNull Subscription subscription) {
        if (subscription.getPendingPlan() == null) {
            return;
        }

        subscription.setDeferredProration(subscription.getDeferredProration().subtract(subscription.getPendingPlanCredit()));
        subscription.setPendingPlan(null);
        subscription.setPendingPlanEffectiveAt(null);
        subscription.setPendingPlanCredit(BigDecimal.ZERO);
    }

    private void requirePlanChangeAllowed(@NonNull Subscription subscription, @NonNull SubscriptionPlan plan) throws SubscriptionStateException {
        if (subscription.getPlan().getId() == plan.getId()) {
            throw new SubscriptionStateException("subscription is already on plan " + plan.getId());
        }

        if (!subscription.getPlan().getCurrency().equalsIgnoreCase(plan.getCurrency())) {
            throw new SubscriptionStateException(String.format("can't change plan currency from %s to %s",
                subscription.getPlan().getCurrency(), plan.getCurrency()));
        }
    }

    private void ensureUsageCounters(long subscriptionId, @NonNull SubscriptionPlan plan) {
        for (val resourceType : plan.getQuotas().keySet()) {
            if (usageCounterRepository.findBySubscriptionIdAndResourceType(subscriptionId, resourceType).isEmpty()) {
                usageCounterRepository.save(
                    UsageCounter.builder()
                        .subscriptionId(subscriptionId)
                        .resourceType(resourceType)
                        .build());
            }
        }
    }

    @NonNull
    private SubscriptionPlan findActivePlan(Long planId) throws SubscriptionPlanNotFoundException {
        if (planId == null) {
            throw new SubscriptionPlanNotFoundException(0);
        }

        return subscriptionPlanRepository.findActiveById(planId)
            .orElseThrow(() -> new SubscriptionPlanNotFoundException(planId));
    }

    private long requireSubscriptionId(@NonNull String tenantId) throws SubscriptionNotFoundException {
        val snapshot = findQuotaSnapshot(tenantId);
        if (snapshot == null) {
            throw noSubscription(tenantId);
        }

        return snapshot.getSubscriptionId();
    }

    /**
     * @return the cached quotas of the tenant's current plan, or {@literal null} if the tenant has
     * no subscription.
     */
    private QuotaSnapshot findQuotaSnapshot(@NonNull String tenantId) {
        val key = quotaCacheKey(tenantId);
        val cached = cache.get(key, QuotaSnapshot.class);
        if (cached != null) {
            return cached;
        }

        val subscription = subscriptionRepository.findCurrentByTenantId(tenantId).orElse(null);
        if (subscription == null) {
            return null;
        }

        val snapshot = new QuotaSnapshot(subscription.getId(), Map.copyOf(subscription.getPlan().getQuotas()));
        cache.put(key, snapshot);
        return snapshot;
    }

    private void evictQuotaCache(@NonNull String tenantId) {
        cache.evictIfPresent(quotaCacheKey(tenantId));
    }

    @NonNull
    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    @NonNull
    private static String quotaCacheKey(@NonNull String tenantId) {
        return "quotas:" + tenantId;
    }

    @NonNull
    private static SubscriptionNotFoundException noSubscription(@NonNull String tenantId) {
        return new SubscriptionNotFoundException("tenant has no subscription: " + tenantId);
    }

    @Value
    private static class QuotaSnapshot {
        long subscriptionId;
        Map<String, Long> quotas;
    }

    @Value
    private static class Overage {
        String resourceType;
        long quota;
        long units;
        BigDecimal unitPrice;
    }
}

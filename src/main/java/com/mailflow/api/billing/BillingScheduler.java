package com.mailflow.api.billing;

import com.mailflow.api.billing.models.BillingPassSummary;
import com.mailflow.api.billing.models.BillingRunResult;
import com.mailflow.api.billing.models.BillingSchedulerStatus;
import com.mailflow.api.subscription.entities.Invoice;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <p>
 * {@link BillingScheduler} drives {@link BillingService#runBillingPass()} at a fixed rate while it
 * is running, and runs billing passes and overage billing on demand.</p>
 *
 * <p>
 * At most one run is in flight at any time. A run requested while another one is in flight is
 * skipped, not queued.</p>
 */
@Component
@Slf4j
class BillingScheduler implements SmartLifecycle {

    private final BillingService billingService;
    private final BillingConfiguration config;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicBoolean runInFlight = new AtomicBoolean(false);
    private final AtomicLong skippedRuns = new AtomicLong();

    private volatile ScheduledFuture<?> timer;
    private volatile OffsetDateTime lastRunStartedAt;
    private volatile BillingRunResult lastRun;
    private volatile OffsetDateTime lastSkippedAt;

    @Autowired
    BillingScheduler(
        @NonNull BillingService billingService,
        @NonNull BillingConfiguration config,
        @NonNull @Qualifier(BillingBeans.BILLING_TASK_SCHEDULER) TaskScheduler taskScheduler,
        @NonNull Clock clock
    ) {
        this.billingService = billingService;
        this.config = config;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (timer != null) {
            return;
        }

        val interval = config.getSchedulerInterval();
        timer = taskScheduler.scheduleAtFixedRate(this::scheduledRun, clock.instant().plus(interval), interval);
        log.info("billing scheduler started with interval {}", interval);
    }

    @Override
    public synchronized void stop() {
        if (timer == null) {
            return;
        }

        // a pass that is already in flight runs to completion.
        timer.cancel(false);
        timer = null;
        log.info("billing scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return timer != null;
    }

    @Override
    public boolean isAutoStartup() {
        return config.isSchedulerAutoStartup();
    }

    /**
     * Runs a billing pass now, unless one is already in flight.
     */
    @NonNull
    BillingRunResult triggerBillingCycles() {
        return runExclusively("billing pass", billingService::runBillingPass);
    }

    /**
     * Bills the tenant's unbilled overage now, unless a run is already in flight.
     */
    @NonNull
    BillingRunResult triggerOverageBilling(@NonNull String tenantId) {
        return runExclusively("overage billing of tenant " + tenantId, () -> {
            val summary = new BillingPassSummary();
            val invoice = billingService.processOverageBilling(tenantId);
            if (invoice.isPresent()) {
                summary.setOverageInvoicesCreated(1);
                if (invoice.get().getStatus() == Invoice.Status.PAID) {
                    summary.setPaymentsSucceeded(1);
                } else if (invoice.get().getPaymentAttempts() > 0) {
                    summary.setPaymentsFailed(1);
                }
            }

            return summary;
        });
    }

    @NonNull
    BillingSchedulerStatus getStatus() {
        val last = lastRun;
        return BillingSchedulerStatus.builder()
            .timerRunning(isRunning())
            .runInFlight(runInFlight.get())
            .interval(config.getSchedulerInterval())
            .lastRunStartedAt(lastRunStartedAt)
            .lastRunFinishedAt(last == null ? null : last.getFinishedAt())
            .lastRunOutcome(last == null ? null : last.getOutcome())
            .lastRunSummary(last == null ? null : last.getSummary())
            .lastRunError(last != null && last.getOutcome() == BillingRunResult.Outcome.FAILED ? last.getMessage() : null)
            .lastSkippedAt(lastSkippedAt)
            .skippedRuns(skippedRuns.get())
            .build();
    }

    private void scheduledRun() {
        triggerBillingCycles();
    }

    @NonNull
    private BillingRunResult runExclusively(@NonNull String name, @NonNull BillingRun run) {
        if (!runInFlight.compareAndSet(false, true)) {
            skippedRuns.incrementAndGet();
            lastSkippedAt = now();
            log.info("skipping {}, another billing run is in flight", name);
            return BillingRunResult.builder()
                .skipped(true)
                .outcome(BillingRunResult.Outcome.SKIPPED)
                .message("another billing run is in flight")
                .build();
        }

        val startedAt = now();
        lastRunStartedAt = startedAt;
        log.info("starting {}", name);
        BillingRunResult result;
        try {
            result = BillingRunResult.builder()
                .outcome(BillingRunResult.Outcome.COMPLETED)
                .startedAt(startedAt)
                .summary(run.run())
                .finishedAt(now())
                .build();

            log.info("finished {}", name);
            lastRun = result;
        } catch (Exception e) {
            log.error("{} failed", name, e);
            result = BillingRunResult.builder()
                .outcome(BillingRunResult.Outcome.FAILED)
                .startedAt(startedAt)
                .finishedAt(now())
                .message(e.getMessage())
                .build();

            lastRun = result;
        } finally {
            runInFlight.set(false);
        }

        return result;
    }

    @NonNull
    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    @FunctionalInterface
    private interface BillingRun {

        BillingPassSummary run() throws Exception;
    }
}

package com.mailflow.api.billing;

import lombok.NonNull;
import lombok.val;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Spring Beans used by the billing package.
 */
@Configuration
class BillingBeans {

    static final String BILLING_TASK_SCHEDULER = "billingTaskScheduler";

    /**
     * Runs scheduled and on-demand billing passes off the request threads.
     */
    @NonNull
    @Bean(name = BILLING_TASK_SCHEDULER)
    ThreadPoolTaskScheduler billingTaskScheduler() {
        val scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("billing-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}

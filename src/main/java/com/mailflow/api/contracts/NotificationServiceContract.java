package com.mailflow.api.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Defines a service contract for the notification service to deliver billing notifications on
 * behalf of the billing service. Delivery is fire-and-forget: the billing service never waits on
 * or retries a notification.
 */
public interface NotificationServiceContract {

    /**
     * Queues a billing notification for delivery to the tenant's billing contacts.
     *
     * @param notification a not {@literal null} notification.
     */
    void sendBillingNotification(@NonNull BillingNotification notification);

    enum NotificationType {
        INVOICE_GENERATED,
        PAYMENT_SUCCEEDED,
        PAYMENT_FAILED,
        PAYMENT_RETRIES_EXHAUSTED,
        SUBSCRIPTION_PLAN_CHANGED,
        SUBSCRIPTION_CANCELLED,
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class BillingNotification {

        @NonNull
        private NotificationType type;

        @NonNull
        private String tenantId;

        private Long subscriptionId;

        private Long invoiceId;

        private String invoiceNumber;

        private BigDecimal amount;

        private String currency;

        private String message;

        private Map<String, String> metadata;
    }
}

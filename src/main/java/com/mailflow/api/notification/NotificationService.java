package com.mailflow.api.notification;

import com.mailflow.api.contracts.NotificationServiceContract;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link NotificationService} records billing notifications in the application log. Tenant
 * facing delivery (e-mail, in-app messages) is owned by the messaging service, which tails these
 * records.
 */
@Service
@Slf4j
class NotificationService implements NotificationServiceContract {

    @Override
    public void sendBillingNotification(@NonNull BillingNotification notification) {
        log.info(
            "billing notification: type={} tenant={} subscription={} invoice={} amount={} {} {}",
            notification.getType(),
            notification.getTenantId(),
            notification.getSubscriptionId(),
            notification.getInvoiceNumber(),
            notification.getAmount(),
            notification.getCurrency(),
            notification.getMessage() == null ? "" : notification.getMessage());
    }
}

package com.mailflow.api.subscription.exceptions;

/**
 * Thrown by createSubscription operation in SubscriptionService if the tenant already has a
 * subscription that isn't cancelled.
 */
public class DuplicateSubscriptionException extends Exception {

    public DuplicateSubscriptionException(String tenantId) {
        super("tenant already has a subscription: " + tenantId);
    }
}

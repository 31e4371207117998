package com.mailflow.api.subscription.exceptions;

/**
 * Thrown by SubscriptionService operations when the tenant (or id) has no matching subscription.
 */
public class SubscriptionNotFoundException extends Exception {

    public SubscriptionNotFoundException(String message) {
        super(message);
    }
}

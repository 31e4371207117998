package com.mailflow.api.subscription.exceptions;

/**
 * Thrown by plan change operations in SubscriptionService when the subscription's state doesn't
 * permit the change.
 */
public class SubscriptionStateException extends Exception {

    public SubscriptionStateException(String message) {
        super(message);
    }
}

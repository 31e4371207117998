package com.mailflow.api.subscription.exceptions;

/**
 * Thrown by SubscriptionService operations when the requested plan doesn't exist or is no longer
 * offered.
 */
public class SubscriptionPlanNotFoundException extends Exception {

    public SubscriptionPlanNotFoundException(long planId) {
        super("subscription plan not found: " + planId);
    }
}

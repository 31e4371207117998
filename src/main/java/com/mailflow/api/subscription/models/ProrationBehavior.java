package com.mailflow.api.subscription.models;

/**
 * How an upgrade in the middle of a billing period settles the price difference.
 */
public enum ProrationBehavior {

    /**
     * Bill the difference on an out-of-cycle invoice right away.
     */
    IMMEDIATE_CHARGE,

    /**
     * Add the difference to the next cycle invoice.
     */
    DEFER,
}

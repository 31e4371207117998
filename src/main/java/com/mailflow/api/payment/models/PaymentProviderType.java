package com.mailflow.api.payment.models;

/**
 * External payment providers that the payment dispatcher can route charges to.
 */
public enum PaymentProviderType {
    STRIPE,
    SQUARE,
}

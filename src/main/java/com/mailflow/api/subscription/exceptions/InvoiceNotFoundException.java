package com.mailflow.api.subscription.exceptions;

/**
 * Thrown by invoice operations in SubscriptionService when the invoice doesn't exist.
 */
public class InvoiceNotFoundException extends Exception {

    public InvoiceNotFoundException(long invoiceId) {
        super("invoice not found: " + invoiceId);
    }
}

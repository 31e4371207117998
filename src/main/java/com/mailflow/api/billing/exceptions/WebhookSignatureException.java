package com.mailflow.api.billing.exceptions;

/**
 * Thrown by handleWebhookEvent operation in BillingService if the payment provider's signature
 * doesn't match the payload.
 */
public class WebhookSignatureException extends Exception {

    public WebhookSignatureException(String message) {
        super(message);
    }
}

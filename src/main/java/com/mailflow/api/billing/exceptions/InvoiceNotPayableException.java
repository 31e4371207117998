package com.mailflow.api.billing.exceptions;

/**
 * Thrown by processInvoicePayment operation in BillingService if the invoice isn't open or has
 * nothing due.
 */
public class InvoiceNotPayableException extends Exception {

    public InvoiceNotPayableException(String message) {
        super(message);
    }

    public InvoiceNotPayableException(String message, Throwable cause) {
        super(message, cause);
    }
}

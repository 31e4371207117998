package com.mailflow.api.payment.exceptions;

import com.mailflow.api.payment.models.PaymentErrorKind;
import lombok.Getter;
import lombok.NonNull;

/**
 * Thrown by provider adapters when a provider side operation, other than a charge, fails.
 */
@Getter
public class PaymentProviderException extends Exception {

    private final PaymentErrorKind errorKind;

    public PaymentProviderException(@NonNull PaymentErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}

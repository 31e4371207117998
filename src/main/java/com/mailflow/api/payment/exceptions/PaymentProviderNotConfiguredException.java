package com.mailflow.api.payment.exceptions;

import com.mailflow.api.payment.models.PaymentProviderType;
import lombok.NonNull;

/**
 * Thrown by the payment dispatcher when an operation targets a provider that isn't registered, or
 * when no provider is active at all. It indicates a deployment error and isn't meant to be handled.
 */
public class PaymentProviderNotConfiguredException extends RuntimeException {

    public PaymentProviderNotConfiguredException(@NonNull PaymentProviderType type) {
        super(String.format("payment provider '%s' is not configured", type));
    }

    public PaymentProviderNotConfiguredException(@NonNull String message) {
        super(message);
    }
}

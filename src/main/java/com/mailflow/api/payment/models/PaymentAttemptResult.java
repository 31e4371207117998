package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * The outcome of a single charge attempt against a single provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAttemptResult {

    private boolean success;

    @NonNull
    private PaymentProviderType provider;

    /**
     * Provider assigned id of the payment. Present on success, and on failures where the provider
     * recorded a failed payment.
     */
    private String paymentId;

    private BigDecimal amount;

    private String currency;

    private PaymentErrorKind errorKind;

    private String errorMessage;

    @NonNull
    public static PaymentAttemptResult succeeded(
        @NonNull PaymentProviderType provider,
        @NonNull String paymentId,
        @NonNull BigDecimal amount,
        @NonNull String currency
    ) {
        return PaymentAttemptResult.builder()
            .success(true)
            .provider(provider)
            .paymentId(paymentId)
            .amount(amount)
            .currency(currency)
            .build();
    }

    @NonNull
    public static PaymentAttemptResult failed(
        @NonNull PaymentProviderType provider,
        @NonNull PaymentErrorKind errorKind,
        String errorMessage
    ) {
        return PaymentAttemptResult.builder()
            .success(false)
            .provider(provider)
            .errorKind(errorKind)
            .errorMessage(errorMessage)
            .build();
    }
}

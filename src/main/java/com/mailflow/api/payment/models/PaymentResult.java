package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * The consolidated outcome of a dispatched payment. On failure, {@link #getErrorKind()} is the
 * reason reported by the primary provider, or the fraud or validation verdict if no provider was
 * contacted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResult {

    private boolean success;

    /**
     * The provider that charged the customer on success, or the primary provider on failure.
     * {@literal null} if no provider was contacted.
     */
    private PaymentProviderType provider;

    private String paymentId;

    private BigDecimal amount;

    private String currency;

    private PaymentErrorKind errorKind;

    private String errorMessage;

    private FraudAssessment fraudAssessment;

    /**
     * Provider attempts in the order they were made. Never more than two.
     */
    @Builder.Default
    private List<PaymentAttemptResult> attempts = List.of();
}

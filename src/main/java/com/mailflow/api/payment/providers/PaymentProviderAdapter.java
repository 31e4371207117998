package com.mailflow.api.payment.providers;

import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.models.CustomerData;
import com.mailflow.api.payment.models.PaymentAttemptResult;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.models.ProviderOperationResult;
import com.mailflow.api.payment.models.ProviderSubscriptionRequest;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * A uniform surface over an external payment provider. Implementations receive their credentials
 * at construction and hold no other state, so a single instance serves concurrent callers.
 */
public interface PaymentProviderAdapter {

    @NonNull
    PaymentProviderType getType();

    /**
     * Charges the customer referenced by the request. It forwards the request's idempotency key to
     * the provider so that retrying the same request never charges twice.
     *
     * @param request a not {@literal null} validated payment request.
     * @return the outcome of the charge. Provider errors are reported through {@link
     * PaymentAttemptResult#getErrorKind()} and never thrown.
     */
    @NonNull
    PaymentAttemptResult charge(@NonNull PaymentRequest request);

    /**
     * Refunds a payment, fully if {@code amount} is {@literal null}.
     *
     * @param paymentId provider assigned id of the payment.
     * @param amount    amount to refund in the payment's currency, or {@literal null}.
     * @param currency  currency of the payment.
     */
    @NonNull
    ProviderOperationResult refund(@NonNull String paymentId, BigDecimal amount, @NonNull String currency);

    @NonNull
    ProviderOperationResult createCustomer(@NonNull CustomerData customer);

    @NonNull
    ProviderOperationResult createSubscription(@NonNull ProviderSubscriptionRequest request);

    /**
     * Immediately cancels a provider side subscription. Cancelling an already cancelled
     * subscription is not an error.
     *
     * @throws PaymentProviderException if the provider rejects or fails the request.
     */
    void cancelSubscription(@NonNull String providerSubscriptionId) throws PaymentProviderException;

    /**
     * Verifies that a webhook payload was signed by the provider with the configured webhook
     * secret. It performs no I/O.
     *
     * @param rawPayload      the exact request body as received.
     * @param signatureHeader the provider's signature header value.
     * @return {@literal true} if the signature is valid. {@literal false} if it doesn't match or if
     * any input is missing or malformed.
     */
    boolean validateWebhookSignature(String rawPayload, String signatureHeader);
}

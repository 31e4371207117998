package com.mailflow.api.payment.providers;

import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.models.CustomerData;
import com.mailflow.api.payment.models.PaymentAttemptResult;
import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.models.ProviderOperationResult;
import com.mailflow.api.payment.models.ProviderSubscriptionRequest;
import com.mailflow.api.payment.upstream.StripeApi;
import com.mailflow.api.platform.Money;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.ApiException;
import com.stripe.exception.CardException;
import com.stripe.exception.IdempotencyException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.exception.StripeException;
import com.stripe.net.Webhook;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;

import java.math.BigDecimal;

/**
 * {@link PaymentProviderAdapter} for Stripe. Charges are off-session PaymentIntents confirmed at
 * creation.
 */
@Slf4j
public class StripeProviderAdapter implements PaymentProviderAdapter {

    /**
     * Maximum age of a webhook signature timestamp, in seconds.
     */
    static final long WEBHOOK_TOLERANCE_SECONDS = 300L;

    private final StripeApi stripeApi;
    private final String webhookSecret;

    public StripeProviderAdapter(@NonNull StripeApi stripeApi, @NonNull String webhookSecret) {
        this.stripeApi = stripeApi;
        this.webhookSecret = webhookSecret;
    }

    @NonNull
    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.STRIPE;
    }

    @NonNull
    @Override
    public PaymentAttemptResult charge(@NonNull PaymentRequest request) {
        if (request.getCustomerRef() == null) {
            return PaymentAttemptResult.failed(getType(), PaymentErrorKind.INVALID_REQUEST, "customer reference is required");
        }

        try {
            val intent = stripeApi.createPaymentIntent(
                Money.toMinorUnits(request.getAmount(), request.getCurrency()),
                request.getCurrency(),
                request.getCustomerRef(),
                request.getPaymentMethodRef(),
                request.getDescription(),
                request.getMetadata(),
                request.getIdempotencyKey());

            if ("succeeded".equals(intent.getStatus())) {
                return PaymentAttemptResult.succeeded(getType(), intent.getId(), request.getAmount(), request.getCurrency());
            }

            // anything else needs the customer to act (e.g. 3DS), which an off-session charge can't do.
            val result = PaymentAttemptResult.failed(
                getType(),
                PaymentErrorKind.CARD_DECLINED,
                String.format("payment intent requires customer action (status: %s)", intent.getStatus()));

            result.setPaymentId(intent.getId());
            return result;
        } catch (StripeException e) {
            log.debug("stripe charge failed", e);
            return PaymentAttemptResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult refund(@NonNull String paymentId, BigDecimal amount, @NonNull String currency) {
        try {
            val refund = stripeApi.createRefund(paymentId, amount == null ? null : Money.toMinorUnits(amount, currency));
            return ProviderOperationResult.succeeded(getType(), refund.getId(), refund.getStatus());
        } catch (StripeException e) {
            log.debug("stripe refund failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult createCustomer(@NonNull CustomerData customer) {
        try {
            val created = stripeApi.createCustomer(customer.getEmail(), customer.getName(), customer.getMetadata());
            return ProviderOperationResult.succeeded(getType(), created.getId(), null);
        } catch (StripeException e) {
            log.debug("stripe customer creation failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult createSubscription(@NonNull ProviderSubscriptionRequest request) {
        try {
            val subscription = stripeApi.createSubscription(
                request.getCustomerRef(),
                request.getProviderPlanRef(),
                request.getTrialDays() == null || request.getTrialDays() < 1 ? null : request.getTrialDays().longValue(),
                request.getMetadata(),
                request.getIdempotencyKey());

            return ProviderOperationResult.succeeded(getType(), subscription.getId(), subscription.getStatus());
        } catch (StripeException e) {
            log.debug("stripe subscription creation failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @Override
    public void cancelSubscription(@NonNull String providerSubscriptionId) throws PaymentProviderException {
        try {
            stripeApi.cancelSubscription(providerSubscriptionId);
        } catch (StripeException e) {
            throw new PaymentProviderException(classify(e), "stripe api error", e);
        }
    }

    @Override
    public boolean validateWebhookSignature(String rawPayload, String signatureHeader) {
        if (rawPayload == null || signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }

        try {
            return Webhook.Signature.verifyHeader(rawPayload, signatureHeader, webhookSecret, WEBHOOK_TOLERANCE_SECONDS);
        } catch (SignatureVerificationException | IllegalArgumentException e) {
            log.trace("stripe webhook signature verification failed", e);
            return false;
        }
    }

    @NonNull
    static PaymentErrorKind classify(@NonNull StripeException e) {
        if (e instanceof CardException) {
            return PaymentErrorKind.CARD_DECLINED;
        }

        // RateLimitException is a subtype of InvalidRequestException.
        if (e instanceof ApiConnectionException || e instanceof RateLimitException || e instanceof ApiException) {
            return PaymentErrorKind.PROVIDER_UNAVAILABLE;
        }

        if (e instanceof InvalidRequestException || e instanceof IdempotencyException) {
            return PaymentErrorKind.INVALID_REQUEST;
        }

        return PaymentErrorKind.UNKNOWN;
    }
}

package com.mailflow.api.payment.providers;

import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.models.CustomerData;
import com.mailflow.api.payment.models.PaymentAttemptResult;
import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.models.ProviderOperationResult;
import com.mailflow.api.payment.models.ProviderSubscriptionRequest;
import com.mailflow.api.payment.upstream.SquareApi;
import com.mailflow.api.platform.Money;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * {@link PaymentProviderAdapter} for Square. Charges are payments from a card on file, completed
 * at creation.
 */
@Slf4j
public class SquareProviderAdapter implements PaymentProviderAdapter {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final SquareApi squareApi;
    private final String webhookSignatureKey;
    private final String webhookNotificationUrl;

    /**
     * @param webhookNotificationUrl the exact url that Square delivers webhooks to. Square signs
     *                               it together with the payload.
     */
    public SquareProviderAdapter(
        @NonNull SquareApi squareApi,
        @NonNull String webhookSignatureKey,
        @NonNull String webhookNotificationUrl
    ) {
        this.squareApi = squareApi;
        this.webhookSignatureKey = webhookSignatureKey;
        this.webhookNotificationUrl = webhookNotificationUrl;
    }

    @NonNull
    @Override
    public PaymentProviderType getType() {
        return PaymentProviderType.SQUARE;
    }

    @NonNull
    @Override
    public PaymentAttemptResult charge(@NonNull PaymentRequest request) {
        if (request.getCustomerRef() == null || request.getPaymentMethodRef() == null) {
            return PaymentAttemptResult.failed(getType(), PaymentErrorKind.INVALID_REQUEST, "customer and card on file references are required");
        }

        try {
            val payment = squareApi.createPayment(
                Money.toMinorUnits(request.getAmount(), request.getCurrency()),
                request.getCurrency(),
                request.getPaymentMethodRef(),
                request.getCustomerRef(),
                request.getDescription(),
                request.getMetadata() == null ? null : request.getMetadata().get("invoiceId"),
                request.getIdempotencyKey());

            val paymentId = payment.path("id").asText(null);
            val status = payment.path("status").asText("");
            if (paymentId != null && "COMPLETED".equals(status)) {
                return PaymentAttemptResult.succeeded(getType(), paymentId, request.getAmount(), request.getCurrency());
            }

            val result = PaymentAttemptResult.failed(
                getType(),
                PaymentErrorKind.CARD_DECLINED,
                String.format("payment was not completed (status: %s)", status));

            result.setPaymentId(paymentId);
            return result;
        } catch (RestClientException e) {
            log.debug("square charge failed", e);
            return PaymentAttemptResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult refund(@NonNull String paymentId, BigDecimal amount, @NonNull String currency) {
        try {
            final long minorAmount;
            if (amount != null) {
                minorAmount = Money.toMinorUnits(amount, currency);
            } else {
                minorAmount = squareApi.getPayment(paymentId).path("amount_money").path("amount").asLong();
            }

            val refund = squareApi.refundPayment(
                paymentId,
                minorAmount,
                currency,
                String.format("refund-%s-%d", paymentId, minorAmount));

            return ProviderOperationResult.succeeded(getType(), refund.path("id").asText(""), refund.path("status").asText(null));
        } catch (RestClientException e) {
            log.debug("square refund failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult createCustomer(@NonNull CustomerData customer) {
        try {
            val created = squareApi.createCustomer(
                customer.getEmail(),
                customer.getName(),
                customer.getTenantId(),
                "customer-" + customer.getTenantId());

            return ProviderOperationResult.succeeded(getType(), created.path("id").asText(""), null);
        } catch (RestClientException e) {
            log.debug("square customer creation failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @NonNull
    @Override
    public ProviderOperationResult createSubscription(@NonNull ProviderSubscriptionRequest request) {
        try {
            val subscription = squareApi.createSubscription(
                request.getCustomerRef(),
                request.getProviderPlanRef(),
                request.getIdempotencyKey());

            return ProviderOperationResult.succeeded(
                getType(),
                subscription.path("id").asText(""),
                subscription.path("status").asText(null));
        } catch (RestClientException e) {
            log.debug("square subscription creation failed", e);
            return ProviderOperationResult.failed(getType(), classify(e), e.getMessage());
        }
    }

    @Override
    public void cancelSubscription(@NonNull String providerSubscriptionId) throws PaymentProviderException {
        try {
            squareApi.cancelSubscription(providerSubscriptionId);
        } catch (RestClientException e) {
            throw new PaymentProviderException(classify(e), "square api error", e);
        }
    }

    /**
     * Square signs webhooks with a Base64 encoded HMAC-SHA256 of the notification url followed by
     * the raw body.
     */
    @Override
    public boolean validateWebhookSignature(String rawPayload, String signatureHeader) {
        if (rawPayload == null || signatureHeader == null || signatureHeader.isBlank()) {
            return false;
        }

        final byte[] expected;
        try {
            val mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(webhookSignatureKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            expected = Base64.getEncoder()
                .encode(mac.doFinal((webhookNotificationUrl + rawPayload).getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is a mandatory JCA algorithm.
            throw new IllegalStateException("hmac calculation failed", e);
        }

        // constant-time compare
        return MessageDigest.isEqual(expected, signatureHeader.trim().getBytes(StandardCharsets.UTF_8));
    }

    @NonNull
    static PaymentErrorKind classify(@NonNull RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return PaymentErrorKind.PROVIDER_UNAVAILABLE;
        }

        if (!(e instanceof RestClientResponseException)) {
            return PaymentErrorKind.UNKNOWN;
        }

        val status = ((RestClientResponseException) e).getStatusCode();
        if (status.is5xxServerError() || status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return PaymentErrorKind.PROVIDER_UNAVAILABLE;
        }

        if (status.value() == HttpStatus.PAYMENT_REQUIRED.value()) {
            return PaymentErrorKind.CARD_DECLINED;
        }

        if (status.value() == HttpStatus.UNAUTHORIZED.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
            return PaymentErrorKind.UNKNOWN;
        }

        return status.is4xxClientError() ? PaymentErrorKind.INVALID_REQUEST : PaymentErrorKind.UNKNOWN;
    }
}

package com.mailflow.api.payment;

import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.exceptions.PaymentProviderNotConfiguredException;
import com.mailflow.api.payment.models.CustomerData;
import com.mailflow.api.payment.models.FraudAssessment;
import com.mailflow.api.payment.models.PaymentAttemptResult;
import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.models.PaymentResult;
import com.mailflow.api.payment.models.ProviderOperationResult;
import com.mailflow.api.payment.models.ProviderSubscriptionRequest;
import com.mailflow.api.platform.Money;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link PaymentDispatcher} routes payment operations to the registered provider adapters. Charges
 * pass a fraud screen first, go to the preferred (or highest priority) active provider, and move to
 * one other active provider if the first one is unavailable.
 */
@Service
@Slf4j
public class PaymentDispatcher {

    private final ProviderRegistry registry;
    private final FraudScreen fraudScreen;
    private final PaymentConfiguration paymentConfig;
    private final ExecutorService chargeExecutor;

    @Autowired
    PaymentDispatcher(
        @NonNull ProviderRegistry registry,
        @NonNull FraudScreen fraudScreen,
        @NonNull PaymentConfiguration paymentConfig,
        @NonNull @Qualifier(PaymentBeans.CHARGE_EXECUTOR) ExecutorService chargeExecutor
    ) {
        this.registry = registry;
        this.fraudScreen = fraudScreen;
        this.paymentConfig = paymentConfig;
        this.chargeExecutor = chargeExecutor;
    }

    /**
     * <p>
     * Charges a customer.</p>
     *
     * <ol>
     *     <li>Rejects invalid requests (non-positive amount, unknown currency or missing customer)
     *     with {@link PaymentErrorKind#INVALID_REQUEST}.</li>
     *     <li>Declines requests that the fraud screen declines with {@link
     *     PaymentErrorKind#FRAUD_DECLINED}. Requests recommended for review proceed only if the
     *     request, or else the configuration, permits it.</li>
     *     <li>Charges through {@code preferredProvider} if it is registered and active, or through
     *     the highest priority active provider otherwise.</li>
     *     <li>If that provider is unavailable, charges through the highest priority active provider
     *     other than the first one. It never contacts more than two providers.</li>
     * </ol>
     *
     * <p>
     * No provider is contacted in the first two cases.</p>
     *
     * @param request           a not {@literal null} payment request.
     * @param preferredProvider an optional provider to try first.
     * @return the consolidated result. On failure, its error kind is the one reported by the first
     * provider.
     * @throws PaymentProviderNotConfiguredException if no provider is active.
     */
    @NonNull
    public PaymentResult processPayment(@NonNull PaymentRequest request, PaymentProviderType preferredProvider) {
        val validationError = validate(request);
        if (validationError != null) {
            log.debug("rejecting invalid payment request: {}", validationError);
            return rejected(request, PaymentErrorKind.INVALID_REQUEST, validationError, null);
        }

        val assessment = fraudScreen.assess(request);
        if (!isPermittedByFraudScreen(request, assessment)) {
            log.info("payment declined by fraud screen: score={} reasons={}", assessment.getScore(), assessment.getReasons());
            return rejected(request, PaymentErrorKind.FRAUD_DECLINED, "Payment declined due to fraud detection", assessment);
        }

        val active = registry.active();
        if (active.isEmpty()) {
            throw new PaymentProviderNotConfiguredException("no active payment provider is configured");
        }

        val primary = active.stream()
            .filter(r -> r.getType() == preferredProvider)
            .findFirst()
            .orElse(active.get(0));

        val attempts = new ArrayList<PaymentAttemptResult>(2);
        val first = chargeWithTimeout(primary, request);
        attempts.add(first);
        if (first.isSuccess()) {
            return succeeded(first, assessment, attempts);
        }

        if (first.getErrorKind() != null && first.getErrorKind().isFallbackEligible()) {
            val fallback = active.stream()
                .filter(r -> r.getType() != primary.getType())
                .findFirst()
                .orElse(null);

            if (fallback != null) {
                log.warn("payment provider {} unavailable, falling back to {}", primary.getType(), fallback.getType());
                val second = chargeWithTimeout(fallback, request);
                attempts.add(second);
                if (second.isSuccess()) {
                    return succeeded(second, assessment, attempts);
                }
            }
        }

        log.warn("payment failed on {}: {} ({})", primary.getType(), first.getErrorKind(), first.getErrorMessage());
        return PaymentResult.builder()
            .success(false)
            .provider(primary.getType())
            .paymentId(first.getPaymentId())
            .amount(request.getAmount())
            .currency(request.getCurrency())
            .errorKind(first.getErrorKind() == null ? PaymentErrorKind.UNKNOWN : first.getErrorKind())
            .errorMessage(first.getErrorMessage())
            .fraudAssessment(assessment)
            .attempts(List.copyOf(attempts))
            .build();
    }

    /**
     * Verifies a webhook signature with the given provider's adapter.
     *
     * @throws PaymentProviderNotConfiguredException if {@code type} is not registered.
     */
    public boolean validateWebhook(String rawPayload, String signature, @NonNull PaymentProviderType type) {
        return requireRegistered(type).getAdapter().validateWebhookSignature(rawPayload, signature);
    }

    /**
     * Refunds a payment on the provider that processed it, fully if {@code amount} is {@literal
     * null}.
     *
     * @throws PaymentProviderNotConfiguredException if {@code type} is not registered.
     */
    @NonNull
    public ProviderOperationResult refundPayment(
        @NonNull PaymentProviderType type,
        @NonNull String paymentId,
        BigDecimal amount,
        @NonNull String currency
    ) {
        return requireRegistered(type).getAdapter().refund(paymentId, amount, currency);
    }

    /**
     * @throws PaymentProviderNotConfiguredException if {@code type} is not registered.
     */
    @NonNull
    public ProviderOperationResult createCustomer(@NonNull PaymentProviderType type, @NonNull CustomerData customer) {
        return requireRegistered(type).getAdapter().createCustomer(customer);
    }

    /**
     * @throws PaymentProviderNotConfiguredException if {@code type} is not registered.
     */
    @NonNull
    public ProviderOperationResult createProviderSubscription(
        @NonNull PaymentProviderType type,
        @NonNull ProviderSubscriptionRequest request
    ) {
        return requireRegistered(type).getAdapter().createSubscription(request);
    }

    /**
     * @throws PaymentProviderException              if the provider fails to cancel the
     *                                               subscription.
     * @throws PaymentProviderNotConfiguredException if {@code type} is not registered.
     */
    public void cancelProviderSubscription(
        @NonNull PaymentProviderType type,
        @NonNull String providerSubscriptionId
    ) throws PaymentProviderException {
        requireRegistered(type).getAdapter().cancelSubscription(providerSubscriptionId);
    }

    /**
     * @return active provider types, highest priority first.
     */
    @NonNull
    public List<PaymentProviderType> getActiveProviders() {
        return registry.active().stream()
            .map(ProviderRegistration::getType)
            .toList();
    }

    @NonNull
    private PaymentAttemptResult chargeWithTimeout(@NonNull ProviderRegistration registration, @NonNull PaymentRequest request) {
        val type = registration.getType();
        val timeout = paymentConfig.getChargeTimeout();
        val future = chargeExecutor.submit(() -> registration.getAdapter().charge(request));
        try {
            val result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : PaymentAttemptResult.failed(type, PaymentErrorKind.UNKNOWN, "provider adapter returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return PaymentAttemptResult.failed(type, PaymentErrorKind.PROVIDER_UNAVAILABLE, timeoutMessage(timeout));
        } catch (ExecutionException e) {
            log.error("payment provider adapter {} threw while charging", type, e.getCause());
            return PaymentAttemptResult.failed(type, PaymentErrorKind.UNKNOWN, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return PaymentAttemptResult.failed(type, PaymentErrorKind.UNKNOWN, "interrupted while waiting for the provider");
        }
    }

    private boolean isPermittedByFraudScreen(@NonNull PaymentRequest request, @NonNull FraudAssessment assessment) {
        switch (assessment.getRecommendation()) {
            case APPROVE:
                return true;
            case REVIEW:
                return request.getProceedOnFraudReview() != null
                    ? request.getProceedOnFraudReview()
                    : paymentConfig.getFraud().isProceedOnReview();
            default:
                return false;
        }
    }

    @NonNull
    private ProviderRegistration requireRegistered(@NonNull PaymentProviderType type) {
        return registry.find(type).orElseThrow(() -> new PaymentProviderNotConfiguredException(type));
    }

    private static String validate(@NonNull PaymentRequest request) {
        if (request.getAmount().signum() <= 0) {
            return "amount must be positive";
        }

        if (!Money.isKnownCurrency(request.getCurrency())) {
            return "unknown currency: " + request.getCurrency();
        }

        if (request.getCustomerRef() == null || request.getCustomerRef().isBlank()) {
            return "customer reference is required";
        }

        if (request.getIdempotencyKey().isBlank()) {
            return "idempotency key is required";
        }

        return null;
    }

    @NonNull
    private static PaymentResult rejected(
        @NonNull PaymentRequest request,
        @NonNull PaymentErrorKind errorKind,
        @NonNull String message,
        FraudAssessment assessment
    ) {
        return PaymentResult.builder()
            .success(false)
            .amount(request.getAmount())
            .currency(request.getCurrency())
            .errorKind(errorKind)
            .errorMessage(message)
            .fraudAssessment(assessment)
            .build();
    }

    @NonNull
    private static PaymentResult succeeded(
        @NonNull PaymentAttemptResult attempt,
        @NonNull FraudAssessment assessment,
        @NonNull List<PaymentAttemptResult> attempts
    ) {
        return PaymentResult.builder()
            .success(true)
            .provider(attempt.getProvider())
            .paymentId(attempt.getPaymentId())
            .amount(attempt.getAmount())
            .currency(attempt.getCurrency())
            .fraudAssessment(assessment)
            .attempts(List.copyOf(attempts))
            .build();
    }

    @NonNull
    private static String timeoutMessage(@NonNull Duration timeout) {
        return String.format("provider did not respond within %d ms", timeout.toMillis());
    }
}

package com.mailflow.api.payment;

import com.mailflow.api.payment.exceptions.PaymentProviderNotConfiguredException;
import com.mailflow.api.payment.models.FraudAssessment;
import com.mailflow.api.payment.models.PaymentAttemptResult;
import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.providers.PaymentProviderAdapter;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaymentDispatcherTest {

    private static final Duration CHARGE_TIMEOUT = Duration.ofMillis(500);

    @Mock
    private PaymentProviderAdapter stripeAdapter;

    @Mock
    private PaymentProviderAdapter squareAdapter;

    private ExecutorService chargeExecutor;
    private PaymentConfiguration paymentConfig;

    @BeforeEach
    void setUp() {
        chargeExecutor = Executors.newCachedThreadPool();
        val policy = new PaymentConfiguration.FraudPolicy(15, 40, 70, new BigDecimal("100000"), false);
        paymentConfig = new PaymentConfiguration(CHARGE_TIMEOUT, List.of(), policy);
    }

    @AfterEach
    void tearDown() {
        chargeExecutor.shutdownNow();
    }

    @Test
    void processPayment_withHealthyPrimary() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.STRIPE, "pi_1", request.getAmount(), "USD"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertTrue(result.isSuccess());
        assertEquals(PaymentProviderType.STRIPE, result.getProvider());
        assertEquals("pi_1", result.getPaymentId());
        assertEquals(1, result.getAttempts().size());
        verifyNoInteractions(squareAdapter);
    }

    @Test
    void processPayment_withPreferredProvider() {
        val request = buildRequest("79.99");
        when(squareAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.SQUARE, "sq_1", request.getAmount(), "USD"));

        val result = buildDispatcher(true, true).processPayment(request, PaymentProviderType.SQUARE);

        assertTrue(result.isSuccess());
        assertEquals(PaymentProviderType.SQUARE, result.getProvider());
        verifyNoInteractions(stripeAdapter);
    }

    @Test
    void processPayment_withUnavailablePrimary() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.failed(PaymentProviderType.STRIPE, PaymentErrorKind.PROVIDER_UNAVAILABLE, "503"));
        when(squareAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.SQUARE, "sq_1", request.getAmount(), "USD"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertTrue(result.isSuccess());
        assertEquals(PaymentProviderType.SQUARE, result.getProvider());
        assertEquals(2, result.getAttempts().size());
        assertFalse(result.getAttempts().get(0).isSuccess());
    }

    @Test
    void processPayment_withDeclinedCard() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.failed(PaymentProviderType.STRIPE, PaymentErrorKind.CARD_DECLINED, "insufficient funds"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertFalse(result.isSuccess());
        assertEquals(PaymentErrorKind.CARD_DECLINED, result.getErrorKind());
        assertEquals(PaymentProviderType.STRIPE, result.getProvider());
        verify(squareAdapter, never()).charge(any());
    }

    @Test
    void processPayment_withAllProvidersUnavailable() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.failed(PaymentProviderType.STRIPE, PaymentErrorKind.PROVIDER_UNAVAILABLE, "stripe down"));
        when(squareAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.failed(PaymentProviderType.SQUARE, PaymentErrorKind.PROVIDER_UNAVAILABLE, "square down"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertFalse(result.isSuccess());
        assertEquals(PaymentErrorKind.PROVIDER_UNAVAILABLE, result.getErrorKind());
        assertEquals("stripe down", result.getErrorMessage());
        assertEquals(2, result.getAttempts().size());
        verify(stripeAdapter, times(1)).charge(request);
        verify(squareAdapter, times(1)).charge(request);
    }

    @Test
    void processPayment_withSlowPrimary() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request)).thenAnswer(invocation -> {
            Thread.sleep(CHARGE_TIMEOUT.toMillis() * 10);
            return PaymentAttemptResult.succeeded(PaymentProviderType.STRIPE, "pi_late", request.getAmount(), "USD");
        });

        when(squareAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.SQUARE, "sq_1", request.getAmount(), "USD"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertTrue(result.isSuccess());
        assertEquals(PaymentProviderType.SQUARE, result.getProvider());
        assertEquals(PaymentErrorKind.PROVIDER_UNAVAILABLE, result.getAttempts().get(0).getErrorKind());
    }

    @Test
    void processPayment_withThrowingAdapter() {
        val request = buildRequest("79.99");
        when(stripeAdapter.charge(request)).thenThrow(new IllegalStateException("bug"));

        val result = buildDispatcher(true, false).processPayment(request, null);

        assertFalse(result.isSuccess());
        assertEquals(PaymentErrorKind.UNKNOWN, result.getErrorKind());
    }

    @Test
    void processPayment_withInvalidRequest() {
        val dispatcher = buildDispatcher(true, true);

        val zeroAmount = dispatcher.processPayment(buildRequest("0"), null);
        assertFalse(zeroAmount.isSuccess());
        assertEquals(PaymentErrorKind.INVALID_REQUEST, zeroAmount.getErrorKind());

        val unknownCurrency = buildRequest("10");
        unknownCurrency.setCurrency("XYZ1");
        assertEquals(PaymentErrorKind.INVALID_REQUEST, dispatcher.processPayment(unknownCurrency, null).getErrorKind());

        val noCustomer = buildRequest("10");
        noCustomer.setCustomerRef(" ");
        assertEquals(PaymentErrorKind.INVALID_REQUEST, dispatcher.processPayment(noCustomer, null).getErrorKind());

        verifyNoInteractions(stripeAdapter, squareAdapter);
    }

    @Test
    void processPayment_withFraudulentRequest() {
        val request = buildRequest("79.99");
        request.setMetadata(Map.of(FraudScreen.BLACKLISTED, "true"));

        val result = buildDispatcher(true, true).processPayment(request, null);

        assertFalse(result.isSuccess());
        assertEquals(PaymentErrorKind.FRAUD_DECLINED, result.getErrorKind());
        assertNotNull(result.getFraudAssessment());
        verifyNoInteractions(stripeAdapter, squareAdapter);
    }

    @Test
    void processPayment_withFraudReview() {
        // an unusual currency lands in the review band.
        val request = buildRequest("79.99");
        request.setCurrency("INR");

        val dispatcher = buildDispatcher(true, false);
        assertEquals(PaymentErrorKind.FRAUD_DECLINED, dispatcher.processPayment(request, null).getErrorKind());

        request.setProceedOnFraudReview(true);
        when(stripeAdapter.charge(request))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.STRIPE, "pi_1", request.getAmount(), "INR"));

        assertTrue(dispatcher.processPayment(request, null).isSuccess());
    }

    @ParameterizedTest(name = "{index} - {0} {1}")
    @CsvSource({
        "79.99, INR",
        "12000, JPY",
        "6000, USD",
        "49, CHF",
    })
    void processPayment_withReviewedRecurringCharge(String amount, String currency) {
        // the shipped policy lets reviewed charges through and declines only on a decline recommendation.
        val policy = new PaymentConfiguration.FraudPolicy(15, 40, 70, new BigDecimal("100000"), true);
        paymentConfig = new PaymentConfiguration(CHARGE_TIMEOUT, List.of(), policy);

        val request = buildRequest(amount);
        request.setCurrency(currency);
        when(stripeAdapter.charge(any()))
            .thenReturn(PaymentAttemptResult.succeeded(PaymentProviderType.STRIPE, "pi_1", request.getAmount(), currency));

        val result = buildDispatcher(true, false).processPayment(request, null);

        assertTrue(result.isSuccess());
        assertEquals(FraudAssessment.Recommendation.REVIEW, result.getFraudAssessment().getRecommendation());
        verify(stripeAdapter).charge(any());
    }

    @Test
    void processPayment_withoutActiveProviders() {
        val dispatcher = buildDispatcher(false, false);
        assertThrows(PaymentProviderNotConfiguredException.class, () -> dispatcher.processPayment(buildRequest("10"), null));
    }

    @Test
    void validateWebhook() {
        when(stripeAdapter.validateWebhookSignature("{}", "sig")).thenReturn(true);

        val dispatcher = new PaymentDispatcher(
            new ProviderRegistry(List.of(registration(PaymentProviderType.STRIPE, 0, true, stripeAdapter))),
            new FraudScreen(paymentConfig),
            paymentConfig,
            chargeExecutor);

        assertTrue(dispatcher.validateWebhook("{}", "sig", PaymentProviderType.STRIPE));
        assertThrows(PaymentProviderNotConfiguredException.class, () -> dispatcher.validateWebhook("{}", "sig", PaymentProviderType.SQUARE));
    }

    @Test
    void getActiveProviders() {
        assertEquals(List.of(PaymentProviderType.STRIPE, PaymentProviderType.SQUARE), buildDispatcher(true, true).getActiveProviders());
        assertEquals(List.of(PaymentProviderType.SQUARE), buildDispatcher(false, true).getActiveProviders());
    }

    @NonNull
    private PaymentDispatcher buildDispatcher(boolean isStripeActive, boolean isSquareActive) {
        val registry = new ProviderRegistry(List.of(
            registration(PaymentProviderType.SQUARE, 1, isSquareActive, squareAdapter),
            registration(PaymentProviderType.STRIPE, 0, isStripeActive, stripeAdapter)));

        return new PaymentDispatcher(registry, new FraudScreen(paymentConfig), paymentConfig, chargeExecutor);
    }

    @NonNull
    private static ProviderRegistration registration(
        @NonNull PaymentProviderType type,
        int priority,
        boolean isActive,
        @NonNull PaymentProviderAdapter adapter
    ) {
        return ProviderRegistration.builder()
            .type(type)
            .priority(priority)
            .active(isActive)
            .adapter(adapter)
            .build();
    }

    @NonNull
    private static PaymentRequest buildRequest(String amount) {
        return PaymentRequest.builder()
            .amount(new BigDecimal(amount))
            .currency("USD")
            .customerRef("cus_test")
            .paymentMethodRef("pm_test")
            .description("test charge")
            .idempotencyKey("invoice-1-attempt-1")
            .build();
    }
}

package com.mailflow.api.payment.providers;

import com.mailflow.api.payment.exceptions.PaymentProviderException;
import com.mailflow.api.payment.models.PaymentErrorKind;
import com.mailflow.api.payment.models.PaymentRequest;
import com.mailflow.api.payment.upstream.StripeApi;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.CardException;
import com.stripe.exception.InvalidRequestException;
import com.stripe.exception.RateLimitException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.net.Webhook;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StripeProviderAdapterTest {

    private static final String WEBHOOK_SECRET = "whsec_test";

    @Mock
    private StripeApi stripeApi;

    private StripeProviderAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new StripeProviderAdapter(stripeApi, WEBHOOK_SECRET);
    }

    @Test
    void charge() throws StripeException {
        val intent = new PaymentIntent();
        intent.setId("pi_test");
        intent.setStatus("succeeded");

        val request = buildRequest();
        when(stripeApi.createPaymentIntent(7999L, "USD", "cus_test", "pm_test", "Invoice INV-1", Map.of("invoiceId", "1"), "invoice-1-attempt-1"))
            .thenReturn(intent);

        val result = adapter.charge(request);
        assertTrue(result.isSuccess());
        assertEquals("pi_test", result.getPaymentId());
        assertEquals(new BigDecimal("79.99"), result.getAmount());
    }

    @Test
    void charge_withIntentRequiringAction() throws StripeException {
        val intent = new PaymentIntent();
        intent.setId("pi_test");
        intent.setStatus("requires_action");
        when(stripeApi.createPaymentIntent(anyLong(), anyString(), anyString(), any(), any(), any(), anyString()))
            .thenReturn(intent);

        val result = adapter.charge(buildRequest());
        assertFalse(result.isSuccess());
        assertEquals(PaymentErrorKind.CARD_DECLINED, result.getErrorKind());
        assertEquals("pi_test", result.getPaymentId());
    }

    @ParameterizedTest(name = "{index} - {0} -> {1}")
    @MethodSource("chargeErrorTestCases")
    void charge_withStripeError(Class<? extends StripeException> errorType, PaymentErrorKind expectedErrorKind) throws StripeException {
        when(stripeApi.createPaymentIntent(anyLong(), anyString(), anyString(), any(), any(), any(), anyString()))
            .thenThrow(mock(errorType));

        val result = adapter.charge(buildRequest());
        assertFalse(result.isSuccess());
        assertEquals(expectedErrorKind, result.getErrorKind());
    }

    static Stream<Arguments> chargeErrorTestCases() {
        return Stream.of(
            // error type, expected error kind
            arguments(CardException.class, PaymentErrorKind.CARD_DECLINED),
            arguments(ApiConnectionException.class, PaymentErrorKind.PROVIDER_UNAVAILABLE),
            arguments(RateLimitException.class, PaymentErrorKind.PROVIDER_UNAVAILABLE),
            arguments(InvalidRequestException.class, PaymentErrorKind.INVALID_REQUEST)
        );
    }

    @Test
    void cancelSubscription() throws StripeException {
        assertDoesNotThrow(() -> adapter.cancelSubscription("sub_ok"));
        verify(stripeApi).cancelSubscription("sub_ok");

        doThrow(new ApiConnectionException("stripe is down")).when(stripeApi).cancelSubscription(eq("sub_down"));
        val e = assertThrows(PaymentProviderException.class, () -> adapter.cancelSubscription("sub_down"));
        assertEquals(PaymentErrorKind.PROVIDER_UNAVAILABLE, e.getErrorKind());
    }

    @Test
    void validateWebhookSignature() throws Exception {
        val payload = "{\"id\":\"evt_test\",\"type\":\"payment_intent.succeeded\"}";
        val timestamp = Webhook.Util.getTimeNow();
        val signature = Webhook.Util.computeHmacSha256(WEBHOOK_SECRET, timestamp + "." + payload);
        val header = String.format("t=%d,v1=%s", timestamp, signature);

        assertTrue(adapter.validateWebhookSignature(payload, header));
        assertFalse(adapter.validateWebhookSignature(payload + " ", header));
        assertFalse(adapter.validateWebhookSignature(payload, "t=1,v1=deadbeef"));
        assertFalse(adapter.validateWebhookSignature(payload, "malformed"));
        assertFalse(adapter.validateWebhookSignature(payload, null));
        assertFalse(adapter.validateWebhookSignature(null, header));
    }

    @Test
    void validateWebhookSignature_withStaleTimestamp() throws Exception {
        val payload = "{\"id\":\"evt_test\",\"type\":\"payment_intent.succeeded\"}";
        val recent = Webhook.Util.getTimeNow() - StripeProviderAdapter.WEBHOOK_TOLERANCE_SECONDS + 30;
        val stale = Webhook.Util.getTimeNow() - StripeProviderAdapter.WEBHOOK_TOLERANCE_SECONDS - 30;

        assertTrue(adapter.validateWebhookSignature(payload, signedHeader(payload, recent)));
        assertFalse(adapter.validateWebhookSignature(payload, signedHeader(payload, stale)));
    }

    private static String signedHeader(String payload, long timestamp) throws Exception {
        val signature = Webhook.Util.computeHmacSha256(WEBHOOK_SECRET, timestamp + "." + payload);
        return String.format("t=%d,v1=%s", timestamp, signature);
    }

    private static PaymentRequest buildRequest() {
        return PaymentRequest.builder()
            .amount(new BigDecimal("79.99"))
            .currency("USD")
            .customerRef("cus_test")
            .paymentMethodRef("pm_test")
            .description("Invoice INV-1")
            .idempotencyKey("invoice-1-attempt-1")
            .metadata(Map.of("invoiceId", "1"))
            .build();
    }
}

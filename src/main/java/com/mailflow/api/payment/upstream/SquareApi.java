package com.mailflow.api.payment.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.val;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A thin wrapper around the Square Connect v2 REST api to enable easy mocking. All methods throw
 * {@link RestClientException} (or its subclasses carrying the HTTP status) on api errors.
 *
 * @see <a href="https://developer.squareup.com/reference/square">Square API reference</a>
 */
public class SquareApi {

    static final String API_VERSION = "2024-04-17";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String accessToken;
    private final String locationId;

    public SquareApi(
        @NonNull RestTemplate restTemplate,
        @NonNull String baseUrl,
        @NonNull String accessToken,
        String locationId
    ) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
        this.locationId = locationId;
    }

    /**
     * Creates and completes a payment from a stored card.
     *
     * @param amount         amount in the smallest currency unit.
     * @param sourceId       id of the card on file.
     * @param idempotencyKey makes retries of this request safe.
     * @return the {@code payment} object of the response.
     */
    @NonNull
    public JsonNode createPayment(
        long amount,
        @NonNull String currency,
        @NonNull String sourceId,
        @NonNull String customerId,
        String note,
        String referenceId,
        @NonNull String idempotencyKey
    ) throws RestClientException {
        val body = new LinkedHashMap<String, Object>();
        body.put("idempotency_key", idempotencyKey);
        body.put("source_id", sourceId);
        body.put("amount_money", money(amount, currency));
        body.put("customer_id", customerId);
        body.put("autocomplete", true);
        putIfNotNull(body, "location_id", locationId);
        putIfNotNull(body, "note", note);
        putIfNotNull(body, "reference_id", referenceId);
        return post("/v2/payments", body).path("payment");
    }

    /**
     * @return the {@code payment} object of the response.
     */
    @NonNull
    public JsonNode getPayment(@NonNull String paymentId) throws RestClientException {
        return exchange(HttpMethod.GET, "/v2/payments/" + paymentId, null).path("payment");
    }

    /**
     * @return the {@code refund} object of the response.
     */
    @NonNull
    public JsonNode refundPayment(
        @NonNull String paymentId,
        long amount,
        @NonNull String currency,
        @NonNull String idempotencyKey
    ) throws RestClientException {
        val body = new LinkedHashMap<String, Object>();
        body.put("idempotency_key", idempotencyKey);
        body.put("payment_id", paymentId);
        body.put("amount_money", money(amount, currency));
        return post("/v2/refunds", body).path("refund");
    }

    /**
     * @return the {@code customer} object of the response.
     */
    @NonNull
    public JsonNode createCustomer(
        String email,
        String name,
        String referenceId,
        @NonNull String idempotencyKey
    ) throws RestClientException {
        val body = new LinkedHashMap<String, Object>();
        body.put("idempotency_key", idempotencyKey);
        putIfNotNull(body, "email_address", email);
        putIfNotNull(body, "given_name", name);
        putIfNotNull(body, "reference_id", referenceId);
        return post("/v2/customers", body).path("customer");
    }

    /**
     * @return the {@code subscription} object of the response.
     */
    @NonNull
    public JsonNode createSubscription(
        @NonNull String customerId,
        @NonNull String planVariationId,
        @NonNull String idempotencyKey
    ) throws RestClientException {
        val body = new LinkedHashMap<String, Object>();
        body.put("idempotency_key", idempotencyKey);
        body.put("customer_id", customerId);
        body.put("plan_variation_id", planVariationId);
        putIfNotNull(body, "location_id", locationId);
        return post("/v2/subscriptions", body).path("subscription");
    }

    public void cancelSubscription(@NonNull String subscriptionId) throws RestClientException {
        post("/v2/subscriptions/" + subscriptionId + "/cancel", Map.of());
    }

    @NonNull
    private JsonNode post(@NonNull String path, @NonNull Map<String, Object> body) {
        return exchange(HttpMethod.POST, path, body);
    }

    @NonNull
    private JsonNode exchange(@NonNull HttpMethod method, @NonNull String path, Map<String, Object> body) {
        val headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set("Square-Version", API_VERSION);

        val response = restTemplate.exchange(baseUrl + path, method, new HttpEntity<>(body, headers), JsonNode.class);
        if (response.getBody() == null) {
            throw new RestClientException("square api returned an empty response body for " + path);
        }

        return response.getBody();
    }

    @NonNull
    private static Map<String, Object> money(long amount, @NonNull String currency) {
        return Map.of("amount", amount, "currency", currency.toUpperCase());
    }

    private static void putIfNotNull(@NonNull Map<String, Object> map, @NonNull String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}

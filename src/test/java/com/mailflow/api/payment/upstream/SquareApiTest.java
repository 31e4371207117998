package com.mailflow.api.payment.upstream;

import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SquareApiTest {

    private MockRestServiceServer server;
    private SquareApi squareApi;

    @BeforeEach
    void setUp() {
        val restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        squareApi = new SquareApi(restTemplate, "https://square.test/", "test-token", "test-location");
    }

    @Test
    void createPayment() {
        server.expect(requestTo("https://square.test/v2/payments"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer test-token"))
            .andExpect(header("Square-Version", SquareApi.API_VERSION))
            .andExpect(jsonPath("$.idempotency_key").value("invoice-1-attempt-1"))
            .andExpect(jsonPath("$.amount_money.amount").value(7999))
            .andExpect(jsonPath("$.amount_money.currency").value("USD"))
            .andExpect(jsonPath("$.location_id").value("test-location"))
            .andExpect(jsonPath("$.reference_id").value("1"))
            .andRespond(withSuccess("{\"payment\":{\"id\":\"sq_pay\",\"status\":\"COMPLETED\"}}", MediaType.APPLICATION_JSON));

        val payment = squareApi.createPayment(7999, "usd", "ccof_test", "cust_test", null, "1", "invoice-1-attempt-1");
        assertEquals("sq_pay", payment.path("id").asText());
        server.verify();
    }

    @Test
    void cancelSubscription_withDeclinedRequest() {
        server.expect(requestTo("https://square.test/v2/subscriptions/sub_test/cancel"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST).contentType(MediaType.APPLICATION_JSON).body("{\"errors\":[]}"));

        assertThrows(HttpClientErrorException.class, () -> squareApi.cancelSubscription("sub_test"));
        server.verify();
    }
}

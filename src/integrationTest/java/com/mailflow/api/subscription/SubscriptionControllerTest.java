package com.mailflow.api.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.Subscription;
import com.mailflow.api.subscription.entities.SubscriptionPlan;
import com.mailflow.api.subscription.payload.CreateSubscriptionParams;
import com.mailflow.api.subscription.payload.UsageParams;
import jakarta.persistence.EntityManager;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.stream.Stream;

import static com.mailflow.api.subscription.SubscriptionTestUtils.buildInvoice;
import static com.mailflow.api.subscription.SubscriptionTestUtils.buildSubscription;
import static com.mailflow.api.subscription.SubscriptionTestUtils.buildSubscriptionPlan;
import static com.mailflow.api.subscription.SubscriptionTestUtils.now;
import static org.junit.jupiter.params.provider.Arguments.arguments;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
public class SubscriptionControllerTest {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private MockMvc mockMvc;

    private SubscriptionPlan plan;

    @BeforeEach
    void setUp() {
        plan = buildSubscriptionPlan(entityManager, "Starter", "29.99", Map.of("emails", 10_000L));
    }

    @Test
    void getPlans() throws Exception {
        mockMvc.perform(get("/v1/plans"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$[?(@.id == " + plan.getId() + ")].name").value("Starter"));
    }

    @Test
    void createSubscription() throws Exception {
        val params = CreateSubscriptionParams.builder()
            .planId(plan.getId())
            .customerRef("cus_create")
            .provider(PaymentProviderType.STRIPE)
            .trialDays(14)
            .build();

        mockMvc.perform(post("/v1/tenants/create-tenant/subscription")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(params)))
            .andExpect(status().is(HttpStatus.CREATED.value()))
            .andExpect(jsonPath("$.tenantId").value("create-tenant"))
            .andExpect(jsonPath("$.status").value("TRIALING"))
            .andExpect(jsonPath("$.plan.id").value(plan.getId()));

        mockMvc.perform(post("/v1/tenants/create-tenant/subscription")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(params)))
            .andExpect(status().is(HttpStatus.CONFLICT.value()));

        mockMvc.perform(get("/v1/tenants/create-tenant/subscription"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.plan.name").value("Starter"));
    }

    @ParameterizedTest
    @MethodSource("createSubscription_withInvalidParamsTestCases")
    void createSubscription_withInvalidParams(String body) throws Exception {
        mockMvc.perform(post("/v1/tenants/invalid-tenant/subscription")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().is(HttpStatus.BAD_REQUEST.value()));
    }

    static Stream<Arguments> createSubscription_withInvalidParamsTestCases() {
        return Stream.of(
            // unknown plan
            arguments("{\"planId\":999999,\"customerRef\":\"cus_1\",\"provider\":\"STRIPE\"}"),
            // missing customer
            arguments("{\"planId\":1,\"provider\":\"STRIPE\"}"),
            // unknown provider
            arguments("{\"planId\":1,\"customerRef\":\"cus_1\",\"provider\":\"PAYPAL\"}"),
            // negative trial
            arguments("{\"planId\":1,\"customerRef\":\"cus_1\",\"provider\":\"STRIPE\",\"trialDays\":-1}"),
            // malformed
            arguments("{")
        );
    }

    @Test
    void getSubscription_withoutSubscription() throws Exception {
        mockMvc.perform(get("/v1/tenants/unknown-tenant/subscription"))
            .andExpect(status().is(HttpStatus.NOT_FOUND.value()));
    }

    @Test
    void quotaAndUsage() throws Exception {
        buildSubscription(entityManager, "usage-tenant", plan, Subscription.Status.ACTIVE, now().minusDays(3));

        mockMvc.perform(post("/v1/tenants/usage-tenant/subscription/usage")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(new UsageParams("emails", 9_500))))
            .andExpect(status().is(HttpStatus.NO_CONTENT.value()));

        mockMvc.perform(get("/v1/tenants/usage-tenant/subscription/quotas/emails").queryParam("amount", "500"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.allowed").value(true))
            .andExpect(jsonPath("$.used").value(9_500))
            .andExpect(jsonPath("$.remaining").value(500))
            .andExpect(jsonPath("$.limit").value(10_000));

        mockMvc.perform(get("/v1/tenants/usage-tenant/subscription/quotas/emails").queryParam("amount", "501"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.allowed").value(false));

        mockMvc.perform(delete("/v1/tenants/usage-tenant/subscription/usage").queryParam("resourceType", "emails"))
            .andExpect(status().is(HttpStatus.NO_CONTENT.value()));

        entityManager.flush();
        entityManager.clear();
        mockMvc.perform(get("/v1/tenants/usage-tenant/subscription/quotas/emails"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.used").value(0));
    }

    @Test
    void updateUsage_withInvalidParams() throws Exception {
        mockMvc.perform(post("/v1/tenants/unknown-tenant/subscription/usage")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(new UsageParams("emails", 10))))
            .andExpect(status().is(HttpStatus.NOT_FOUND.value()));

        mockMvc.perform(post("/v1/tenants/unknown-tenant/subscription/usage")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(new UsageParams("emails", 0))))
            .andExpect(status().is(HttpStatus.BAD_REQUEST.value()));

        mockMvc.perform(get("/v1/tenants/unknown-tenant/subscription/quotas/emails"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.allowed").value(false));
    }

    @Test
    void invoices() throws Exception {
        val subscription = buildSubscription(entityManager, "invoice-tenant", plan, Subscription.Status.ACTIVE, now().minusDays(3));
        val paid = buildInvoice(entityManager, subscription, 1, Invoice.Status.PAID, "29.99", null);
        val from = now().minusDays(1).toString();
        val to = now().plusDays(1).toString();

        mockMvc.perform(get("/v1/tenants/invoice-tenant/invoices").queryParam("from", from).queryParam("to", to))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].invoiceNumber").value(paid.getInvoiceNumber()));

        mockMvc.perform(post("/v1/tenants/invoice-tenant/invoices")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(Map.of(
                    "periodStart", subscription.getCurrentPeriodStart().toString(),
                    "periodEnd", subscription.getCurrentPeriodEnd().toString()))))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.status").value("OPEN"))
            .andExpect(jsonPath("$.total").value(29.99));

        mockMvc.perform(post("/v1/invoices/" + paid.getId() + "/void"))
            .andExpect(status().is(HttpStatus.CONFLICT.value()));

        mockMvc.perform(post("/v1/invoices/999999/void"))
            .andExpect(status().is(HttpStatus.NOT_FOUND.value()));
    }
}

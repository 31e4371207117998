package com.mailflow.api.billing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.api.payment.PaymentDispatcher;
import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.models.PaymentResult;
import com.mailflow.api.subscription.entities.Invoice;
import com.mailflow.api.subscription.entities.Subscription;
import com.mailflow.api.subscription.entities.SubscriptionPlan;
import com.mailflow.api.subscription.models.ProrationBehavior;
import com.mailflow.api.subscription.payload.ChangePlanParams;
import jakarta.persistence.EntityManager;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Map;

import static com.mailflow.api.subscription.SubscriptionTestUtils.buildInvoice;
import static com.mailflow.api.subscription.SubscriptionTestUtils.buildSubscription;
import static com.mailflow.api.subscription.SubscriptionTestUtils.buildSubscriptionPlan;
import static com.mailflow.api.subscription.SubscriptionTestUtils.now;
import static org.hamcrest.Matchers.greaterThan;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Transactional
public class BillingControllerTest {

    @MockBean
    private PaymentDispatcher paymentDispatcher;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private EntityManager entityManager;

    @Autowired
    private MockMvc mockMvc;

    private SubscriptionPlan starter;
    private SubscriptionPlan pro;

    @BeforeEach
    void setUp() {
        starter = buildSubscriptionPlan(entityManager, "Starter", "29.99", Map.of("emails", 10_000L));
        pro = buildSubscriptionPlan(entityManager, "Pro", "79.99", Map.of("emails", 100_000L));
        when(paymentDispatcher.processPayment(any(), any())).thenAnswer(i -> PaymentResult.builder()
            .success(true)
            .provider(PaymentProviderType.STRIPE)
            .paymentId("pi_controller_test")
            .build());
    }

    @Test
    void scheduler() throws Exception {
        mockMvc.perform(get("/v1/billing/scheduler"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.timerRunning").value(false))
            .andExpect(jsonPath("$.runInFlight").value(false));

        mockMvc.perform(post("/v1/billing/scheduler/start"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.timerRunning").value(true));

        mockMvc.perform(post("/v1/billing/scheduler/stop"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.timerRunning").value(false));
    }

    @Test
    void triggerBillingCycles() throws Exception {
        buildSubscription(entityManager, "controller-run-tenant", starter, Subscription.Status.ACTIVE, now().minusMonths(1).minusDays(2));

        mockMvc.perform(post("/v1/billing/runs"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.skipped").value(false))
            .andExpect(jsonPath("$.outcome").value("COMPLETED"))
            .andExpect(jsonPath("$.summary.closedPeriods").value(1))
            .andExpect(jsonPath("$.summary.paymentsSucceeded").value(1));

        mockMvc.perform(get("/v1/billing/scheduler"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.lastRunOutcome").value("COMPLETED"));
    }

    @Test
    void payInvoice() throws Exception {
        val subscription = buildSubscription(entityManager, "controller-pay-tenant", starter, Subscription.Status.PAST_DUE, now().minusDays(2));
        val open = buildInvoice(entityManager, subscription, 1, Invoice.Status.OPEN, "29.99", now().plusDays(1));
        val paid = buildInvoice(entityManager, subscription, 2, Invoice.Status.PAID, "29.99", null);

        mockMvc.perform(post("/v1/billing/invoices/" + open.getId() + "/payments"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.status").value("PAID"))
            .andExpect(jsonPath("$.paymentAttempts").value(1));

        mockMvc.perform(post("/v1/billing/invoices/" + paid.getId() + "/payments"))
            .andExpect(status().is(HttpStatus.CONFLICT.value()));

        mockMvc.perform(post("/v1/billing/invoices/999999/payments"))
            .andExpect(status().is(HttpStatus.NOT_FOUND.value()));

        mockMvc.perform(get("/v1/tenants/controller-pay-tenant/subscription"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void getReport() throws Exception {
        val subscription = buildSubscription(entityManager, "controller-report-tenant", starter, Subscription.Status.ACTIVE, now().minusDays(2));
        buildInvoice(entityManager, subscription, 1, Invoice.Status.PAID, "29.99", null);
        buildInvoice(entityManager, subscription, 2, Invoice.Status.OPEN, "29.99", now().plusDays(1));

        mockMvc.perform(get("/v1/billing/tenants/controller-report-tenant/report")
                .queryParam("from", now().minusDays(1).toString())
                .queryParam("to", now().plusDays(1).toString()))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.invoicesGenerated").value(2))
            .andExpect(jsonPath("$.totalBilled").value(59.98))
            .andExpect(jsonPath("$.totalCollected").value(29.99))
            .andExpect(jsonPath("$.totalOutstanding").value(29.99));

        mockMvc.perform(get("/v1/billing/tenants/controller-report-tenant/report")
                .queryParam("from", now().toString())
                .queryParam("to", now().minusDays(1).toString()))
            .andExpect(status().is(HttpStatus.BAD_REQUEST.value()));
    }

    @Test
    void upgradeAndDowngrade() throws Exception {
        buildSubscription(entityManager, "controller-change-tenant", starter, Subscription.Status.ACTIVE, now().minusDays(10));

        mockMvc.perform(post("/v1/tenants/controller-change-tenant/subscription/upgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(ChangePlanParams.builder()
                    .planId(pro.getId())
                    .prorationBehavior(ProrationBehavior.IMMEDIATE_CHARGE)
                    .build())))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.subscription.plan.id").value(pro.getId()))
            .andExpect(jsonPath("$.prorationAmount").value(greaterThan(0.0)))
            .andExpect(jsonPath("$.prorationInvoice.kind").value("PRORATION"))
            .andExpect(jsonPath("$.prorationInvoice.status").value("PAID"));

        mockMvc.perform(post("/v1/tenants/controller-change-tenant/subscription/upgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(ChangePlanParams.builder().planId(pro.getId()).build())))
            .andExpect(status().is(HttpStatus.CONFLICT.value()));

        mockMvc.perform(post("/v1/tenants/controller-change-tenant/subscription/downgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsBytes(ChangePlanParams.builder().planId(starter.getId()).build())))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.subscription.plan.id").value(pro.getId()))
            .andExpect(jsonPath("$.subscription.pendingPlanId").value(starter.getId()));

        mockMvc.perform(post("/v1/tenants/controller-change-tenant/subscription/upgrade")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"planId\":0}"))
            .andExpect(status().is(HttpStatus.BAD_REQUEST.value()));
    }

    @Test
    void cancel() throws Exception {
        buildSubscription(entityManager, "controller-cancel-tenant", starter, Subscription.Status.ACTIVE, now().minusDays(10));
        buildSubscription(entityManager, "controller-cancel-later-tenant", starter, Subscription.Status.ACTIVE, now().minusDays(10));

        mockMvc.perform(delete("/v1/tenants/controller-cancel-tenant/subscription"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(delete("/v1/tenants/controller-cancel-later-tenant/subscription")
                .queryParam("cancelAt", now().plusDays(5).toString()))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.cancelAtPeriodEnd").value(true));

        mockMvc.perform(delete("/v1/tenants/controller-cancel-missing-tenant/subscription"))
            .andExpect(status().is(HttpStatus.NOT_FOUND.value()));

        // provider subscription isn't linked, so nothing is cancelled upstream.
        verify(paymentDispatcher, never()).cancelProviderSubscription(any(), any());
    }

    @Test
    void triggerOverageBilling() throws Exception {
        buildSubscription(entityManager, "controller-overage-tenant", starter, Subscription.Status.ACTIVE, now().minusDays(2));

        mockMvc.perform(post("/v1/tenants/controller-overage-tenant/subscription/usage")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"resourceType\":\"emails\",\"amount\":10500}"))
            .andExpect(status().is(HttpStatus.NO_CONTENT.value()));

        mockMvc.perform(post("/v1/billing/tenants/controller-overage-tenant/overage"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.summary.overageInvoicesCreated").value(1))
            .andExpect(jsonPath("$.summary.paymentsSucceeded").value(1));

        // counters are updated in bulk, so reload them.
        entityManager.flush();
        entityManager.clear();
        mockMvc.perform(post("/v1/billing/tenants/controller-overage-tenant/overage"))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$.summary.overageInvoicesCreated").value(0));

        mockMvc.perform(get("/v1/tenants/controller-overage-tenant/invoices")
                .queryParam("from", now().minusDays(1).toString())
                .queryParam("to", now().plusDays(1).toString()))
            .andExpect(status().is(HttpStatus.OK.value()))
            .andExpect(jsonPath("$[0].kind").value("OVERAGE"))
            .andExpect(jsonPath("$[0].total").value(new BigDecimal("0.50").doubleValue()));
    }
}

package com.mailflow.api.billing;

import com.mailflow.api.billing.payload.PlanChangeResponse;
import com.mailflow.api.subscription.exceptions.SubscriptionNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionStateException;
import com.mailflow.api.subscription.models.ProrationBehavior;
import com.mailflow.api.subscription.payload.ChangePlanParams;
import com.mailflow.api.subscription.payload.SubscriptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

/**
 * REST controller for plan changes and cancellation of a tenant's subscription, under
 * '{@code /v1/tenants/{tenantId}/subscription}'.
 */
@Validated
@RestController
@RequestMapping("/v1/tenants/{tenantId}/subscription")
@Slf4j
@Tag(name = "subscription")
class SubscriptionBillingController {

    private final BillingService billingService;

    @Autowired
    SubscriptionBillingController(@NonNull BillingService billingService) {
        this.billingService = billingService;
    }

    /**
     * <p>
     * Moves the subscription to a more expensive plan right away.</p>
     *
     * <p>
     * The unused share of the current period is prorated at the price difference. With the
     * {@code IMMEDIATE_CHARGE} proration behaviour (default), the proration is invoiced and charged
     * right away. With {@code DEFER}, it is added to the next cycle invoice. Subscriptions in their
     * trial switch plans without proration.</p>
     */
    @Operation(summary = "Upgrade the tenant's plan")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid or the plan doesn't exist", content = @Content),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "409", description = "the plan isn't an upgrade or the subscription can't change plans", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/upgrade")
    ResponseEntity<PlanChangeResponse> upgrade(
        @NonNull @NotBlank @PathVariable String tenantId,
        @Valid @NotNull @RequestBody ChangePlanParams params
    ) {
        val behavior = params.getProrationBehavior() == null
            ? ProrationBehavior.IMMEDIATE_CHARGE
            : params.getProrationBehavior();

        try {
            val result = billingService.upgradeSubscription(tenantId, params.getPlanId(), behavior);
            return ResponseEntity.ok(PlanChangeResponse.from(result));
        } catch (SubscriptionPlanNotFoundException e) {
            log.trace("subscription plan not found", e);
            return ResponseEntity.badRequest().build();
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (SubscriptionStateException e) {
            log.trace("plan upgrade refused", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * Schedules a move to a cheaper plan at the first billing period boundary at or after {@code
     * effectiveAt}, by default the end of the current period. The unused share of the current
     * period is credited towards the next cycle invoice.
     */
    @Operation(summary = "Downgrade the tenant's plan")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid or the plan doesn't exist", content = @Content),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "409", description = "the plan isn't a downgrade or the subscription can't change plans", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/downgrade")
    ResponseEntity<PlanChangeResponse> downgrade(
        @NonNull @NotBlank @PathVariable String tenantId,
        @Valid @NotNull @RequestBody ChangePlanParams params
    ) {
        try {
            val result = billingService.downgradeSubscription(tenantId, params.getPlanId(), params.getEffectiveAt());
            return ResponseEntity.ok(PlanChangeResponse.from(result));
        } catch (SubscriptionPlanNotFoundException e) {
            log.trace("subscription plan not found", e);
            return ResponseEntity.badRequest().build();
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (SubscriptionStateException e) {
            log.trace("plan downgrade refused", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    /**
     * Cancels the subscription right away, or at the first billing period boundary at or after
     * {@code cancelAt} if it is in the future.
     */
    @Operation(summary = "Cancel the tenant's subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @DeleteMapping
    ResponseEntity<SubscriptionResponse> cancel(
        @NonNull @NotBlank @PathVariable String tenantId,
        @RequestParam(value = "cancelAt", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime cancelAt
    ) {
        try {
            return ResponseEntity.ok(SubscriptionResponse.from(billingService.cancelSubscription(tenantId, cancelAt)));
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}

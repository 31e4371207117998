package com.mailflow.api.subscription;

import com.mailflow.api.subscription.exceptions.DuplicateSubscriptionException;
import com.mailflow.api.subscription.exceptions.InvoiceNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionPlanNotFoundException;
import com.mailflow.api.subscription.exceptions.SubscriptionStateException;
import com.mailflow.api.subscription.models.QuotaCheckResult;
import com.mailflow.api.subscription.payload.CreateSubscriptionParams;
import com.mailflow.api.subscription.payload.GenerateInvoiceParams;
import com.mailflow.api.subscription.payload.InvoiceResponse;
import com.mailflow.api.subscription.payload.SubscriptionPlanResponse;
import com.mailflow.api.subscription.payload.SubscriptionResponse;
import com.mailflow.api.subscription.payload.UsageParams;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * REST controller for plan, tenant subscription, usage and invoice routes under '{@code /v1}'.
 * Plan changes and cancellations go through the billing package, since they may charge the
 * tenant.
 */
@Validated
@RestController
@RequestMapping("/v1")
@Slf4j
@Tag(name = "subscription")
class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @Autowired
    SubscriptionController(@NonNull SubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @Operation(summary = "List available plans")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/plans")
    ResponseEntity<List<SubscriptionPlanResponse>> getPlans() {
        return ResponseEntity.ok(subscriptionService.getPlans().stream().map(SubscriptionPlanResponse::from).toList());
    }

    /**
     * Subscribes the tenant to a plan. A tenant can't have more than one subscription that isn't
     * cancelled.
     */
    @Operation(summary = "Subscribe a tenant to a plan")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "subscription created"),
        @ApiResponse(responseCode = "400", description = "request is not valid or the plan doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "tenant already has a subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/tenants/{tenantId}/subscription")
    ResponseEntity<SubscriptionResponse> createSubscription(
        @NonNull @NotBlank @PathVariable String tenantId,
        @Valid @NotNull @RequestBody CreateSubscriptionParams params
    ) {
        try {
            val subscription = subscriptionService.createSubscription(tenantId, params);
            return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponse.from(subscription));
        } catch (SubscriptionPlanNotFoundException e) {
            log.trace("subscription plan not found", e);
            return ResponseEntity.badRequest().build();
        } catch (DuplicateSubscriptionException e) {
            log.trace("duplicate subscription", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Get the tenant's subscription")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/tenants/{tenantId}/subscription")
    ResponseEntity<SubscriptionResponse> getSubscription(@NonNull @NotBlank @PathVariable String tenantId) {
        try {
            return ResponseEntity.ok(SubscriptionResponse.from(subscriptionService.getSubscription(tenantId)));
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    /**
     * Checks whether the tenant may use {@code amount} more units of a resource in the current
     * billing period.
     */
    @Operation(summary = "Check a usage quota")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/tenants/{tenantId}/subscription/quotas/{resourceType}")
    ResponseEntity<QuotaCheckResult> checkQuota(
        @NonNull @NotBlank @PathVariable String tenantId,
        @NonNull @NotBlank @PathVariable String resourceType,
        @PositiveOrZero @RequestParam(value = "amount", defaultValue = "1") long amount
    ) {
        return ResponseEntity.ok(subscriptionService.checkQuotaLimit(tenantId, resourceType, amount));
    }

    @Operation(summary = "Record resource usage")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "usage recorded"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/tenants/{tenantId}/subscription/usage")
    ResponseEntity<Void> updateUsage(
        @NonNull @NotBlank @PathVariable String tenantId,
        @Valid @NotNull @RequestBody UsageParams params
    ) {
        try {
            subscriptionService.updateUsage(tenantId, params.getResourceType(), params.getAmount());
            return ResponseEntity.noContent().build();
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Reset resource usage")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "usage reset"),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @DeleteMapping("/tenants/{tenantId}/subscription/usage")
    ResponseEntity<Void> resetUsage(
        @NonNull @NotBlank @PathVariable String tenantId,
        @RequestParam(value = "resourceType", required = false) String resourceType
    ) {
        try {
            subscriptionService.resetUsage(tenantId, resourceType);
            return ResponseEntity.noContent().build();
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "List the tenant's invoices created in a time range")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/tenants/{tenantId}/invoices")
    ResponseEntity<List<InvoiceResponse>> listInvoices(
        @NonNull @NotBlank @PathVariable String tenantId,
        @NonNull @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
        @NonNull @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to
    ) {
        return ResponseEntity.ok(subscriptionService.listInvoices(tenantId, from, to).stream().map(InvoiceResponse::from).toList());
    }

    /**
     * Returns the tenant's cycle invoice for the given period, creating it if it doesn't exist.
     * It doesn't charge the tenant.
     */
    @Operation(summary = "Generate a cycle invoice")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "tenant has no subscription", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/tenants/{tenantId}/invoices")
    ResponseEntity<InvoiceResponse> generateInvoice(
        @NonNull @NotBlank @PathVariable String tenantId,
        @Valid @NotNull @RequestBody GenerateInvoiceParams params
    ) {
        try {
            val invoice = subscriptionService.generateInvoice(tenantId, params.getPeriodStart(), params.getPeriodEnd());
            return ResponseEntity.ok(InvoiceResponse.from(invoice));
        } catch (SubscriptionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Void an unpaid invoice")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "404", description = "invoice doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "invoice has been paid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/invoices/{invoiceId}/void")
    ResponseEntity<InvoiceResponse> voidInvoice(@Min(1) @PathVariable long invoiceId) {
        try {
            return ResponseEntity.ok(InvoiceResponse.from(subscriptionService.voidInvoice(invoiceId)));
        } catch (InvoiceNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (SubscriptionStateException e) {
            log.trace("invoice can't be voided", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }
}

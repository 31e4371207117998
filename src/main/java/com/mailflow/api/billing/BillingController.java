package com.mailflow.api.billing;

import com.mailflow.api.billing.exceptions.InvoiceNotPayableException;
import com.mailflow.api.billing.models.BillingReport;
import com.mailflow.api.billing.models.BillingRunResult;
import com.mailflow.api.billing.models.BillingSchedulerStatus;
import com.mailflow.api.subscription.exceptions.InvoiceNotFoundException;
import com.mailflow.api.subscription.payload.InvoiceResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;

/**
 * REST controller for billing operations under '{@code /v1/billing}'.
 */
@Validated
@RestController
@RequestMapping("/v1/billing")
@Slf4j
@Tag(name = "billing")
class BillingController {

    private final BillingService billingService;
    private final BillingScheduler billingScheduler;

    @Autowired
    BillingController(@NonNull BillingService billingService, @NonNull BillingScheduler billingScheduler) {
        this.billingService = billingService;
        this.billingScheduler = billingScheduler;
    }

    @Operation(summary = "Get the billing scheduler's status")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/scheduler")
    ResponseEntity<BillingSchedulerStatus> getSchedulerStatus() {
        return ResponseEntity.ok(billingScheduler.getStatus());
    }

    @Operation(summary = "Start running billing passes at the configured interval")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/scheduler/start")
    ResponseEntity<BillingSchedulerStatus> startScheduler() {
        billingScheduler.start();
        return ResponseEntity.ok(billingScheduler.getStatus());
    }

    /**
     * Stops scheduling billing passes. A pass that is in flight runs to completion.
     */
    @Operation(summary = "Stop running scheduled billing passes")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/scheduler/stop")
    ResponseEntity<BillingSchedulerStatus> stopScheduler() {
        billingScheduler.stop();
        return ResponseEntity.ok(billingScheduler.getStatus());
    }

    /**
     * Runs a billing pass on the request thread. It is skipped if another billing run is in
     * flight.
     */
    @Operation(summary = "Run a billing pass")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "the pass ran, see its outcome"),
        @ApiResponse(responseCode = "409", description = "another billing run is in flight"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/runs")
    ResponseEntity<BillingRunResult> triggerBillingCycles() {
        return toResponse(billingScheduler.triggerBillingCycles());
    }

    @Operation(summary = "Bill a tenant's unbilled overage")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "the run ran, see its outcome"),
        @ApiResponse(responseCode = "409", description = "another billing run is in flight"),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/tenants/{tenantId}/overage")
    ResponseEntity<BillingRunResult> triggerOverageBilling(@NonNull @NotBlank @PathVariable String tenantId) {
        return toResponse(billingScheduler.triggerOverageBilling(tenantId));
    }

    /**
     * Charges the amount due on an open invoice. The returned invoice carries the outcome, i.e.
     * it is paid on success and open or failed otherwise.
     */
    @Operation(summary = "Charge an open invoice")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "404", description = "invoice doesn't exist", content = @Content),
        @ApiResponse(responseCode = "409", description = "invoice isn't open or has nothing due", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @PostMapping("/invoices/{invoiceId}/payments")
    ResponseEntity<InvoiceResponse> payInvoice(@Min(1) @PathVariable long invoiceId) {
        try {
            return ResponseEntity.ok(InvoiceResponse.from(billingService.processInvoicePayment(invoiceId)));
        } catch (InvoiceNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (InvoiceNotPayableException e) {
            log.trace("invoice not payable", e);
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Aggregate a tenant's invoices created in a time range")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
    })
    @NonNull
    @GetMapping("/tenants/{tenantId}/report")
    ResponseEntity<BillingReport> getReport(
        @NonNull @NotBlank @PathVariable String tenantId,
        @NonNull @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
        @NonNull @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to
    ) {
        if (!to.isAfter(from)) {
            return ResponseEntity.badRequest().build();
        }

        return ResponseEntity.ok(billingService.generateBillingReport(tenantId, from, to));
    }

    @NonNull
    private static ResponseEntity<BillingRunResult> toResponse(@NonNull BillingRunResult result) {
        if (result.isSkipped()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }

        return ResponseEntity.ok(result);
    }
}

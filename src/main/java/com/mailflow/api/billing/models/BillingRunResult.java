package com.mailflow.api.billing.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.time.OffsetDateTime;

/**
 * Outcome of a scheduled or triggered billing run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "BillingRunResult")
public class BillingRunResult {

    @Schema(required = true, description = "whether the run was skipped because another one was in flight")
    private boolean skipped;

    @Schema(required = true)
    @NonNull
    private Outcome outcome;

    private OffsetDateTime startedAt;

    private OffsetDateTime finishedAt;

    @Schema(description = "counters of the pass. only present for completed billing passes.")
    private BillingPassSummary summary;

    private String message;

    public enum Outcome {
        COMPLETED,
        FAILED,
        SKIPPED,
    }
}

package com.mailflow.api.billing.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "BillingSchedulerStatus")
public class BillingSchedulerStatus {

    @Schema(description = "whether periodic billing passes are scheduled")
    private boolean timerRunning;

    @Schema(description = "whether a billing run is in flight")
    private boolean runInFlight;

    private Duration interval;

    private OffsetDateTime lastRunStartedAt;

    private OffsetDateTime lastRunFinishedAt;

    private BillingRunResult.Outcome lastRunOutcome;

    private BillingPassSummary lastRunSummary;

    private String lastRunError;

    @Schema(description = "when a run was last skipped because another one was in flight")
    private OffsetDateTime lastSkippedAt;

    private long skippedRuns;
}

package com.mailflow.api.subscription.models;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "QuotaCheck")
public class QuotaCheckResult {

    @Schema(required = true, description = "whether the requested amount fits in the remaining quota")
    private boolean allowed;

    @Schema(description = "units used in the current period")
    private long used;

    @Schema(description = "units left in the current period. absent if the resource is unlimited.")
    private Long remaining;

    @Schema(description = "quota of the resource. absent if the resource is unlimited.")
    private Long limit;

    public static QuotaCheckResult denied() {
        return QuotaCheckResult.builder().allowed(false).remaining(0L).limit(0L).build();
    }
}

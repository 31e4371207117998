package com.mailflow.api.subscription.payload;

import com.mailflow.api.subscription.models.ProrationBehavior;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangePlanParams {

    @NotNull
    @Min(1)
    private Long planId;

    /**
     * Only used by upgrades. Defaults to {@link ProrationBehavior#IMMEDIATE_CHARGE}.
     */
    private ProrationBehavior prorationBehavior;

    /**
     * Only used by downgrades. Defaults to the end of the current billing period.
     */
    private OffsetDateTime effectiveAt;
}

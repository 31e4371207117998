package com.mailflow.api.subscription.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageParams {

    @NotBlank
    private String resourceType;

    @Positive
    private long amount;
}

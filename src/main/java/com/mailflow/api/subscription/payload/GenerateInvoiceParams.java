package com.mailflow.api.subscription.payload;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateInvoiceParams {

    @NotNull
    private OffsetDateTime periodStart;

    @NotNull
    private OffsetDateTime periodEnd;
}

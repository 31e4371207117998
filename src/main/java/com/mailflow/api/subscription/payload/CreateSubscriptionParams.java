package com.mailflow.api.subscription.payload;

import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.subscription.entities.BillingAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSubscriptionParams {

    @NotNull
    @Min(1)
    private Long planId;

    @NotBlank
    private String customerRef;

    @NotNull
    private PaymentProviderType provider;

    private String paymentMethodRef;

    @Valid
    private BillingAddress billingAddress;

    /**
     * Overrides the plan's trial length if present.
     */
    @PositiveOrZero
    private Integer trialDays;

    private String discountRef;

    @DecimalMin("0")
    @DecimalMax("1")
    private BigDecimal taxRate;
}

package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * The outcome of a non-charge provider operation, i.e. refunds, customer creation and
 * subscription creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderOperationResult {

    private boolean success;

    @NonNull
    private PaymentProviderType provider;

    /**
     * Provider assigned id of the created object (refund, customer or subscription).
     */
    private String reference;

    /**
     * Provider reported status of the created object, e.g. {@code succeeded} or {@code pending}.
     */
    private String status;

    private PaymentErrorKind errorKind;

    private String errorMessage;

    @NonNull
    public static ProviderOperationResult succeeded(@NonNull PaymentProviderType provider, @NonNull String reference, String status) {
        return ProviderOperationResult.builder()
            .success(true)
            .provider(provider)
            .reference(reference)
            .status(status)
            .build();
    }

    @NonNull
    public static ProviderOperationResult failed(@NonNull PaymentProviderType provider, @NonNull PaymentErrorKind errorKind, String errorMessage) {
        return ProviderOperationResult.builder()
            .success(false)
            .provider(provider)
            .errorKind(errorKind)
            .errorMessage(errorMessage)
            .build();
    }
}

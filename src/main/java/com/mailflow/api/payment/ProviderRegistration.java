package com.mailflow.api.payment;

import com.mailflow.api.payment.models.PaymentProviderType;
import com.mailflow.api.payment.providers.PaymentProviderAdapter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

/**
 * A payment provider adapter along with its routing attributes.
 */
@Data
@Builder
@AllArgsConstructor
public class ProviderRegistration {

    @NonNull
    private final PaymentProviderType type;

    private final int priority;

    private final boolean active;

    @NonNull
    private final PaymentProviderAdapter adapter;
}

package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.Map;

/**
 * Billing contact details used to create a customer at a payment provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerData {

    @NonNull
    private String tenantId;

    private String email;

    private String name;

    private Map<String, String> metadata;
}

package com.mailflow.api.subscription.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * A single charge (or credit, when {@link #amount} is negative) on an {@link Invoice}.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceLineItem {

    @NonNull
    private String description;

    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal quantity;

    @NonNull
    @Column(precision = 19, scale = 6)
    private BigDecimal unitPrice;

    @NonNull
    @Column(precision = 19, scale = 4)
    private BigDecimal amount;

    @NonNull
    @Enumerated(EnumType.STRING)
    private Kind kind;

    public enum Kind {
        SUBSCRIPTION,
        SETUP_FEE,
        PRORATION,
        OVERAGE
    }
}

package com.mailflow.api.payment.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.List;

/**
 * An explainable fraud verdict for a payment request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudAssessment {

    private int score;

    @NonNull
    private RiskBand band;

    @NonNull
    private Recommendation recommendation;

    /**
     * Human readable reasons that contributed to the score or forced the recommendation.
     */
    @NonNull
    @Builder.Default
    private List<String> reasons = List.of();

    public enum RiskBand {
        LOW,
        MEDIUM,
        HIGH,
    }

    public enum Recommendation {
        APPROVE,
        REVIEW,
        DECLINE,
    }
}

package com.mailflow.api.payment;

import com.mailflow.api.payment.models.FraudAssessment;
import com.mailflow.api.payment.models.PaymentRequest;
import lombok.NonNull;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNullElse;

/**
 * {@link FraudScreen} scores payment requests from their amount, currency and the risk signals
 * that callers attach as request metadata. The same request always gets the same verdict.
 */
@Component
class FraudScreen {

    static final String IS_HIGH_RISK = "isHighRisk";
    static final String VPN_DETECTED = "vpnDetected";
    static final String PROXY_DETECTED = "proxyDetected";
    static final String TOR_DETECTED = "torDetected";
    static final String RECENT_FAILED_ATTEMPTS = "recentFailedAttempts";
    static final String DAILY_TRANSACTION_COUNT = "dailyTransactionCount";
    static final String KNOWN_FRAUDSTER = "knownFraudster";
    static final String BLACKLISTED = "blacklisted";

    private static final Set<String> MAJOR_CURRENCIES = Set.of("USD", "EUR", "GBP", "JPY", "AUD", "CAD");

    private final PaymentConfiguration.FraudPolicy policy;

    @Autowired
    FraudScreen(@NonNull PaymentConfiguration paymentConfig) {
        this.policy = paymentConfig.getFraud();
    }

    @NonNull
    FraudAssessment assess(@NonNull PaymentRequest request) {
        val metadata = requireNonNullElse(request.getMetadata(), Map.<String, String>of());
        val reasons = new ArrayList<String>();
        int score = 0;

        val amount = request.getAmount();
        if (amount.compareTo(BigDecimal.valueOf(50000)) > 0) {
            score += 50;
            reasons.add("very high transaction amount");
        } else if (amount.compareTo(BigDecimal.valueOf(25000)) > 0) {
            score += 40;
            reasons.add("high transaction amount");
        } else if (amount.compareTo(BigDecimal.valueOf(10000)) > 0) {
            score += 30;
            reasons.add("large transaction amount");
        } else if (amount.compareTo(BigDecimal.valueOf(5000)) > 0) {
            score += 20;
            reasons.add("above average transaction amount");
        } else if (amount.compareTo(BigDecimal.valueOf(1000)) > 0) {
            score += 10;
            reasons.add("moderate transaction amount");
        }

        val currency = request.getCurrency().toUpperCase();
        if (!MAJOR_CURRENCIES.contains(currency)) {
            score += 15;
            reasons.add("uncommon currency");
        }

        val highRisk = flag(metadata, IS_HIGH_RISK);
        if (highRisk) {
            score += 50;
            reasons.add("payer is flagged as high risk");
        }

        if (flag(metadata, VPN_DETECTED)) {
            score += 15;
            reasons.add("vpn detected");
        }

        if (flag(metadata, PROXY_DETECTED)) {
            score += 20;
            reasons.add("proxy detected");
        }

        if (flag(metadata, TOR_DETECTED)) {
            score += 35;
            reasons.add("tor exit node detected");
        }

        val failedAttempts = count(metadata, RECENT_FAILED_ATTEMPTS);
        if (failedAttempts > 5) {
            score += 40;
        } else if (failedAttempts > 3) {
            score += 25;
        } else if (failedAttempts > 1) {
            score += 10;
        }

        if (failedAttempts > 1) {
            reasons.add(String.format("%d recent failed payment attempts", failedAttempts));
        }

        val dailyCount = count(metadata, DAILY_TRANSACTION_COUNT);
        if (dailyCount > 20) {
            score += 25;
        } else if (dailyCount > 10) {
            score += 15;
        } else if (dailyCount > 5) {
            score += 5;
        }

        if (dailyCount > 5) {
            reasons.add(String.format("%d transactions today", dailyCount));
        }

        FraudAssessment.RiskBand band;
        FraudAssessment.Recommendation recommendation;
        if (score >= policy.getDeclineThreshold()) {
            band = FraudAssessment.RiskBand.HIGH;
            recommendation = FraudAssessment.Recommendation.DECLINE;
        } else if (score >= policy.getHighRiskThreshold()) {
            band = FraudAssessment.RiskBand.HIGH;
            recommendation = FraudAssessment.Recommendation.REVIEW;
        } else if (score >= policy.getReviewThreshold()) {
            band = FraudAssessment.RiskBand.MEDIUM;
            recommendation = FraudAssessment.Recommendation.REVIEW;
        } else {
            band = FraudAssessment.RiskBand.LOW;
            recommendation = FraudAssessment.Recommendation.APPROVE;
        }

        // hard rules override the score.
        if (highRisk) {
            band = FraudAssessment.RiskBand.HIGH;
            recommendation = FraudAssessment.Recommendation.DECLINE;
        }

        if (amount.compareTo(policy.getAmountCeiling()) > 0) {
            band = FraudAssessment.RiskBand.HIGH;
            recommendation = FraudAssessment.Recommendation.DECLINE;
            reasons.add(String.format("amount exceeds the %s ceiling", policy.getAmountCeiling().toPlainString()));
        }

        if (flag(metadata, KNOWN_FRAUDSTER) || flag(metadata, BLACKLISTED)) {
            score = Math.max(score, 100);
            band = FraudAssessment.RiskBand.HIGH;
            recommendation = FraudAssessment.Recommendation.DECLINE;
            reasons.add("payer is blacklisted");
        }

        return FraudAssessment.builder()
            .score(score)
            .band(band)
            .recommendation(recommendation)
            .reasons(reasons)
            .build();
    }

    private static boolean flag(@NonNull Map<String, String> metadata, @NonNull String key) {
        return Boolean.parseBoolean(metadata.get(key));
    }

    private static int count(@NonNull Map<String, String> metadata, @NonNull String key) {
        val value = metadata.get(key);
        if (value == null) {
            return 0;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}

package com.creditintel.backend.pipeline;

/**
 * Score cut-points owned by a model version: {@code score >= lowMin} is LOW risk,
 * {@code score >= mediumMin} is MEDIUM risk, anything below is HIGH risk.
 */
public record RiskThresholds(double lowMin, double mediumMin) {

    public RiskThresholds {
        if (!(mediumMin >= 0.0 && mediumMin < lowMin && lowMin <= 100.0)) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= mediumMin < lowMin <= 100, got low="
                    + lowMin + " medium=" + mediumMin);
        }
    }

    public RiskLevel classify(double score) {
        if (score >= lowMin) {
            return RiskLevel.LOW;
        }
        if (score >= mediumMin) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }
}

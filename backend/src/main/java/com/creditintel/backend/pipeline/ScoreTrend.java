package com.creditintel.backend.pipeline;

public record ScoreTrend(
        String issuerId,
        int count,
        double averageScore,
        double scoreVariance,
        Double latestScore,
        TrendLabel label
) {

    public enum TrendLabel {
        STABLE,
        VOLATILE,
        INSUFFICIENT_DATA
    }
}

package com.creditintel.backend.pipeline;

public record ScoringOutcome(
        FeatureSnapshot snapshot,
        ScoreRecord scoreRecord,
        Explanation explanation,
        LowCoverageWarning warning
) {

    public boolean hasWarning() {
        return warning != null;
    }

    public ScoredResult toScoredResult() {
        return new ScoredResult(scoreRecord, explanation);
    }
}

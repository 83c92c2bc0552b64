package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.Objects;

public record ScoreRecord(
        ScoreKey key,
        double score,
        RiskLevel riskLevel,
        double confidence,
        boolean lowCoverage,
        Instant computedAt
) {

    public ScoreRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(riskLevel, "riskLevel");
        Objects.requireNonNull(computedAt, "computedAt");
        if (!(score >= 0.0 && score <= 100.0)) {
            throw new IllegalArgumentException("Score out of range: " + score);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
    }

    public String issuerId() {
        return key.issuerId();
    }

    public long snapshotVersion() {
        return key.snapshotVersion();
    }

    public long modelVersionId() {
        return key.modelVersionId();
    }
}

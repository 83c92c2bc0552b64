package com.creditintel.backend.dto;

import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.RiskLevel;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoringOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Fixed-shape scoring response. Built only through {@link #from(ScoringOutcome)}, which refuses
 * outcomes that break the response contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreditScoreResponse {

    private String issuerId;
    private double score;
    private RiskLevel riskLevel;
    private double confidence;
    private String explanation;
    private List<KeyFactorResponse> keyFactors;
    private long modelVersion;
    private long snapshotVersion;
    private boolean lowCoverage;
    private List<String> imputedFeatures;
    private double baselineScore;
    private Instant computedAt;

    public static CreditScoreResponse from(ScoringOutcome outcome) {
        ScoreRecord record = outcome.scoreRecord();
        Explanation explanation = outcome.explanation();
        FeatureSnapshot snapshot = outcome.snapshot();
        if (!record.key().equals(explanation.scoreKey())) {
            throw new IllegalStateException("Explanation " + explanation.scoreKey() + " does not match score "
                    + record.key());
        }
        if (snapshot.snapshotVersion() != record.snapshotVersion() || !snapshot.issuerId().equals(record.issuerId())) {
            throw new IllegalStateException("Snapshot " + snapshot.issuerId() + "#" + snapshot.snapshotVersion()
                    + " does not match score " + record.key());
        }
        if (explanation.narrative().isBlank()) {
            throw new IllegalStateException("Explanation narrative is empty for " + record.key());
        }
        return CreditScoreResponse.builder()
                .issuerId(record.issuerId())
                .score(record.score())
                .riskLevel(record.riskLevel())
                .confidence(record.confidence())
                .explanation(explanation.narrative())
                .keyFactors(explanation.keyFactors().stream().map(KeyFactorResponse::from).toList())
                .modelVersion(record.modelVersionId())
                .snapshotVersion(record.snapshotVersion())
                .lowCoverage(record.lowCoverage())
                .imputedFeatures(snapshot.imputedFeatures())
                .baselineScore(explanation.baselineScore())
                .computedAt(record.computedAt())
                .build();
    }
}

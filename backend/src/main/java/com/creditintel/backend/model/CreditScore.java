package com.creditintel.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A persisted score row. The explanation lives in the same row so the pair is written atomically.
 */
@Entity
@Table(name = "credit_scores", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"issuer_id", "snapshot_version", "model_version"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditScore {

    public static final String SCORE_TYPE_ISSUER = "issuer";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "issuer_id", nullable = false, length = 64)
    private String issuerId;

    @Column(name = "snapshot_version", nullable = false)
    private Long snapshotVersion;

    @Column(name = "model_version", nullable = false)
    private Long modelVersion;

    @Column(name = "score_type", nullable = false, length = 50)
    private String scoreType;

    @Column(nullable = false)
    private Double score;

    @Column(name = "risk_level", nullable = false, length = 20)
    private String riskLevel;

    @Column(nullable = false)
    private Double confidence;

    @Column(name = "low_coverage", nullable = false)
    private Boolean lowCoverage;

    @Column(name = "baseline_score", nullable = false)
    private Double baselineScore;

    @Column(name = "feature_contributions", nullable = false, length = 65535)
    private String featureContributions;

    @Column(name = "key_factors", nullable = false, length = 65535)
    private String keyFactors;

    @Column(nullable = false, length = 4000)
    private String explanation;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;
}

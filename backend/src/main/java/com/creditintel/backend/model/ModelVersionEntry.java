package com.creditintel.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry row for one model version. The id is assigned by the registry, not generated.
 */
@Entity
@Table(name = "model_versions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelVersionEntry {

    @Id
    @Column(name = "version_id")
    private Long versionId;

    @Column(nullable = false, length = 20)
    private String status;

    @Column(name = "model_type", nullable = false, length = 50)
    private String modelType;

    @Column(name = "feature_schema", nullable = false, length = 4000)
    private String featureSchema;

    @Column(name = "trained_at", nullable = false)
    private Instant trainedAt;

    @Column(name = "parameters_json", nullable = false, length = 65535)
    private String parametersJson;

    @Column(name = "low_min", nullable = false)
    private Double lowMin;

    @Column(name = "medium_min", nullable = false)
    private Double mediumMin;

    @Column(name = "metrics_json", nullable = false, length = 4000)
    private String metricsJson;

    @Column(name = "reference_json", nullable = false, length = 1000000)
    private String referenceJson;

    @Column(name = "evaluation_json", nullable = false, length = 1000000)
    private String evaluationJson;

    @Column(name = "baseline_score", nullable = false)
    private Double baselineScore;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}

package com.creditintel.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "model_performance")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPerformance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_version", nullable = false)
    private Long modelVersion;

    @Column(name = "model_type", length = 50)
    private String modelType;

    @Column(nullable = false, length = 20)
    private String status;

    private Double accuracy;

    @Column(name = "precision_score")
    private Double precisionScore;

    @Column(name = "recall_score")
    private Double recallScore;

    @Column(name = "f1_score")
    private Double f1Score;

    @Column(name = "auc_roc")
    private Double aucRoc;

    @Column(name = "shap_consistency")
    private Double shapConsistency;

    @Column(name = "feature_importance_stability")
    private Double featureImportanceStability;

    @Column(name = "training_date", nullable = false)
    private Instant trainingDate;

    @Column(name = "training_samples")
    private Integer trainingSamples;

    @Column(name = "validation_samples")
    private Integer validationSamples;

    @Column(name = "feature_names", length = 4000)
    private String featureNames;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}

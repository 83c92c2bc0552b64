package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One trained model in the registry arena. Instances are immutable; status changes produce a copy.
 */
public record ModelVersion(
        long versionId,
        List<String> featureSchema,
        Instant trainedAt,
        ModelStatus status,
        LogisticParameters parameters,
        RiskThresholds thresholds,
        ModelMetrics metrics,
        ReferencePopulation referencePopulation,
        ReferencePopulation evaluationSet,
        double baselineScore
) {

    public static final String MODEL_TYPE = "logistic_regression";

    public ModelVersion {
        Objects.requireNonNull(featureSchema, "featureSchema");
        Objects.requireNonNull(trainedAt, "trainedAt");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(referencePopulation, "referencePopulation");
        featureSchema = List.copyOf(featureSchema);
        evaluationSet = evaluationSet == null ? ReferencePopulation.empty() : evaluationSet;
        if (featureSchema.isEmpty()) {
            throw new IllegalArgumentException("Feature schema must not be empty");
        }
        TrainingData.requireDistinct(featureSchema);
        if (parameters.dimension() != featureSchema.size()) {
            throw new IllegalArgumentException("Parameters cover " + parameters.dimension()
                    + " features but schema has " + featureSchema.size());
        }
        if (referencePopulation.isEmpty()) {
            throw new IllegalArgumentException("Reference population must not be empty");
        }
    }

    public ModelVersion withStatus(ModelStatus newStatus) {
        return new ModelVersion(versionId, featureSchema, trainedAt, newStatus, parameters, thresholds, metrics,
                referencePopulation, evaluationSet, baselineScore);
    }

    public ModelVersion withMetrics(ModelMetrics newMetrics) {
        return new ModelVersion(versionId, featureSchema, trainedAt, status, parameters, thresholds, newMetrics,
                referencePopulation, evaluationSet, baselineScore);
    }

    public int featureIndex(String feature) {
        return featureSchema.indexOf(feature);
    }

    public double scoreVector(double[] x) {
        return parameters.creditScore(x);
    }
}

package com.creditintel.backend.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Documented aggregation rule for one feature. Reference mean/std and risk direction describe the
 * population the synthetic bootstrap model is trained on.
 */
public record FeatureDefinition(
        String name,
        SourceKind sourceKind,
        String metricName,
        Aggregation aggregation,
        Duration lookback,
        ImputationPolicy imputation,
        double neutralValue,
        String label,
        double referenceMean,
        double referenceStd,
        int riskDirection
) {

    public FeatureDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(lookback, "lookback");
        Objects.requireNonNull(imputation, "imputation");
        if (lookback.isNegative() || lookback.isZero()) {
            throw new IllegalArgumentException("Lookback must be positive for feature " + name);
        }
        if (!Double.isFinite(neutralValue)) {
            throw new IllegalArgumentException("Neutral value must be finite for feature " + name);
        }
        if (label == null || label.isBlank()) {
            label = name;
        }
    }

    public boolean matches(Observation observation) {
        return observation.sourceKind() == sourceKind && observation.metricName().equals(metricName);
    }
}

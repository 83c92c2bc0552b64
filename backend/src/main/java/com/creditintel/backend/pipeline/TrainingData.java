package com.creditintel.backend.pipeline;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record TrainingData(
        List<String> featureSchema,
        RiskThresholds thresholds,
        List<LabeledExample> examples,
        String description
) {

    public TrainingData {
        Objects.requireNonNull(thresholds, "thresholds");
        featureSchema = featureSchema == null ? List.of() : List.copyOf(featureSchema);
        examples = examples == null ? List.of() : List.copyOf(examples);
        requireDistinct(featureSchema);
    }

    static void requireDistinct(List<String> schema) {
        Set<String> seen = new HashSet<>();
        for (String feature : schema) {
            if (!seen.add(feature)) {
                throw new IllegalArgumentException("Duplicate feature in schema: " + feature);
            }
        }
    }
}

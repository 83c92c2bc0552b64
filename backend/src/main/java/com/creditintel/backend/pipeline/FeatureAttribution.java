package com.creditintel.backend.pipeline;

public record FeatureAttribution(
        String feature,
        String label,
        double value,
        double contribution
) {}

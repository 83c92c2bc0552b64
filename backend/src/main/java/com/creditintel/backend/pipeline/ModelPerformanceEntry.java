package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.List;

public record ModelPerformanceEntry(
        long versionId,
        ModelStatus status,
        List<String> featureSchema,
        ModelMetrics metrics,
        Instant trainedAt,
        Instant recordedAt
) {

    public static ModelPerformanceEntry of(ModelVersion version, Instant recordedAt) {
        return new ModelPerformanceEntry(version.versionId(), version.status(), version.featureSchema(),
                version.metrics(), version.trainedAt(), recordedAt);
    }
}

package com.creditintel.backend.dto;

import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModelMetricsResponse {

    private long modelVersion;
    private String modelType;
    private ModelStatus status;
    private double accuracy;
    private double precision;
    private double recall;
    private double f1Score;
    private double aucRoc;
    private Double shapConsistency;
    private Double featureImportanceStability;
    private int trainingSamples;
    private int validationSamples;
    private List<String> featureNames;
    private Instant trainedAt;

    public static ModelMetricsResponse from(ModelVersion version) {
        ModelMetrics metrics = version.metrics();
        return ModelMetricsResponse.builder()
                .modelVersion(version.versionId())
                .modelType(ModelVersion.MODEL_TYPE)
                .status(version.status())
                .accuracy(metrics.accuracy())
                .precision(metrics.precision())
                .recall(metrics.recall())
                .f1Score(metrics.f1Score())
                .aucRoc(metrics.aucRoc())
                .shapConsistency(metrics.shapConsistency())
                .featureImportanceStability(metrics.featureImportanceStability())
                .trainingSamples(metrics.trainingSamples())
                .validationSamples(metrics.holdoutSamples())
                .featureNames(version.featureSchema())
                .trainedAt(version.trainedAt())
                .build();
    }
}

package com.creditintel.backend.service.store;

import com.creditintel.backend.model.ModelPerformance;
import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ModelPerformanceEntry;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.repository.ModelPerformanceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;

import java.util.List;

@RequiredArgsConstructor
public class JpaModelPerformanceStore implements ModelPerformanceStore {

    private final ModelPerformanceRepository repository;
    private final JsonColumnMapper jsonColumnMapper = new JsonColumnMapper();

    @Override
    public void record(ModelPerformanceEntry entry) {
        ModelMetrics metrics = entry.metrics();
        repository.save(ModelPerformance.builder()
                .modelVersion(entry.versionId())
                .modelType(ModelVersion.MODEL_TYPE)
                .status(entry.status().name())
                .accuracy(metrics.accuracy())
                .precisionScore(metrics.precision())
                .recallScore(metrics.recall())
                .f1Score(metrics.f1Score())
                .aucRoc(metrics.aucRoc())
                .shapConsistency(metrics.shapConsistency())
                .featureImportanceStability(metrics.featureImportanceStability())
                .trainingDate(entry.trainedAt())
                .trainingSamples(metrics.trainingSamples())
                .validationSamples(metrics.holdoutSamples())
                .featureNames(jsonColumnMapper.writeStrings(entry.featureSchema()))
                .createdAt(entry.recordedAt())
                .build());
    }

    @Override
    public List<ModelPerformanceEntry> recent(int limit) {
        return repository.findByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit))).stream()
                .map(this::toEntry)
                .toList();
    }

    private ModelPerformanceEntry toEntry(ModelPerformance row) {
        ModelMetrics metrics = new ModelMetrics(
                valueOrZero(row.getAccuracy()),
                valueOrZero(row.getPrecisionScore()),
                valueOrZero(row.getRecallScore()),
                valueOrZero(row.getF1Score()),
                valueOrZero(row.getAucRoc()),
                row.getShapConsistency(),
                row.getFeatureImportanceStability(),
                row.getTrainingSamples() == null ? 0 : row.getTrainingSamples(),
                row.getValidationSamples() == null ? 0 : row.getValidationSamples());
        return new ModelPerformanceEntry(row.getModelVersion(), ModelStatus.valueOf(row.getStatus()),
                jsonColumnMapper.readStrings(row.getFeatureNames()), metrics, row.getTrainingDate(),
                row.getCreatedAt());
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0.0 : value;
    }
}

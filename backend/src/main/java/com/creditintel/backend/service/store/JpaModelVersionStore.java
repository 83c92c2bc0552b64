package com.creditintel.backend.service.store;

import com.creditintel.backend.model.ModelVersionEntry;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.RiskThresholds;
import com.creditintel.backend.repository.ModelVersionEntryRepository;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.util.List;

@RequiredArgsConstructor
public class JpaModelVersionStore implements ModelVersionStore {

    private final ModelVersionEntryRepository repository;
    private final Clock clock;
    private final JsonColumnMapper jsonColumnMapper = new JsonColumnMapper();

    @Override
    public void save(ModelVersion version) {
        repository.saveAndFlush(ModelVersionEntry.builder()
                .versionId(version.versionId())
                .status(version.status().name())
                .modelType(ModelVersion.MODEL_TYPE)
                .featureSchema(jsonColumnMapper.writeStrings(version.featureSchema()))
                .trainedAt(version.trainedAt())
                .parametersJson(jsonColumnMapper.writeParameters(version.parameters()))
                .lowMin(version.thresholds().lowMin())
                .mediumMin(version.thresholds().mediumMin())
                .metricsJson(jsonColumnMapper.writeMetrics(version.metrics()))
                .referenceJson(jsonColumnMapper.writePopulation(version.referencePopulation()))
                .evaluationJson(jsonColumnMapper.writePopulation(version.evaluationSet()))
                .baselineScore(version.baselineScore())
                .updatedAt(clock.instant())
                .build());
    }

    @Override
    public List<ModelVersion> findAll() {
        return repository.findAllByOrderByVersionIdAsc().stream()
                .map(this::toVersion)
                .toList();
    }

    private ModelVersion toVersion(ModelVersionEntry row) {
        return new ModelVersion(
                row.getVersionId(),
                jsonColumnMapper.readStrings(row.getFeatureSchema()),
                row.getTrainedAt(),
                ModelStatus.valueOf(row.getStatus()),
                jsonColumnMapper.readParameters(row.getParametersJson()),
                new RiskThresholds(row.getLowMin(), row.getMediumMin()),
                jsonColumnMapper.readMetrics(row.getMetricsJson()),
                jsonColumnMapper.readPopulation(row.getReferenceJson()),
                jsonColumnMapper.readPopulation(row.getEvaluationJson()),
                row.getBaselineScore());
    }
}

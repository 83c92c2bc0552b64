package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.pipeline.FeatureCatalog;
import com.creditintel.backend.pipeline.LabeledExample;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.RiskThresholds;
import com.creditintel.backend.pipeline.TrainingData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Trains and activates an initial model from the synthetic population on startup when nothing is
 * active yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "credit.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ModelBootstrapper implements ApplicationRunner {

    private final ModelRegistry registry;
    private final RetrainingCoordinator coordinator;
    private final SyntheticTrainingDataGenerator generator;
    private final FeatureCatalog catalog;
    private final ScoringProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (registry.active().isPresent()) {
            log.info("Active model {} present, skipping bootstrap", registry.active().get().versionId());
            return;
        }
        bootstrap();
    }

    public ModelVersion bootstrap() {
        ScoringProperties.Bootstrap config = properties.getBootstrap();
        List<LabeledExample> examples = generator.generate(catalog.definitions(), config.getSamples(),
                config.getSeed(), config.getDefaultRate());
        TrainingData data = new TrainingData(catalog.names(),
                new RiskThresholds(config.getLowMin(), config.getMediumMin()),
                examples, "synthetic bootstrap (seed " + config.getSeed() + ")");
        ModelVersion candidate = coordinator.submit(data);
        if (!coordinator.validate(candidate.versionId())) {
            throw new IllegalStateException("Bootstrap model " + candidate.versionId() + " failed validation");
        }
        ModelVersion active = coordinator.promote(candidate.versionId());
        log.info("Bootstrapped model {} over {}", active.versionId(), active.featureSchema());
        return active;
    }
}

package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.dto.ModelMetricsResponse;
import com.creditintel.backend.exception.InvalidModelTransitionException;
import com.creditintel.backend.exception.NoActiveModelException;
import com.creditintel.backend.exception.TrainingException;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.LabeledExample;
import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ModelPerformanceEntry;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.OutcomeLabel;
import com.creditintel.backend.pipeline.RiskThresholds;
import com.creditintel.backend.pipeline.TrainingData;
import com.creditintel.backend.service.ScoringMetricsService;
import com.creditintel.backend.service.store.FeatureSnapshotStore;
import com.creditintel.backend.service.store.ModelPerformanceStore;
import com.creditintel.backend.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Trains, validates and promotes model versions. A candidate only becomes active through
 * {@link #promote}, and training failures never register a candidate.
 */
@Slf4j
@Service
public class RetrainingCoordinator {

    private static final Instant HISTORY_START = Instant.parse("1900-01-01T00:00:00Z");

    private final ModelRegistry registry;
    private final LogisticTrainer trainer;
    private final ExplanationConsistency consistency;
    private final ModelPerformanceStore performanceStore;
    private final FeatureSnapshotStore snapshotStore;
    private final ScoringMetricsService metricsService;
    private final ScoringProperties properties;
    private final Clock clock;
    private final Executor trainingExecutor;

    public RetrainingCoordinator(ModelRegistry registry,
                                 LogisticTrainer trainer,
                                 ExplanationConsistency consistency,
                                 ModelPerformanceStore performanceStore,
                                 FeatureSnapshotStore snapshotStore,
                                 ScoringMetricsService metricsService,
                                 ScoringProperties properties,
                                 Clock clock,
                                 @Qualifier("trainingExecutor") Executor trainingExecutor) {
        this.registry = registry;
        this.trainer = trainer;
        this.consistency = consistency;
        this.performanceStore = performanceStore;
        this.snapshotStore = snapshotStore;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
        this.trainingExecutor = trainingExecutor;
    }

    public ModelVersion submit(TrainingData data) {
        return submit(data, CancellationToken.none());
    }

    public ModelVersion submit(TrainingData data, CancellationToken token) {
        LogisticTrainer.TrainedModel trained = trainer.train(data, token);
        ModelVersion candidate = token.commit(() -> registry.registerCandidate(new ModelVersion(
                registry.nextVersionId(),
                data.featureSchema(),
                clock.instant().truncatedTo(ChronoUnit.MICROS),
                ModelStatus.CANDIDATE,
                trained.parameters(),
                data.thresholds(),
                trained.metrics(),
                trained.referencePopulation(),
                trained.evaluationSet(),
                trained.baselineScore())));
        performanceStore.record(ModelPerformanceEntry.of(candidate, clock.instant()));
        log.info("Registered candidate model {} trained on {} ({} features)", candidate.versionId(),
                data.description(), candidate.featureSchema().size());
        return candidate;
    }

    public TrainingJob submitAsync(TrainingData data) {
        CancellationToken token = new CancellationToken();
        CompletableFuture<ModelVersion> result = CompletableFuture.supplyAsync(() -> submit(data, token),
                trainingExecutor);
        result.whenComplete((version, error) -> {
            if (error != null && !token.isCancelled()) {
                log.warn("Background training failed: {}", error.getMessage());
            }
        });
        return new TrainingJob(result, token);
    }

    public boolean validate(long candidateId) {
        return validate(candidateId, CancellationToken.none());
    }

    /**
     * Holdout metrics must clear the AUC floor and stay within tolerance of the active model;
     * explanations must stay consistent with the active model's.
     */
    public boolean validate(long candidateId, CancellationToken token) {
        ModelVersion candidate = registry.require(candidateId);
        if (candidate.status() != ModelStatus.CANDIDATE) {
            throw new InvalidModelTransitionException(candidateId, candidate.status(), ModelStatus.VALIDATED);
        }
        ScoringProperties.Retraining config = properties.getRetraining();
        ModelMetrics metrics = candidate.metrics();
        List<String> failures = new ArrayList<>();
        if (metrics.aucRoc() < config.getMinimumAuc()) {
            failures.add("auc " + metrics.aucRoc() + " below floor " + config.getMinimumAuc());
        }

        Optional<ModelVersion> active = registry.active();
        ExplanationConsistency.Report report = ExplanationConsistency.Report.identical();
        if (active.isPresent()) {
            ModelMetrics current = active.get().metrics();
            double tolerance = config.getMetricTolerance();
            compare("accuracy", metrics.accuracy(), current.accuracy(), tolerance, failures);
            compare("f1", metrics.f1Score(), current.f1Score(), tolerance, failures);
            compare("auc", metrics.aucRoc(), current.aucRoc(), tolerance, failures);
            report = consistency.compare(candidate, active.get(), token);
        }
        if (report.shapConsistency() < config.getMinShapConsistency()) {
            failures.add("shap consistency " + report.shapConsistency() + " below " + config.getMinShapConsistency());
        }
        if (report.featureImportanceStability() < config.getMinFeatureImportanceStability()) {
            failures.add("feature importance stability " + report.featureImportanceStability() + " below "
                    + config.getMinFeatureImportanceStability());
        }

        boolean passed = failures.isEmpty();
        ModelVersion updated = registry.transition(candidateId, passed ? ModelStatus.VALIDATED : ModelStatus.REJECTED,
                metrics.withExplanationMetrics(report.shapConsistency(), report.featureImportanceStability()));
        performanceStore.record(ModelPerformanceEntry.of(updated, clock.instant()));
        if (passed) {
            log.info("Model {} validated", candidateId);
        } else {
            log.warn("Model {} rejected: {}", candidateId, failures);
        }
        return passed;
    }

    public ModelVersion promote(long candidateId) {
        return registry.promote(candidateId, promoted -> {
            performanceStore.record(ModelPerformanceEntry.of(promoted, clock.instant()));
            metricsService.recordPromotion(promoted);
        });
    }

    public ModelMetricsResponse activeModelMetrics() {
        return registry.active()
                .map(ModelMetricsResponse::from)
                .orElseThrow(() -> new NoActiveModelException(null));
    }

    public List<ModelPerformanceEntry> performanceHistory(int limit) {
        return performanceStore.recent(limit);
    }

    /**
     * Joins each outcome with the issuer's latest stored snapshot at or before the outcome date and
     * submits the result as training data. Outcomes without a usable snapshot are skipped.
     */
    public ModelVersion trainFromHistory(List<OutcomeLabel> outcomes, List<String> schema, RiskThresholds thresholds) {
        List<LabeledExample> examples = new ArrayList<>();
        int skipped = 0;
        for (OutcomeLabel outcome : outcomes) {
            Optional<FeatureSnapshot> snapshot = snapshotStore
                    .findByIssuer(outcome.issuerId(), HISTORY_START, outcome.asOf()).stream()
                    .max(Comparator.comparing(FeatureSnapshot::asOf)
                            .thenComparingLong(FeatureSnapshot::snapshotVersion));
            if (snapshot.isEmpty() || !schema.stream().allMatch(snapshot.get()::hasFeature)) {
                skipped++;
                continue;
            }
            Map<String, Double> features = new LinkedHashMap<>();
            schema.forEach(feature -> features.put(feature, snapshot.get().value(feature)));
            examples.add(new LabeledExample(outcome.issuerId(), features, outcome.defaulted()));
        }
        if (examples.isEmpty()) {
            throw new TrainingException("No stored snapshots match the " + outcomes.size() + " outcomes");
        }
        log.info("Training from history: {} examples, {} outcomes skipped", examples.size(), skipped);
        return submit(new TrainingData(schema, thresholds, examples, "history (" + examples.size() + " outcomes)"));
    }

    private static void compare(String metric, double candidate, double active, double tolerance,
                                List<String> failures) {
        if (candidate < active - tolerance) {
            failures.add(metric + " " + candidate + " regressed from " + active);
        }
    }
}

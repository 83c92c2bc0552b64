package com.creditintel.backend.service;

import com.creditintel.backend.dto.ApiError;
import com.creditintel.backend.dto.CreditScoreResponse;
import com.creditintel.backend.dto.ScoringResult;
import com.creditintel.backend.exception.CreditIntelligenceException;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.LowCoverageWarning;
import com.creditintel.backend.pipeline.ModelScore;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.pipeline.ScoringModel;
import com.creditintel.backend.pipeline.ScoringOutcome;
import com.creditintel.backend.service.model.ExplanationGenerator;
import com.creditintel.backend.service.model.ModelRegistry;
import com.creditintel.backend.service.store.ScoreStore;
import com.creditintel.backend.util.IssuerLocks;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds, scores and explains one issuer at a time. Work for an issuer is serialized on its lock;
 * the score and its explanation come from the same snapshot and are stored in one call.
 */
@Slf4j
@Service
public class CreditScoringService {

    static final String MDC_ISSUER = "issuerId";

    private final FeatureSnapshotBuilder snapshotBuilder;
    private final ScoringModel scoringModel;
    private final ExplanationGenerator explanationGenerator;
    private final ModelRegistry modelRegistry;
    private final ScoreStore scoreStore;
    private final IssuerLocks issuerLocks;
    private final ScoringMetricsService metricsService;
    private final Clock clock;
    private final Executor scoringExecutor;

    public CreditScoringService(FeatureSnapshotBuilder snapshotBuilder,
                                ScoringModel scoringModel,
                                ExplanationGenerator explanationGenerator,
                                ModelRegistry modelRegistry,
                                ScoreStore scoreStore,
                                IssuerLocks issuerLocks,
                                ScoringMetricsService metricsService,
                                Clock clock,
                                @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.snapshotBuilder = snapshotBuilder;
        this.scoringModel = scoringModel;
        this.explanationGenerator = explanationGenerator;
        this.modelRegistry = modelRegistry;
        this.scoreStore = scoreStore;
        this.issuerLocks = issuerLocks;
        this.metricsService = metricsService;
        this.clock = clock;
        this.scoringExecutor = scoringExecutor;
    }

    public ScoringOutcome score(String issuerId) {
        return score(issuerId, clock.instant());
    }

    public ScoringOutcome score(String issuerId, Instant asOf) {
        String previous = MDC.get(MDC_ISSUER);
        MDC.put(MDC_ISSUER, issuerId);
        try {
            return issuerLocks.withLock(issuerId, () -> scoreLocked(issuerId, asOf));
        } finally {
            if (previous == null) {
                MDC.remove(MDC_ISSUER);
            } else {
                MDC.put(MDC_ISSUER, previous);
            }
        }
    }

    /**
     * Scores and converts the outcome to the response shape; failures come back as {@link ApiError}.
     */
    public ScoringResult evaluate(String issuerId, Instant asOf) {
        try {
            return ScoringResult.success(CreditScoreResponse.from(score(issuerId, asOf)));
        } catch (CreditIntelligenceException ex) {
            log.warn("Scoring {} failed: {}", issuerId, ex.getMessage());
            metricsService.recordScoringFailure(ex.getKind().name());
            return ScoringResult.failure(ApiError.from(ex, issuerId, clock.instant()));
        } catch (RuntimeException ex) {
            log.error("Scoring {} failed unexpectedly", issuerId, ex);
            metricsService.recordScoringFailure("INTERNAL");
            return ScoringResult.failure(ApiError.from(ex, issuerId, clock.instant()));
        }
    }

    /**
     * Scores issuers concurrently on the scoring executor. Results keep the order of {@code issuers}.
     */
    public Map<String, ScoringResult> evaluateAll(List<String> issuers, Instant asOf) {
        Map<String, CompletableFuture<ScoringResult>> pending = new LinkedHashMap<>();
        for (String issuerId : issuers) {
            pending.putIfAbsent(issuerId,
                    CompletableFuture.supplyAsync(() -> evaluate(issuerId, asOf), scoringExecutor));
        }
        Map<String, ScoringResult> results = new LinkedHashMap<>();
        pending.forEach((issuerId, future) -> results.put(issuerId, future.join()));
        return results;
    }

    public Optional<ScoredResult> find(ScoreKey key) {
        return scoreStore.find(key);
    }

    private ScoringOutcome scoreLocked(String issuerId, Instant asOf) {
        ModelVersion model = modelRegistry.requireActive(issuerId);
        FeatureSnapshot snapshot = snapshotBuilder.build(issuerId, asOf, model.featureSchema());
        ScoreKey key = new ScoreKey(issuerId, snapshot.snapshotVersion(), model.versionId());
        Optional<ScoredResult> existing = scoreStore.find(key);
        if (existing.isPresent()) {
            log.debug("Returning stored score {}", key);
            return toOutcome(snapshot, existing.get());
        }

        ModelScore modelScore = scoringModel.score(snapshot, model);
        ScoreRecord record = new ScoreRecord(key, modelScore.score(), modelScore.riskLevel(),
                modelScore.confidence(), snapshot.lowCoverage(), clock.instant().truncatedTo(ChronoUnit.MICROS));
        Explanation explanation = explanationGenerator.explain(snapshot, model, record);
        ScoredResult stored = scoreStore.saveIfAbsent(new ScoredResult(record, explanation));
        metricsService.recordScore(stored.scoreRecord().riskLevel(), stored.scoreRecord().lowCoverage());
        log.info("Scored {} at {}: {} ({}) with model {}", issuerId, snapshot.asOf(),
                String.format(Locale.ROOT, "%.2f", stored.scoreRecord().score()),
                stored.scoreRecord().riskLevel().wireName(), model.versionId());
        return toOutcome(snapshot, stored);
    }

    private ScoringOutcome toOutcome(FeatureSnapshot snapshot, ScoredResult result) {
        LowCoverageWarning warning = snapshot.lowCoverage() ? LowCoverageWarning.of(snapshot) : null;
        return new ScoringOutcome(snapshot, result.scoreRecord(), result.explanation(), warning);
    }
}

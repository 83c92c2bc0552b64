package com.creditintel.backend.service.store;

import com.creditintel.backend.model.CreditScore;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.RiskLevel;
import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.repository.CreditScoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Score and explanation share one row, so a single insert persists both.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaScoreStore implements ScoreStore {

    private final CreditScoreRepository repository;
    private final JsonColumnMapper jsonColumnMapper = new JsonColumnMapper();

    @Override
    public ScoredResult saveIfAbsent(ScoredResult result) {
        Optional<ScoredResult> existing = find(result.key());
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            repository.saveAndFlush(toEntity(result));
            return result;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Score {} stored concurrently, loading existing row", result.key());
            return find(result.key())
                    .orElseThrow(() -> new IllegalStateException("Score key collision for " + result.key(), ex));
        }
    }

    @Override
    public Optional<ScoredResult> find(ScoreKey key) {
        return repository.findByIssuerIdAndSnapshotVersionAndModelVersion(key.issuerId(), key.snapshotVersion(),
                key.modelVersionId()).map(this::toResult);
    }

    @Override
    public List<ScoredResult> findByIssuer(String issuerId, Instant from, Instant to) {
        return repository
                .findByIssuerIdAndComputedAtBetweenOrderByComputedAtAscSnapshotVersionAscModelVersionAsc(issuerId,
                        from, to)
                .stream()
                .map(this::toResult)
                .toList();
    }

    @Override
    public Optional<ScoredResult> latest(String issuerId) {
        return repository.findFirstByIssuerIdOrderByComputedAtDescSnapshotVersionDescModelVersionDesc(issuerId)
                .map(this::toResult);
    }

    @Override
    public List<String> issuers() {
        return repository.findDistinctIssuerIds();
    }

    private CreditScore toEntity(ScoredResult result) {
        ScoreRecord record = result.scoreRecord();
        Explanation explanation = result.explanation();
        return CreditScore.builder()
                .issuerId(record.issuerId())
                .snapshotVersion(record.snapshotVersion())
                .modelVersion(record.modelVersionId())
                .scoreType(CreditScore.SCORE_TYPE_ISSUER)
                .score(record.score())
                .riskLevel(record.riskLevel().wireName())
                .confidence(record.confidence())
                .lowCoverage(record.lowCoverage())
                .baselineScore(explanation.baselineScore())
                .featureContributions(jsonColumnMapper.writeAttributions(explanation.attributions()))
                .keyFactors(jsonColumnMapper.writeAttributions(explanation.keyFactors()))
                .explanation(explanation.narrative())
                .computedAt(record.computedAt())
                .build();
    }

    private ScoredResult toResult(CreditScore entity) {
        ScoreKey key = new ScoreKey(entity.getIssuerId(), entity.getSnapshotVersion(), entity.getModelVersion());
        ScoreRecord record = new ScoreRecord(key, entity.getScore(),
                RiskLevel.valueOf(entity.getRiskLevel().toUpperCase(Locale.ROOT)), entity.getConfidence(),
                entity.getLowCoverage(), entity.getComputedAt());
        Explanation explanation = new Explanation(key, entity.getBaselineScore(),
                jsonColumnMapper.readAttributions(entity.getFeatureContributions()),
                jsonColumnMapper.readAttributions(entity.getKeyFactors()),
                entity.getExplanation());
        return new ScoredResult(record, explanation);
    }
}

package com.creditintel.backend.service;

import com.creditintel.backend.dto.DashboardSummary;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.RiskLevel;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoreTrend;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.service.model.ModelRegistry;
import com.creditintel.backend.service.store.ScoreStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side over stored scores: per-issuer history and trend, and the dashboard summary.
 */
@Service
@RequiredArgsConstructor
public class ScoreHistoryService {

    static final int TREND_WINDOW = 10;
    static final double STABLE_VARIANCE = 100.0;
    private static final Instant HISTORY_START = Instant.parse("1900-01-01T00:00:00Z");

    private final ScoreStore scoreStore;
    private final ModelRegistry modelRegistry;
    private final Clock clock;

    public List<ScoredResult> history(String issuerId, Instant from, Instant to) {
        return scoreStore.findByIssuer(issuerId, from, to);
    }

    public Optional<ScoredResult> latest(String issuerId) {
        return scoreStore.latest(issuerId);
    }

    /**
     * Mean and population variance of the ten most recent scores; variance under 100 is stable.
     */
    public ScoreTrend trend(String issuerId) {
        List<ScoredResult> all = scoreStore.findByIssuer(issuerId, HISTORY_START, clock.instant());
        if (all.isEmpty()) {
            return new ScoreTrend(issuerId, 0, 0.0, 0.0, null, ScoreTrend.TrendLabel.INSUFFICIENT_DATA);
        }
        List<ScoredResult> recent = all.subList(Math.max(0, all.size() - TREND_WINDOW), all.size());
        double sum = 0.0;
        for (ScoredResult result : recent) {
            sum += result.scoreRecord().score();
        }
        double average = sum / recent.size();
        double variance = 0.0;
        for (ScoredResult result : recent) {
            double delta = result.scoreRecord().score() - average;
            variance += delta * delta;
        }
        variance /= recent.size();
        double latest = recent.get(recent.size() - 1).scoreRecord().score();
        ScoreTrend.TrendLabel label = variance < STABLE_VARIANCE
                ? ScoreTrend.TrendLabel.STABLE
                : ScoreTrend.TrendLabel.VOLATILE;
        return new ScoreTrend(issuerId, recent.size(), average, variance, latest, label);
    }

    public DashboardSummary dashboard() {
        Map<RiskLevel, Integer> distribution = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level, 0);
        }
        int issuers = 0;
        int lowCoverage = 0;
        double sum = 0.0;
        for (String issuerId : scoreStore.issuers()) {
            Optional<ScoredResult> latest = scoreStore.latest(issuerId);
            if (latest.isEmpty()) {
                continue;
            }
            ScoreRecord record = latest.get().scoreRecord();
            issuers++;
            sum += record.score();
            distribution.merge(record.riskLevel(), 1, Integer::sum);
            if (record.lowCoverage()) {
                lowCoverage++;
            }
        }
        return DashboardSummary.builder()
                .totalIssuers(issuers)
                .averageScore(issuers == 0 ? 0.0 : sum / issuers)
                .riskDistribution(distribution)
                .lowCoverageIssuers(lowCoverage)
                .activeModelVersion(modelRegistry.active().map(ModelVersion::versionId).orElse(null))
                .generatedAt(clock.instant())
                .build();
    }
}

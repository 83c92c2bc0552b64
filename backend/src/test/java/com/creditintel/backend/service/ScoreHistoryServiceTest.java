package com.creditintel.backend.service;

import com.creditintel.backend.TestModels;
import com.creditintel.backend.dto.DashboardSummary;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.RiskLevel;
import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoreTrend;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.service.model.ModelRegistry;
import com.creditintel.backend.service.store.InMemoryScoreStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoreHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-03T12:00:00Z");

    private final InMemoryScoreStore scoreStore = new InMemoryScoreStore();
    private final ModelRegistry registry = new ModelRegistry();
    private final ScoreHistoryService service =
            new ScoreHistoryService(scoreStore, registry, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void historyIsOrderedByComputationTime() {
        save("AAPL", 2L, 60.0, NOW.minus(Duration.ofDays(1)), false);
        save("AAPL", 1L, 50.0, NOW.minus(Duration.ofDays(2)), false);
        save("MSFT", 1L, 80.0, NOW.minus(Duration.ofDays(1)), false);

        List<ScoredResult> history = service.history("AAPL", NOW.minus(Duration.ofDays(7)), NOW);

        assertThat(history).extracting(result -> result.scoreRecord().score()).containsExactly(50.0, 60.0);
        assertThat(service.latest("AAPL").orElseThrow().scoreRecord().score()).isEqualTo(60.0);
    }

    @Test
    void steadyScoresAreStable() {
        for (int i = 0; i < 12; i++) {
            save("AAPL", i + 1, 60.0 + (i % 2), NOW.minus(Duration.ofHours(12 - i)), false);
        }

        ScoreTrend trend = service.trend("AAPL");

        assertThat(trend.count()).isEqualTo(10);
        assertThat(trend.averageScore()).isCloseTo(60.5, within(1e-9));
        assertThat(trend.scoreVariance()).isCloseTo(0.25, within(1e-9));
        assertThat(trend.latestScore()).isEqualTo(61.0);
        assertThat(trend.label()).isEqualTo(ScoreTrend.TrendLabel.STABLE);
    }

    @Test
    void swingingScoresAreVolatile() {
        save("AAPL", 1L, 20.0, NOW.minus(Duration.ofHours(3)), false);
        save("AAPL", 2L, 80.0, NOW.minus(Duration.ofHours(2)), false);

        assertThat(service.trend("AAPL").label()).isEqualTo(ScoreTrend.TrendLabel.VOLATILE);
    }

    @Test
    void unscoredIssuerHasNoTrend() {
        ScoreTrend trend = service.trend("NONE");

        assertThat(trend.count()).isZero();
        assertThat(trend.latestScore()).isNull();
        assertThat(trend.label()).isEqualTo(ScoreTrend.TrendLabel.INSUFFICIENT_DATA);
    }

    @Test
    void dashboardSummarisesLatestScorePerIssuer() {
        TestModels.activate(registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        save("AAPL", 1L, 30.0, NOW.minus(Duration.ofDays(2)), false);
        save("AAPL", 2L, 75.0, NOW.minus(Duration.ofDays(1)), false);
        save("MSFT", 1L, 55.0, NOW.minus(Duration.ofDays(1)), true);

        DashboardSummary summary = service.dashboard();

        assertThat(summary.getTotalIssuers()).isEqualTo(2);
        assertThat(summary.getAverageScore()).isCloseTo(65.0, within(1e-9));
        assertThat(summary.getRiskDistribution())
                .containsEntry(RiskLevel.LOW, 1)
                .containsEntry(RiskLevel.MEDIUM, 1)
                .containsEntry(RiskLevel.HIGH, 0);
        assertThat(summary.getLowCoverageIssuers()).isEqualTo(1);
        assertThat(summary.getActiveModelVersion()).isEqualTo(1L);
        assertThat(summary.getGeneratedAt()).isEqualTo(NOW);
    }

    private void save(String issuerId, long snapshotVersion, double score, Instant computedAt, boolean lowCoverage) {
        ScoreKey key = new ScoreKey(issuerId, snapshotVersion, 1L);
        ScoreRecord record = new ScoreRecord(key, score, TestModels.THRESHOLDS.classify(score), 0.6, lowCoverage,
                computedAt);
        scoreStore.saveIfAbsent(new ScoredResult(record, new Explanation(key, 50.0, List.of(), List.of(),
                issuerId + " scores " + score)));
    }
}

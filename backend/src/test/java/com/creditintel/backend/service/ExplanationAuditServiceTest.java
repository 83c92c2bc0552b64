package com.creditintel.backend.service;

import com.creditintel.backend.ScoringFixture;
import com.creditintel.backend.TestModels;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.HeadlineSentiment;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.PricePoint;
import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.pipeline.ScoringOutcome;
import com.creditintel.backend.pipeline.SourceKind;
import com.creditintel.backend.service.store.InMemoryScoreStore;
import com.creditintel.backend.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationAuditServiceTest {

    private static final Instant AS_OF = ScoringFixture.NOW;
    private static final Instant FROM = Instant.EPOCH;

    private final ScoringFixture fixture = new ScoringFixture();
    private ExplanationAuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = auditOver(fixture.scoreStore);
        TestModels.activate(fixture.registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        fixture.store(PricePoint.price("AAPL", 150.0, AS_OF.minus(Duration.ofDays(1))), SourceKind.MARKET);
        fixture.store(HeadlineSentiment.polarity("AAPL", "Apple warns on weak demand", "reuters", -0.6,
                AS_OF.minus(Duration.ofDays(2))), SourceKind.NEWS_SENTIMENT);
    }

    @Test
    void storedExplanationsAreReproduced() {
        ScoringOutcome outcome = fixture.scoringService.score("AAPL", AS_OF);

        ExplanationAuditService.AuditReport report =
                auditService.audit(List.of("AAPL"), FROM, AS_OF, CancellationToken.none());

        assertThat(report.checked()).isEqualTo(1);
        assertThat(report.reproduced()).isEqualTo(1);
        assertThat(report.clean()).isTrue();
        assertThat(auditService.regenerate(outcome.toScoredResult())).isEqualTo(outcome.explanation());
    }

    @Test
    void promotingANewModelLeavesHistoricalExplanationsIntact() {
        fixture.scoringService.score("AAPL", AS_OF);
        LogisticParameters retrained = new LogisticParameters(new double[]{110.0, 0.1}, new double[]{35.0, 0.5},
                new double[]{-0.4, -1.1}, -1.8);
        TestModels.activate(fixture.registry, TestModels.model(2L, ModelStatus.CANDIDATE, TestModels.AAPL_SCHEMA,
                retrained, TestModels.aaplReference()));
        ScoringOutcome rescored = fixture.scoringService.score("AAPL", AS_OF);

        ExplanationAuditService.AuditReport report =
                auditService.audit(List.of("AAPL"), FROM, AS_OF, CancellationToken.none());

        assertThat(rescored.scoreRecord().modelVersionId()).isEqualTo(2L);
        assertThat(fixture.registry.require(1L).status()).isEqualTo(ModelStatus.RETIRED);
        assertThat(report.checked()).isEqualTo(2);
        assertThat(report.clean()).isTrue();
    }

    @Test
    void tamperedExplanationIsReported() {
        ScoredResult genuine = fixture.scoringService.score("AAPL", AS_OF).toScoredResult();
        InMemoryScoreStore tamperedStore = new InMemoryScoreStore();
        Explanation original = genuine.explanation();
        tamperedStore.saveIfAbsent(new ScoredResult(genuine.scoreRecord(), new Explanation(original.scoreKey(),
                original.baselineScore(), original.attributions(), original.keyFactors(), "AAPL looks fine.")));

        ExplanationAuditService.AuditReport report =
                auditOver(tamperedStore).audit(List.of("AAPL"), FROM, AS_OF, CancellationToken.none());

        assertThat(report.checked()).isEqualTo(1);
        assertThat(report.reproduced()).isZero();
        assertThat(report.mismatches()).singleElement().asString().contains("differs");
        assertThat(report.clean()).isFalse();
    }

    @Test
    void scoreWithoutItsSnapshotIsReported() {
        InMemoryScoreStore orphanStore = new InMemoryScoreStore();
        ScoreKey key = new ScoreKey("AAPL", 99L, 1L);
        orphanStore.saveIfAbsent(new ScoredResult(
                new ScoreRecord(key, 60.0, TestModels.THRESHOLDS.classify(60.0), 0.6, false, AS_OF),
                new Explanation(key, 91.0, List.of(), List.of(), "AAPL scores 60.0")));

        ExplanationAuditService.AuditReport report =
                auditOver(orphanStore).audit(List.of("AAPL"), FROM, AS_OF, CancellationToken.none());

        assertThat(report.mismatches()).singleElement().asString().contains("missing");
    }

    @Test
    void cancelledAuditStopsEarly() {
        fixture.scoringService.score("AAPL", AS_OF);
        CancellationToken token = new CancellationToken();
        token.cancel();

        ExplanationAuditService.AuditReport report = auditService.audit(List.of("AAPL"), FROM, AS_OF, token);

        assertThat(report.cancelled()).isTrue();
        assertThat(report.checked()).isZero();
        assertThat(report.clean()).isFalse();
    }

    private ExplanationAuditService auditOver(InMemoryScoreStore scoreStore) {
        return new ExplanationAuditService(scoreStore, fixture.snapshotStore, fixture.registry,
                fixture.explanationGenerator);
    }
}

package com.creditintel.backend.service;

import com.creditintel.backend.ScoringFixture;
import com.creditintel.backend.TestModels;
import com.creditintel.backend.exception.NoActiveModelException;
import com.creditintel.backend.exception.SchemaMismatchException;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.HeadlineSentiment;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.PricePoint;
import com.creditintel.backend.pipeline.SourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureSnapshotBuilderTest {

    private static final Instant AS_OF = ScoringFixture.NOW;

    private final ScoringFixture fixture = new ScoringFixture();

    @Test
    void identicalInputsReuseTheLatestVersion() {
        fixture.store(PricePoint.price("AAPL", 150.0, AS_OF.minus(Duration.ofDays(1))), SourceKind.MARKET);

        FeatureSnapshot first = fixture.snapshotBuilder.build("AAPL", AS_OF, TestModels.AAPL_SCHEMA);
        FeatureSnapshot second = fixture.snapshotBuilder.build("AAPL", AS_OF, TestModels.AAPL_SCHEMA);

        assertThat(first.snapshotVersion()).isEqualTo(1L);
        assertThat(second).isEqualTo(first);
        assertThat(fixture.snapshotStore.findByIssuer("AAPL", Instant.EPOCH, AS_OF)).hasSize(1);
    }

    @Test
    void newDataMintsTheNextVersion() {
        fixture.store(PricePoint.price("AAPL", 150.0, AS_OF.minus(Duration.ofDays(2))), SourceKind.MARKET);
        FeatureSnapshot first = fixture.snapshotBuilder.build("AAPL", AS_OF, TestModels.AAPL_SCHEMA);

        fixture.store(HeadlineSentiment.polarity("AAPL", "Apple cuts guidance", "reuters", -0.6,
                AS_OF.minus(Duration.ofDays(1))), SourceKind.NEWS_SENTIMENT);
        FeatureSnapshot second = fixture.snapshotBuilder.build("AAPL", AS_OF, TestModels.AAPL_SCHEMA);

        assertThat(second.snapshotVersion()).isEqualTo(first.snapshotVersion() + 1);
        assertThat(second.contentHash()).isNotEqualTo(first.contentHash());
        assertThat(second.value("sentiment_30d")).isLessThan(0.0);
        assertThat(fixture.snapshotStore.find("AAPL", 1L)).contains(first);
    }

    @Test
    void draftsAreDeterministicAndUnversioned() {
        fixture.store(PricePoint.price("AAPL", 150.0, AS_OF.minus(Duration.ofDays(1))), SourceKind.MARKET);

        FeatureSnapshot first = fixture.snapshotBuilder.draft("AAPL", AS_OF, TestModels.AAPL_SCHEMA);
        FeatureSnapshot second = fixture.snapshotBuilder.draft("AAPL", AS_OF, TestModels.AAPL_SCHEMA);

        assertThat(first).isEqualTo(second);
        assertThat(first.isDraft()).isTrue();
        assertThat(fixture.snapshotStore.latest("AAPL")).isEmpty();
    }

    @Test
    void featureOrderFollowsTheSchema() {
        FeatureSnapshot snapshot = fixture.snapshotBuilder.build("AAPL", AS_OF,
                List.of("sentiment_30d", "gdp_growth", "price"));

        assertThat(snapshot.featureNames()).containsExactly("sentiment_30d", "gdp_growth", "price");
    }

    @Test
    void issuerWithoutDataIsFlaggedLowCoverage() {
        FeatureSnapshot snapshot = fixture.snapshotBuilder.build("NODATA", AS_OF, TestModels.AAPL_SCHEMA);

        assertThat(snapshot.lowCoverage()).isTrue();
        assertThat(snapshot.imputedFraction()).isEqualTo(1.0);
        assertThat(snapshot.imputedFeatures()).containsExactly("price", "sentiment_30d");
        assertThat(snapshot.value("price")).isEqualTo(100.0);
    }

    @Test
    void halfImputedIsNotLowCoverage() {
        fixture.store(PricePoint.price("AAPL", 150.0, AS_OF.minus(Duration.ofDays(1))), SourceKind.MARKET);

        FeatureSnapshot snapshot = fixture.snapshotBuilder.build("AAPL", AS_OF, TestModels.AAPL_SCHEMA);

        assertThat(snapshot.imputedFraction()).isEqualTo(0.5);
        assertThat(snapshot.lowCoverage()).isFalse();
    }

    @Test
    void unknownFeatureIsASchemaMismatch() {
        assertThatThrownBy(() -> fixture.snapshotBuilder.build("AAPL", AS_OF, List.of("price", "mystery")))
                .isInstanceOfSatisfying(SchemaMismatchException.class,
                        ex -> assertThat(ex.getMissingFeatures()).containsExactly("mystery"));
    }

    @Test
    void activeSchemaIsUsedByDefault() {
        TestModels.activate(fixture.registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));

        FeatureSnapshot snapshot = fixture.snapshotBuilder.build("AAPL", AS_OF);

        assertThat(snapshot.featureNames()).isEqualTo(TestModels.AAPL_SCHEMA);
    }

    @Test
    void defaultSchemaNeedsAnActiveModel() {
        assertThatThrownBy(() -> fixture.snapshotBuilder.build("AAPL", AS_OF))
                .isInstanceOf(NoActiveModelException.class);
    }
}

package com.creditintel.backend.service.store;

import com.creditintel.backend.TestModels;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.ModelPerformanceEntry;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;
import com.creditintel.backend.pipeline.RawDocument;
import com.creditintel.backend.pipeline.SourceKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStoresTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void observationRevisionsKeepHistoryAndServeTheLatest() {
        InMemoryObservationStore store = new InMemoryObservationStore();
        ObservationKey key = new ObservationKey("AAPL", SourceKind.MARKET, "price", T0);

        assertThat(store.append(new Observation(key, 150.0, Map.of(), T0.plusSeconds(1))))
                .isEqualTo(AppendResult.APPENDED);
        assertThat(store.append(new Observation(key, 150.0, Map.of(), T0.plusSeconds(2))))
                .isEqualTo(AppendResult.DUPLICATE);
        assertThat(store.append(new Observation(key, 151.5, Map.of(), T0.plusSeconds(3))))
                .isEqualTo(AppendResult.REVISED);

        assertThat(store.find(key)).get().extracting(Observation::value).isEqualTo(151.5);
        assertThat(store.findByIssuer("AAPL", T0, T0)).extracting(Observation::value).containsExactly(150.0, 151.5);
    }

    @Test
    void observationRangeIsInclusiveAndOrderedByObservedAt() {
        InMemoryObservationStore store = new InMemoryObservationStore();
        Instant later = T0.plus(Duration.ofDays(2));
        store.append(new Observation(new ObservationKey("AAPL", SourceKind.MARKET, "price", later), 2.0, Map.of(), later));
        store.append(new Observation(new ObservationKey("AAPL", SourceKind.MARKET, "price", T0), 1.0, Map.of(), later));
        store.append(new Observation(new ObservationKey("MSFT", SourceKind.MARKET, "price", T0), 9.0, Map.of(), later));

        assertThat(store.findByIssuer("AAPL", T0, later)).extracting(Observation::value).containsExactly(1.0, 2.0);
        assertThat(store.findByIssuer("AAPL", T0.plusSeconds(1), later)).hasSize(1);
        assertThat(store.findByIssuer("NONE", T0, later)).isEmpty();
    }

    @Test
    void rawDocumentsAreStoredOnce() {
        InMemoryRawDocumentStore store = new InMemoryRawDocumentStore();
        RawDocument document = new RawDocument("doc-1", "AAPL", "Apple cuts guidance", "body", "reuters",
                "https://news.example/1", T0, List.of("guidance"));

        assertThat(store.append(document)).isTrue();
        assertThat(store.append(document)).isFalse();
        assertThat(store.find("doc-1")).contains(document);
        assertThat(store.findByIssuer("AAPL", T0, T0)).containsExactly(document);
    }

    @Test
    void snapshotVersionsAreWriteOnce() {
        InMemoryFeatureSnapshotStore store = new InMemoryFeatureSnapshotStore();
        FeatureSnapshot first = TestModels.snapshot("AAPL", 1L, TestModels.features("price", 150.0, "sentiment_30d", -0.6));
        FeatureSnapshot second = TestModels.snapshot("AAPL", 2L, TestModels.features("price", 160.0, "sentiment_30d", -0.6));
        store.append(first);
        store.append(second);

        assertThat(store.latest("AAPL")).contains(second);
        assertThat(store.find("AAPL", 1L)).contains(first);
        assertThatThrownBy(() -> store.append(first)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.append(first.withVersion(0L))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void performanceEntriesAreReturnedNewestFirst() {
        InMemoryModelPerformanceStore store = new InMemoryModelPerformanceStore();
        store.record(ModelPerformanceEntry.of(TestModels.aaplModel(1L, ModelStatus.VALIDATED), T0));
        store.record(ModelPerformanceEntry.of(TestModels.aaplModel(2L, ModelStatus.REJECTED), T0.plusSeconds(60)));
        store.record(ModelPerformanceEntry.of(TestModels.aaplModel(3L, ModelStatus.ACTIVE), T0.plusSeconds(120)));

        assertThat(store.recent(2)).extracting(ModelPerformanceEntry::versionId).containsExactly(3L, 2L);
    }
}

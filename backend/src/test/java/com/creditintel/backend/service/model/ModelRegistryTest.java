package com.creditintel.backend.service.model;

import com.creditintel.backend.TestModels;
import com.creditintel.backend.exception.InvalidModelTransitionException;
import com.creditintel.backend.exception.ModelNotFoundException;
import com.creditintel.backend.exception.PromotionConflictException;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.service.store.InMemoryModelVersionStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryTest {

    private final InMemoryModelVersionStore store = new InMemoryModelVersionStore();
    private final ModelRegistry registry = new ModelRegistry(store);

    @Test
    void promotionRetiresThePreviousActiveVersion() {
        TestModels.activate(registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        ModelVersion second = TestModels.activate(registry, TestModels.aaplModel(2L, ModelStatus.CANDIDATE));

        assertThat(second.status()).isEqualTo(ModelStatus.ACTIVE);
        assertThat(registry.active()).contains(second);
        assertThat(registry.require(1L).status()).isEqualTo(ModelStatus.RETIRED);
        assertThat(registry.versions()).hasSize(2);
    }

    @Test
    void onlyValidatedVersionsCanBePromoted() {
        registry.registerCandidate(TestModels.aaplModel(1L, ModelStatus.CANDIDATE));

        assertThatThrownBy(() -> registry.promote(1L)).isInstanceOf(InvalidModelTransitionException.class);
        assertThat(registry.active()).isEmpty();
    }

    @Test
    void activationGoesThroughPromote() {
        registry.registerCandidate(TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        registry.transition(1L, ModelStatus.VALIDATED, null);

        assertThatThrownBy(() -> registry.transition(1L, ModelStatus.ACTIVE, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void activeVersionCannotBeRetiredDirectly() {
        TestModels.activate(registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));

        assertThatThrownBy(() -> registry.transition(1L, ModelStatus.RETIRED, null))
                .isInstanceOf(InvalidModelTransitionException.class);
        assertThat(registry.active()).isPresent();
    }

    @Test
    void rejectedVersionIsTerminal() {
        registry.registerCandidate(TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        registry.transition(1L, ModelStatus.REJECTED, TestModels.metrics(0.4));

        assertThat(registry.require(1L).metrics().aucRoc()).isEqualTo(0.4);
        assertThatThrownBy(() -> registry.transition(1L, ModelStatus.VALIDATED, null))
                .isInstanceOf(InvalidModelTransitionException.class);
    }

    @Test
    void unknownVersionIsReported() {
        assertThatThrownBy(() -> registry.require(99L)).isInstanceOf(ModelNotFoundException.class);
        assertThat(registry.find(99L)).isEmpty();
    }

    @Test
    void versionIdsKeepIncreasingPastRegisteredIds() {
        registry.registerCandidate(TestModels.aaplModel(5L, ModelStatus.CANDIDATE));

        assertThat(registry.nextVersionId()).isEqualTo(6L);
    }

    @Test
    void concurrentPromotionIsRefusedWhileOneIsInFlight() throws Exception {
        registry.registerCandidate(TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        registry.transition(1L, ModelStatus.VALIDATED, null);
        registry.registerCandidate(TestModels.aaplModel(2L, ModelStatus.CANDIDATE));
        registry.transition(2L, ModelStatus.VALIDATED, null);
        CountDownLatch inCallback = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<ModelVersion> first = executor.submit(() -> registry.promote(1L, promoted -> {
                inCallback.countDown();
                awaitQuietly(release);
            }));
            assertThat(inCallback.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(registry.isPromotionInFlight()).isTrue();
            assertThatThrownBy(() -> registry.promote(2L)).isInstanceOf(PromotionConflictException.class);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).versionId()).isEqualTo(1L);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
        assertThat(registry.active().map(ModelVersion::versionId)).contains(1L);
        assertThat(registry.require(2L).status()).isEqualTo(ModelStatus.VALIDATED);
    }

    @Test
    void concurrentPromotionsLeaveExactlyOneActiveVersion() throws Exception {
        int candidates = 8;
        for (long id = 1; id <= candidates; id++) {
            registry.registerCandidate(TestModels.aaplModel(id, ModelStatus.CANDIDATE));
            registry.transition(id, ModelStatus.VALIDATED, null);
        }
        ExecutorService executor = Executors.newFixedThreadPool(candidates);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (long id = 1; id <= candidates; id++) {
                long candidateId = id;
                futures.add(executor.submit(() -> {
                    awaitQuietly(start);
                    try {
                        registry.promote(candidateId);
                    } catch (PromotionConflictException ignored) {
                        // another promotion held the lock
                    }
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<ModelVersion> active = registry.versions().stream()
                .filter(version -> version.status() == ModelStatus.ACTIVE)
                .toList();
        assertThat(active).hasSize(1);
        assertThat(registry.active()).contains(active.get(0));
    }

    @Test
    void everyChangeIsWrittenThroughToTheStore() {
        TestModels.activate(registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        TestModels.activate(registry, TestModels.aaplModel(2L, ModelStatus.CANDIDATE));
        registry.registerCandidate(TestModels.aaplModel(3L, ModelStatus.CANDIDATE));
        registry.transition(3L, ModelStatus.REJECTED, TestModels.metrics(0.4));

        assertThat(store.findAll()).extracting(ModelVersion::status)
                .containsExactly(ModelStatus.RETIRED, ModelStatus.ACTIVE, ModelStatus.REJECTED);
        assertThat(store.findAll().get(2).metrics().aucRoc()).isEqualTo(0.4);
    }

    @Test
    void restartRestoresVersionsAndTheActivePointer() {
        TestModels.activate(registry, TestModels.aaplModel(1L, ModelStatus.CANDIDATE));
        registry.registerCandidate(TestModels.aaplModel(2L, ModelStatus.CANDIDATE));

        ModelRegistry restarted = new ModelRegistry(store);

        assertThat(restarted.active().map(ModelVersion::versionId)).contains(1L);
        assertThat(restarted.require(2L).status()).isEqualTo(ModelStatus.CANDIDATE);
        assertThat(restarted.versions()).hasSize(2);
    }

    @Test
    void restartNeverReusesAVersionId() {
        TestModels.activate(registry, TestModels.aaplModel(registry.nextVersionId(), ModelStatus.CANDIDATE));

        ModelRegistry restarted = new ModelRegistry(store);

        assertThat(restarted.nextVersionId()).isEqualTo(2L);
        assertThatThrownBy(() -> restarted.registerCandidate(TestModels.aaplModel(1L, ModelStatus.CANDIDATE)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already registered");
        assertThat(restarted.require(1L).status()).isEqualTo(ModelStatus.ACTIVE);
    }

    @Test
    void storeWithTwoActiveVersionsIsRefused() {
        store.save(TestModels.aaplModel(1L, ModelStatus.ACTIVE));
        store.save(TestModels.aaplModel(2L, ModelStatus.ACTIVE));

        assertThatThrownBy(() -> new ModelRegistry(store))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("two active versions");
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

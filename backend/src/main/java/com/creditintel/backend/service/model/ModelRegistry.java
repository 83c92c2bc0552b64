package com.creditintel.backend.service.model;

import com.creditintel.backend.exception.InvalidModelTransitionException;
import com.creditintel.backend.exception.ModelNotFoundException;
import com.creditintel.backend.exception.NoActiveModelException;
import com.creditintel.backend.exception.PromotionConflictException;
import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ModelStatus;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.service.store.InMemoryModelVersionStore;
import com.creditintel.backend.service.store.ModelVersionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Arena of model versions. The whole registry (versions plus the active pointer) is one immutable
 * value swapped atomically, so a reader never observes two active versions or none mid-promotion.
 * Versions are retained forever so historical explanations can be regenerated. Every change is
 * written through to the {@link ModelVersionStore} and the registry is rebuilt from it on startup,
 * so version ids are never handed out twice.
 */
@Slf4j
@Component
public class ModelRegistry {

    private final AtomicReference<RegistryState> state;
    private final AtomicLong versionSequence;
    private final ReentrantLock promotionLock = new ReentrantLock();
    private final ModelVersionStore store;

    public ModelRegistry() {
        this(new InMemoryModelVersionStore());
    }

    @Autowired
    public ModelRegistry(ModelVersionStore store) {
        this.store = store;
        RegistryState restored = RegistryState.EMPTY;
        for (ModelVersion version : store.findAll()) {
            restored = restored.with(version);
            if (version.status() == ModelStatus.ACTIVE) {
                if (restored.activeId() != null) {
                    throw new IllegalStateException("Stored registry has two active versions: "
                            + restored.activeId() + " and " + version.versionId());
                }
                restored = restored.withActive(version.versionId());
            }
        }
        this.state = new AtomicReference<>(restored);
        this.versionSequence = new AtomicLong(restored.versions().isEmpty() ? 0L : restored.versions().lastKey());
        if (!restored.versions().isEmpty()) {
            log.info("Restored {} model versions (active {}, last id {})", restored.versions().size(),
                    restored.activeId(), versionSequence.get());
        }
    }

    public long nextVersionId() {
        return versionSequence.incrementAndGet();
    }

    public ModelVersion registerCandidate(ModelVersion candidate) {
        if (candidate.status() != ModelStatus.CANDIDATE) {
            throw new IllegalArgumentException("Only candidates can be registered, got " + candidate.status());
        }
        update(current -> {
            if (current.versions().containsKey(candidate.versionId())) {
                throw new IllegalStateException("Model version " + candidate.versionId() + " already registered");
            }
            return current.with(candidate);
        });
        versionSequence.accumulateAndGet(candidate.versionId(), Math::max);
        persist(candidate.versionId());
        return candidate;
    }

    /**
     * Moves a version along the status machine. Activation is reserved for {@link #promote}.
     */
    public ModelVersion transition(long versionId, ModelStatus target, ModelMetrics metrics) {
        if (target == ModelStatus.ACTIVE) {
            throw new IllegalArgumentException("Use promote to activate a model version");
        }
        RegistryState next = update(current -> {
            ModelVersion version = current.require(versionId);
            if (!version.status().canTransitionTo(target) || Long.valueOf(versionId).equals(current.activeId())) {
                throw new InvalidModelTransitionException(versionId, version.status(), target);
            }
            ModelVersion updated = version.withStatus(target);
            if (metrics != null) {
                updated = updated.withMetrics(metrics);
            }
            return current.with(updated);
        });
        persist(versionId);
        return next.require(versionId);
    }

    public ModelVersion promote(long candidateId) {
        return promote(candidateId, promoted -> {
        });
    }

    /**
     * Activates a validated version and retires the previous active one in one state swap.
     * {@code onPromoted} runs while the promotion lock is still held.
     */
    public ModelVersion promote(long candidateId, Consumer<ModelVersion> onPromoted) {
        if (!promotionLock.tryLock()) {
            throw new PromotionConflictException(candidateId);
        }
        try {
            Long previousActive = state.get().activeId();
            RegistryState next = update(snapshot -> {
                ModelVersion candidate = snapshot.require(candidateId);
                if (candidate.status() != ModelStatus.VALIDATED) {
                    throw new InvalidModelTransitionException(candidateId, candidate.status(), ModelStatus.ACTIVE);
                }
                RegistryState swapped = snapshot;
                Long previous = snapshot.activeId();
                if (previous != null) {
                    swapped = swapped.with(snapshot.require(previous).withStatus(ModelStatus.RETIRED));
                }
                return swapped.with(candidate.withStatus(ModelStatus.ACTIVE))
                        .withActive(candidateId);
            });
            if (previousActive != null) {
                persist(previousActive);
            }
            persist(candidateId);
            ModelVersion promoted = next.require(candidateId);
            log.info("Promoted model version {} (previous active {})", candidateId, previousActive);
            onPromoted.accept(promoted);
            return promoted;
        } finally {
            promotionLock.unlock();
        }
    }

    public Optional<ModelVersion> active() {
        RegistryState current = state.get();
        return current.activeId() == null
                ? Optional.empty()
                : Optional.of(current.versions().get(current.activeId()));
    }

    public ModelVersion requireActive(String issuerId) {
        return active().orElseThrow(() -> new NoActiveModelException(issuerId));
    }

    public Optional<ModelVersion> find(long versionId) {
        return Optional.ofNullable(state.get().versions().get(versionId));
    }

    public ModelVersion require(long versionId) {
        return state.get().require(versionId);
    }

    public List<ModelVersion> versions() {
        return List.copyOf(state.get().versions().values());
    }

    public boolean isPromotionInFlight() {
        return promotionLock.isLocked();
    }

    private RegistryState update(UnaryOperator<RegistryState> change) {
        return state.updateAndGet(change);
    }

    /**
     * Writes the latest in-memory value of a version, so overlapping writers cannot leave an older
     * status in the store.
     */
    private void persist(long versionId) {
        synchronized (store) {
            store.save(state.get().require(versionId));
        }
    }

    record RegistryState(NavigableMap<Long, ModelVersion> versions, Long activeId) {

        static final RegistryState EMPTY = new RegistryState(new TreeMap<>(), null);

        RegistryState {
            versions = Collections.unmodifiableNavigableMap(versions);
        }

        RegistryState with(ModelVersion version) {
            TreeMap<Long, ModelVersion> copy = new TreeMap<>(versions);
            copy.put(version.versionId(), version);
            return new RegistryState(copy, activeId);
        }

        RegistryState withActive(long versionId) {
            return new RegistryState(versions, versionId);
        }

        ModelVersion require(long versionId) {
            ModelVersion version = versions.get(versionId);
            if (version == null) {
                throw new ModelNotFoundException(versionId);
            }
            return version;
        }
    }
}

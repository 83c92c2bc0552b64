package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.FeatureSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemoryFeatureSnapshotStore implements FeatureSnapshotStore {

    private final Map<String, NavigableMap<Long, FeatureSnapshot>> byIssuer = new ConcurrentHashMap<>();

    @Override
    public void append(FeatureSnapshot snapshot) {
        if (snapshot.isDraft()) {
            throw new IllegalArgumentException("Draft snapshots cannot be stored");
        }
        NavigableMap<Long, FeatureSnapshot> versions =
                byIssuer.computeIfAbsent(snapshot.issuerId(), id -> new ConcurrentSkipListMap<>());
        FeatureSnapshot existing = versions.putIfAbsent(snapshot.snapshotVersion(), snapshot);
        if (existing != null) {
            throw new IllegalStateException("Snapshot " + snapshot.issuerId() + "#" + snapshot.snapshotVersion()
                    + " already stored");
        }
    }

    @Override
    public Optional<FeatureSnapshot> find(String issuerId, long snapshotVersion) {
        NavigableMap<Long, FeatureSnapshot> versions = byIssuer.get(issuerId);
        return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(snapshotVersion));
    }

    @Override
    public Optional<FeatureSnapshot> latest(String issuerId) {
        NavigableMap<Long, FeatureSnapshot> versions = byIssuer.get(issuerId);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    @Override
    public List<FeatureSnapshot> findByIssuer(String issuerId, Instant from, Instant to) {
        NavigableMap<Long, FeatureSnapshot> versions = byIssuer.get(issuerId);
        if (versions == null) {
            return List.of();
        }
        return versions.values().stream()
                .filter(snapshot -> !snapshot.asOf().isBefore(from) && !snapshot.asOf().isAfter(to))
                .toList();
    }
}

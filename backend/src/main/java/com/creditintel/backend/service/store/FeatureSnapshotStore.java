package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.FeatureSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FeatureSnapshotStore {

    /**
     * Stores a snapshot that already carries its version. Versions are assigned by the caller while it
     * holds the issuer lock.
     */
    void append(FeatureSnapshot snapshot);

    Optional<FeatureSnapshot> find(String issuerId, long snapshotVersion);

    Optional<FeatureSnapshot> latest(String issuerId);

    /**
     * Snapshots with {@code from <= asOf <= to}, ordered by version.
     */
    List<FeatureSnapshot> findByIssuer(String issuerId, Instant from, Instant to);
}

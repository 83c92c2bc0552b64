package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable, versioned feature vector for one issuer at one point in time. Feature order is the
 * schema order the snapshot was built for. A version of {@code 0} marks a draft that has not been
 * registered with the snapshot store yet.
 */
public record FeatureSnapshot(
        String issuerId,
        long snapshotVersion,
        Instant asOf,
        Map<String, Double> features,
        Map<String, FeatureProvenance> provenance,
        double imputedFraction,
        boolean lowCoverage,
        String contentHash
) {

    public FeatureSnapshot {
        Objects.requireNonNull(issuerId, "issuerId");
        Objects.requireNonNull(asOf, "asOf");
        Objects.requireNonNull(contentHash, "contentHash");
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        if (!features.keySet().equals(provenance.keySet())) {
            throw new IllegalArgumentException("Every feature needs provenance: " + features.keySet()
                    + " vs " + provenance.keySet());
        }
    }

    public FeatureSnapshot withVersion(long version) {
        return new FeatureSnapshot(issuerId, version, asOf, features, provenance, imputedFraction, lowCoverage,
                contentHash);
    }

    public boolean isDraft() {
        return snapshotVersion == 0L;
    }

    public List<String> featureNames() {
        return List.copyOf(features.keySet());
    }

    public boolean hasFeature(String name) {
        return features.containsKey(name);
    }

    public double value(String name) {
        Double value = features.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Snapshot " + issuerId + "#" + snapshotVersion
                    + " has no feature " + name);
        }
        return value;
    }

    public boolean isImputed(String name) {
        FeatureProvenance entry = provenance.get(name);
        return entry != null && entry.imputed();
    }

    public List<String> imputedFeatures() {
        List<String> imputed = new ArrayList<>();
        provenance.forEach((name, entry) -> {
            if (entry.imputed()) {
                imputed.add(name);
            }
        });
        return imputed;
    }

    public List<ObservationKey> contributingObservations() {
        TreeSet<ObservationKey> keys = new TreeSet<>();
        provenance.values().forEach(entry -> keys.addAll(entry.sources()));
        return List.copyOf(keys);
    }
}

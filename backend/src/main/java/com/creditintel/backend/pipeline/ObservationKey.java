package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of an observation: (issuer, source kind, metric, observed-at).
 */
public record ObservationKey(
        String issuerId,
        SourceKind sourceKind,
        String metricName,
        Instant observedAt
) implements Comparable<ObservationKey> {

    private static final Comparator<ObservationKey> ORDER = Comparator
            .comparing(ObservationKey::issuerId)
            .thenComparing(ObservationKey::sourceKind)
            .thenComparing(ObservationKey::metricName)
            .thenComparing(ObservationKey::observedAt);

    public ObservationKey {
        Objects.requireNonNull(issuerId, "issuerId");
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    @Override
    public int compareTo(ObservationKey other) {
        return ORDER.compare(this, other);
    }
}

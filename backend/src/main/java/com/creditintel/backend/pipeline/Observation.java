package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public record Observation(
        ObservationKey key,
        double value,
        Map<String, String> attributes,
        Instant ingestedAt
) {

    public static final String ATTR_SOURCE = "source";
    public static final String ATTR_DOCUMENT_ID = "document_id";

    public Observation {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(ingestedAt, "ingestedAt");
        attributes = attributes == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(attributes));
    }

    public String issuerId() {
        return key.issuerId();
    }

    public SourceKind sourceKind() {
        return key.sourceKind();
    }

    public String metricName() {
        return key.metricName();
    }

    public Instant observedAt() {
        return key.observedAt();
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Same identity, same value bits and same attributes; ingestion time is ignored.
     */
    public boolean sameContent(Observation other) {
        return other != null
                && key.equals(other.key)
                && Double.doubleToLongBits(value) == Double.doubleToLongBits(other.value)
                && attributes.equals(other.attributes);
    }
}

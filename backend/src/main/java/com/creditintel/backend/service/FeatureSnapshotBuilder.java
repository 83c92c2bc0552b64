package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.exception.SchemaMismatchException;
import com.creditintel.backend.pipeline.FeatureCatalog;
import com.creditintel.backend.pipeline.FeatureDefinition;
import com.creditintel.backend.pipeline.FeatureProvenance;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.service.model.ModelRegistry;
import com.creditintel.backend.service.store.FeatureSnapshotStore;
import com.creditintel.backend.service.store.ObservationStore;
import com.creditintel.backend.util.HashUtils;
import com.creditintel.backend.util.IssuerLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregates an issuer's stored observations into a versioned {@link FeatureSnapshot}.
 * Identical inputs give identical content; a new version is only minted when the content differs
 * from the issuer's latest snapshot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureSnapshotBuilder {

    static final Instant HISTORY_START = Instant.parse("1900-01-01T00:00:00Z");

    private final ObservationStore observationStore;
    private final FeatureSnapshotStore snapshotStore;
    private final FeatureCatalog catalog;
    private final FeatureAggregator aggregator;
    private final ModelRegistry modelRegistry;
    private final IssuerLocks issuerLocks;
    private final ScoringProperties properties;

    /**
     * Builds against the active model's feature schema.
     */
    public FeatureSnapshot build(String issuerId, Instant asOf) {
        return build(issuerId, asOf, modelRegistry.requireActive(issuerId).featureSchema());
    }

    public FeatureSnapshot build(String issuerId, Instant asOf, List<String> schema) {
        FeatureSnapshot draft = draft(issuerId, asOf, schema);
        return issuerLocks.withLock(issuerId, () -> register(draft));
    }

    /**
     * Computes snapshot content without assigning a version or touching the snapshot store.
     */
    public FeatureSnapshot draft(String issuerId, Instant asOf, List<String> schema) {
        if (issuerId == null || issuerId.isBlank()) {
            throw new IllegalArgumentException("Issuer id is required");
        }
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("Feature schema must not be empty");
        }
        Instant effectiveAsOf = asOf.truncatedTo(ChronoUnit.MICROS);
        List<FeatureDefinition> definitions = resolve(issuerId, schema);
        List<Observation> observations = observationStore.findByIssuer(issuerId, HISTORY_START, effectiveAsOf);

        Map<String, Double> features = new LinkedHashMap<>();
        Map<String, FeatureProvenance> provenance = new LinkedHashMap<>();
        int imputed = 0;
        for (FeatureDefinition definition : definitions) {
            FeatureAggregator.FeatureValue value = aggregator.aggregate(definition, observations, effectiveAsOf);
            features.put(definition.name(), value.value());
            provenance.put(definition.name(), value.provenance());
            if (value.provenance().imputed()) {
                imputed++;
            }
        }
        double imputedFraction = (double) imputed / definitions.size();
        boolean lowCoverage = imputedFraction > properties.getSnapshot().getLowCoverageThreshold();
        String contentHash = contentHash(issuerId, effectiveAsOf, features, provenance);
        return new FeatureSnapshot(issuerId, 0L, effectiveAsOf, features, provenance, imputedFraction, lowCoverage,
                contentHash);
    }

    private FeatureSnapshot register(FeatureSnapshot draft) {
        Optional<FeatureSnapshot> latest = snapshotStore.latest(draft.issuerId());
        if (latest.isPresent() && latest.get().contentHash().equals(draft.contentHash())) {
            return latest.get();
        }
        long version = latest.map(snapshot -> snapshot.snapshotVersion() + 1).orElse(1L);
        FeatureSnapshot snapshot = draft.withVersion(version);
        snapshotStore.append(snapshot);
        if (snapshot.lowCoverage()) {
            log.warn("Snapshot {}#{} has low coverage: imputed {}", snapshot.issuerId(), version,
                    snapshot.imputedFeatures());
        } else {
            log.debug("Snapshot {}#{} registered", snapshot.issuerId(), version);
        }
        return snapshot;
    }

    private List<FeatureDefinition> resolve(String issuerId, List<String> schema) {
        List<String> unknown = schema.stream().filter(name -> catalog.find(name).isEmpty()).toList();
        if (!unknown.isEmpty()) {
            throw new SchemaMismatchException(issuerId, unknown, List.of());
        }
        return schema.stream().map(catalog::require).toList();
    }

    static String contentHash(String issuerId, Instant asOf, Map<String, Double> features,
                              Map<String, FeatureProvenance> provenance) {
        StringBuilder canonical = new StringBuilder();
        canonical.append(issuerId).append('|').append(asOf);
        features.forEach((name, value) -> {
            FeatureProvenance entry = provenance.get(name);
            canonical.append('|').append(name)
                    .append('=').append(Long.toHexString(Double.doubleToLongBits(value)))
                    .append(':').append(entry.imputation());
            entry.sources().forEach(key -> canonical.append(';')
                    .append(key.sourceKind()).append('/').append(key.metricName()).append('@').append(key.observedAt()));
        });
        return HashUtils.sha256Hex(canonical.toString());
    }
}

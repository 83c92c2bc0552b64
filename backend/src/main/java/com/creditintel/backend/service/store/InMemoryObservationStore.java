package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryObservationStore implements ObservationStore {

    private static final Comparator<Observation> ORDER = Comparator
            .comparing(Observation::key)
            .thenComparing(Observation::ingestedAt);

    // issuer -> identity -> revisions in ingestion order
    private final Map<String, TreeMap<ObservationKey, List<Observation>>> byIssuer = new ConcurrentHashMap<>();

    @Override
    public AppendResult append(Observation observation) {
        TreeMap<ObservationKey, List<Observation>> issuerRows =
                byIssuer.computeIfAbsent(observation.issuerId(), id -> new TreeMap<>());
        synchronized (issuerRows) {
            List<Observation> revisions = issuerRows.computeIfAbsent(observation.key(), key -> new ArrayList<>());
            if (revisions.isEmpty()) {
                revisions.add(observation);
                return AppendResult.APPENDED;
            }
            Observation latest = revisions.get(revisions.size() - 1);
            if (latest.sameContent(observation)) {
                return AppendResult.DUPLICATE;
            }
            revisions.add(observation);
            revisions.sort(Comparator.comparing(Observation::ingestedAt));
            return AppendResult.REVISED;
        }
    }

    @Override
    public Optional<Observation> find(ObservationKey key) {
        TreeMap<ObservationKey, List<Observation>> issuerRows = byIssuer.get(key.issuerId());
        if (issuerRows == null) {
            return Optional.empty();
        }
        synchronized (issuerRows) {
            List<Observation> revisions = issuerRows.get(key);
            if (revisions == null || revisions.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(revisions.get(revisions.size() - 1));
        }
    }

    @Override
    public List<Observation> findByIssuer(String issuerId, Instant from, Instant to) {
        TreeMap<ObservationKey, List<Observation>> issuerRows = byIssuer.get(issuerId);
        if (issuerRows == null) {
            return List.of();
        }
        List<Observation> result = new ArrayList<>();
        synchronized (issuerRows) {
            for (List<Observation> revisions : issuerRows.values()) {
                for (Observation observation : revisions) {
                    Instant observedAt = observation.observedAt();
                    if (!observedAt.isBefore(from) && !observedAt.isAfter(to)) {
                        result.add(observation);
                    }
                }
            }
        }
        result.sort(Comparator.comparing(Observation::observedAt).thenComparing(ORDER));
        return result;
    }
}

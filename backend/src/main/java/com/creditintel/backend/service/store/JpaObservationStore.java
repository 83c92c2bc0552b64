package com.creditintel.backend.service.store;

import com.creditintel.backend.model.ObservationEntry;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;
import com.creditintel.backend.repository.ObservationEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational adapter. Callers serialize appends per issuer; the unique constraint on
 * (identity, ingested-at) catches anything that slips through.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaObservationStore implements ObservationStore {

    private final ObservationEntryRepository repository;
    private final JsonColumnMapper jsonColumnMapper = new JsonColumnMapper();

    @Override
    public AppendResult append(Observation observation) {
        Optional<Observation> latest = find(observation.key());
        if (latest.isPresent() && latest.get().sameContent(observation)) {
            return AppendResult.DUPLICATE;
        }
        try {
            repository.saveAndFlush(toEntry(observation));
        } catch (DataIntegrityViolationException ex) {
            log.debug("Concurrent append for {} resolved as duplicate", observation.key());
            return AppendResult.DUPLICATE;
        }
        return latest.isPresent() ? AppendResult.REVISED : AppendResult.APPENDED;
    }

    @Override
    public Optional<Observation> find(ObservationKey key) {
        List<ObservationEntry> revisions = repository
                .findByIssuerIdAndSourceKindAndMetricNameAndObservedAtOrderByIngestedAtAsc(
                        key.issuerId(), key.sourceKind(), key.metricName(), key.observedAt());
        if (revisions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toObservation(revisions.get(revisions.size() - 1)));
    }

    @Override
    public List<Observation> findByIssuer(String issuerId, Instant from, Instant to) {
        return repository.findByIssuerIdAndObservedAtBetweenOrderByObservedAtAscIngestedAtAsc(issuerId, from, to)
                .stream()
                .map(this::toObservation)
                .toList();
    }

    private ObservationEntry toEntry(Observation observation) {
        return ObservationEntry.builder()
                .issuerId(observation.issuerId())
                .sourceKind(observation.sourceKind())
                .metricName(observation.metricName())
                .observedAt(observation.observedAt())
                .metricValue(observation.value())
                .attributesJson(jsonColumnMapper.writeAttributes(observation.attributes()))
                .ingestedAt(observation.ingestedAt())
                .build();
    }

    private Observation toObservation(ObservationEntry entry) {
        ObservationKey key = new ObservationKey(entry.getIssuerId(), entry.getSourceKind(), entry.getMetricName(),
                entry.getObservedAt());
        return new Observation(key, entry.getMetricValue(), jsonColumnMapper.readAttributes(entry.getAttributesJson()),
                entry.getIngestedAt());
    }
}

package com.creditintel.backend.repository;

import com.creditintel.backend.model.ObservationEntry;
import com.creditintel.backend.pipeline.SourceKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ObservationEntryRepository extends JpaRepository<ObservationEntry, Long> {

    List<ObservationEntry> findByIssuerIdAndSourceKindAndMetricNameAndObservedAtOrderByIngestedAtAsc(
            String issuerId, SourceKind sourceKind, String metricName, Instant observedAt);

    List<ObservationEntry> findByIssuerIdAndObservedAtBetweenOrderByObservedAtAscIngestedAtAsc(
            String issuerId, Instant from, Instant to);
}

package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of normalized observations. Several revisions may share one identity; readers
 * pick the latest ingested one.
 */
public interface ObservationStore {

    AppendResult append(Observation observation);

    /**
     * Latest revision for the identity.
     */
    Optional<Observation> find(ObservationKey key);

    /**
     * Every revision for the issuer with {@code from <= observedAt <= to}, ordered by observed-at and
     * then ingested-at.
     */
    List<Observation> findByIssuer(String issuerId, Instant from, Instant to);
}

package com.creditintel.backend.pipeline;

import java.util.List;

/**
 * Data-source adapter contract. Adapters own fetching, timeouts and retries, and must be idempotent
 * on the observation identity.
 */
public interface ObservationAdapter {

    SourceKind sourceKind();

    List<RawObservation> fetch(String issuerId);
}

package com.creditintel.backend.pipeline;

import java.time.Instant;

/**
 * Typed record returned by a data-source adapter before normalization.
 */
public interface RawObservation {

    String issuerId();

    Instant observedAt();
}

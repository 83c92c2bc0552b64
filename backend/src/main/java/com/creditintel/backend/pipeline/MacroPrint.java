package com.creditintel.backend.pipeline;

import java.time.Instant;

public record MacroPrint(
        String issuerId,
        String indicator,
        double value,
        Instant observedAt
) implements RawObservation {}

package com.creditintel.backend.pipeline;

import java.time.Instant;

/**
 * Observed credit outcome for an issuer, joined to the latest snapshot at or before {@code asOf}.
 */
public record OutcomeLabel(String issuerId, Instant asOf, boolean defaulted) {}

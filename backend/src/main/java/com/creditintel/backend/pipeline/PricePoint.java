package com.creditintel.backend.pipeline;

import java.time.Instant;

/**
 * Market-sourced numeric point: share price or a reported balance-sheet ratio.
 */
public record PricePoint(
        String issuerId,
        String metricName,
        double value,
        Instant observedAt
) implements RawObservation {

    public static final String PRICE = "price";

    public static PricePoint price(String issuerId, double price, Instant observedAt) {
        return new PricePoint(issuerId, PRICE, price, observedAt);
    }
}

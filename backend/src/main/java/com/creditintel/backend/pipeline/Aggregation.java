package com.creditintel.backend.pipeline;

public enum Aggregation {
    /** Latest observation in the window, ties broken by latest ingestion. */
    LAST_VALUE(1, true),
    /** Arithmetic mean of the window. */
    MEAN(1, true),
    /** Mean weighted by recency and source credibility. */
    WEIGHTED_MEAN(1, true),
    /** (last - first) / |first| across the window. */
    RATE_OF_CHANGE(2, false),
    /** Population standard deviation of simple returns across the window. */
    VOLATILITY(3, false);

    private final int minimumPoints;
    private final boolean carryForwardSupported;

    Aggregation(int minimumPoints, boolean carryForwardSupported) {
        this.minimumPoints = minimumPoints;
        this.carryForwardSupported = carryForwardSupported;
    }

    public int minimumPoints() {
        return minimumPoints;
    }

    public boolean carryForwardSupported() {
        return carryForwardSupported;
    }
}

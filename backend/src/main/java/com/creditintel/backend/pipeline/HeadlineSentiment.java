package com.creditintel.backend.pipeline;

import java.time.Instant;

/**
 * Headline with its sentiment score expressed on the adapter's own scale.
 */
public record HeadlineSentiment(
        String issuerId,
        String headline,
        String body,
        String source,
        String url,
        double rawScore,
        double scaleMin,
        double scaleMax,
        Instant publishedAt
) implements RawObservation {

    public static final String METRIC = "headline_sentiment";

    public static HeadlineSentiment polarity(String issuerId, String headline, String source, double polarity,
                                             Instant publishedAt) {
        return new HeadlineSentiment(issuerId, headline, null, source, null, polarity, -1.0, 1.0, publishedAt);
    }

    @Override
    public Instant observedAt() {
        return publishedAt;
    }
}

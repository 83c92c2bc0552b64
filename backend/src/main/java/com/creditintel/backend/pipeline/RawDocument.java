package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Unstructured news payload handed to the document store.
 */
public record RawDocument(
        String documentId,
        String issuerId,
        String headline,
        String body,
        String source,
        String url,
        Instant publishedAt,
        List<String> riskFactors
) {

    public RawDocument {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }
}

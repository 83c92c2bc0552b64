package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.RawDocument;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RawDocumentStore {

    /**
     * @return {@code false} when a document with the same id is already stored
     */
    boolean append(RawDocument document);

    Optional<RawDocument> find(String documentId);

    List<RawDocument> findByIssuer(String issuerId, Instant from, Instant to);
}

package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.RawDocument;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Document store adapter for raw news payloads.
 */
public class InMemoryRawDocumentStore implements RawDocumentStore {

    private final Map<String, RawDocument> documents = new ConcurrentHashMap<>();

    @Override
    public boolean append(RawDocument document) {
        return documents.putIfAbsent(document.documentId(), document) == null;
    }

    @Override
    public Optional<RawDocument> find(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public List<RawDocument> findByIssuer(String issuerId, Instant from, Instant to) {
        return documents.values().stream()
                .filter(document -> document.issuerId().equals(issuerId))
                .filter(document -> !document.publishedAt().isBefore(from) && !document.publishedAt().isAfter(to))
                .sorted(Comparator.comparing(RawDocument::publishedAt).thenComparing(RawDocument::documentId))
                .toList();
    }
}

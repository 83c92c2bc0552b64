package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoredResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persists a score together with its explanation. Readers see both or neither.
 */
public interface ScoreStore {

    /**
     * Stores the pair unless one already exists for the key; returns whatever is stored afterwards.
     */
    ScoredResult saveIfAbsent(ScoredResult result);

    Optional<ScoredResult> find(ScoreKey key);

    /**
     * Results computed in {@code [from, to]}, ordered by computed-at.
     */
    List<ScoredResult> findByIssuer(String issuerId, Instant from, Instant to);

    Optional<ScoredResult> latest(String issuerId);

    List<String> issuers();
}

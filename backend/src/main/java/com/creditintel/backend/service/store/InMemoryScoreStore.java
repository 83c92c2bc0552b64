package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.ScoreKey;
import com.creditintel.backend.pipeline.ScoredResult;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScoreStore implements ScoreStore {

    private static final Comparator<ScoredResult> BY_COMPUTED_AT = Comparator
            .comparing((ScoredResult result) -> result.scoreRecord().computedAt())
            .thenComparing(result -> result.key().snapshotVersion())
            .thenComparing(result -> result.key().modelVersionId());

    private final Map<ScoreKey, ScoredResult> results = new ConcurrentHashMap<>();

    @Override
    public ScoredResult saveIfAbsent(ScoredResult result) {
        ScoredResult existing = results.putIfAbsent(result.key(), result);
        return existing != null ? existing : result;
    }

    @Override
    public Optional<ScoredResult> find(ScoreKey key) {
        return Optional.ofNullable(results.get(key));
    }

    @Override
    public List<ScoredResult> findByIssuer(String issuerId, Instant from, Instant to) {
        return results.values().stream()
                .filter(result -> result.key().issuerId().equals(issuerId))
                .filter(result -> {
                    Instant computedAt = result.scoreRecord().computedAt();
                    return !computedAt.isBefore(from) && !computedAt.isAfter(to);
                })
                .sorted(BY_COMPUTED_AT)
                .toList();
    }

    @Override
    public Optional<ScoredResult> latest(String issuerId) {
        return results.values().stream()
                .filter(result -> result.key().issuerId().equals(issuerId))
                .max(BY_COMPUTED_AT);
    }

    @Override
    public List<String> issuers() {
        return results.keySet().stream().map(ScoreKey::issuerId).distinct().sorted().toList();
    }
}

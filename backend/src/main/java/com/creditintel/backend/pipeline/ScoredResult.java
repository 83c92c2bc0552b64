package com.creditintel.backend.pipeline;

import java.util.Objects;

/**
 * A score and the explanation derived from it; persisted and read back as one unit.
 */
public record ScoredResult(ScoreRecord scoreRecord, Explanation explanation) {

    public ScoredResult {
        Objects.requireNonNull(scoreRecord, "scoreRecord");
        Objects.requireNonNull(explanation, "explanation");
        if (!scoreRecord.key().equals(explanation.scoreKey())) {
            throw new IllegalArgumentException("Explanation " + explanation.scoreKey()
                    + " does not belong to score " + scoreRecord.key());
        }
    }

    public ScoreKey key() {
        return scoreRecord.key();
    }
}

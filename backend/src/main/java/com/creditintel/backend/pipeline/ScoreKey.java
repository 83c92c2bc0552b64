package com.creditintel.backend.pipeline;

import java.util.Objects;

public record ScoreKey(String issuerId, long snapshotVersion, long modelVersionId) {

    public ScoreKey {
        Objects.requireNonNull(issuerId, "issuerId");
    }
}

package com.creditintel.backend.pipeline;

import java.util.EnumSet;
import java.util.Set;

public enum ModelStatus {
    CANDIDATE,
    VALIDATED,
    REJECTED,
    ACTIVE,
    RETIRED;

    public boolean canTransitionTo(ModelStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<ModelStatus> allowedTargets() {
        return switch (this) {
            case CANDIDATE -> EnumSet.of(VALIDATED, REJECTED);
            case VALIDATED -> EnumSet.of(ACTIVE, RETIRED);
            case ACTIVE -> EnumSet.of(RETIRED);
            case REJECTED, RETIRED -> EnumSet.noneOf(ModelStatus.class);
        };
    }
}

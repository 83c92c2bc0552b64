package com.creditintel.backend.pipeline;

public enum ImputationKind {
    NONE,
    CARRY_FORWARD,
    NEUTRAL
}

package com.creditintel.backend.pipeline;

public enum ImputationPolicy {
    CARRY_FORWARD,
    NEUTRAL
}

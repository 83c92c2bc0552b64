package com.creditintel.backend.exception;

public enum ErrorKind {
    VALIDATION,
    SCHEMA_MISMATCH,
    TRAINING,
    PROMOTION_CONFLICT,
    EXPLANATION_MISMATCH,
    MODEL_NOT_FOUND,
    NO_ACTIVE_MODEL,
    INVALID_TRANSITION,
    INTERNAL
}

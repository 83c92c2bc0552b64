package com.creditintel.backend.exception;

public enum ValidationReason {
    SOURCE_KIND_MISMATCH,
    BLANK_ISSUER,
    BLANK_METRIC,
    BLANK_HEADLINE,
    NON_FINITE_VALUE,
    NON_POSITIVE_PRICE,
    INVALID_SCALE,
    SENTIMENT_OUT_OF_RANGE,
    MISSING_TIMESTAMP,
    FUTURE_TIMESTAMP
}

package com.creditintel.backend.pipeline;

public enum SourceKind {
    MARKET,
    MACRO,
    NEWS_SENTIMENT
}

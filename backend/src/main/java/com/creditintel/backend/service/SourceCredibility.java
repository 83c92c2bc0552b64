package com.creditintel.backend.service;

import java.util.Set;

/**
 * Credibility weight of a news outlet, applied when averaging headline sentiment.
 */
public final class SourceCredibility {

    public static final double HIGH = 1.0;
    public static final double MEDIUM = 0.7;
    public static final double OTHER = 0.5;

    private static final Set<String> HIGH_CREDIBILITY = Set.of(
            "reuters", "bloomberg", "wall street journal", "financial times",
            "cnbc", "marketwatch", "yahoo finance", "seeking alpha");

    private static final Set<String> MEDIUM_CREDIBILITY = Set.of(
            "cnn", "bbc", "forbes", "fortune", "business insider", "techcrunch", "venturebeat");

    private SourceCredibility() {
    }

    /**
     * @param source lower-cased outlet name, may be {@code null}
     */
    public static double weight(String source) {
        if (source == null) {
            return OTHER;
        }
        if (HIGH_CREDIBILITY.contains(source)) {
            return HIGH;
        }
        if (MEDIUM_CREDIBILITY.contains(source)) {
            return MEDIUM;
        }
        return OTHER;
    }
}

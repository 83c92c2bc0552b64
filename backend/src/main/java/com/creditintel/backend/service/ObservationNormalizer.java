package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.exception.ObservationValidationException;
import com.creditintel.backend.exception.ValidationReason;
import com.creditintel.backend.pipeline.HeadlineSentiment;
import com.creditintel.backend.pipeline.MacroPrint;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;
import com.creditintel.backend.pipeline.PricePoint;
import com.creditintel.backend.pipeline.RawObservation;
import com.creditintel.backend.pipeline.SourceKind;
import com.creditintel.backend.util.HashUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts adapter output into {@link Observation}s. Rejects anything it cannot represent faithfully;
 * values are never clamped or defaulted.
 */
@Service
@RequiredArgsConstructor
public class ObservationNormalizer {

    private final Clock clock;
    private final ScoringProperties properties;

    public Observation normalize(RawObservation raw, SourceKind sourceKind) {
        if (raw == null || sourceKind == null) {
            throw new IllegalArgumentException("Raw observation and source kind are required");
        }
        String issuerId = raw.issuerId();
        if (issuerId == null || issuerId.isBlank()) {
            throw reject(null, ValidationReason.BLANK_ISSUER, "Issuer id is blank");
        }
        SourceKind expected = expectedKind(raw);
        if (expected != sourceKind) {
            throw reject(issuerId, ValidationReason.SOURCE_KIND_MISMATCH,
                    raw.getClass().getSimpleName() + " cannot be ingested as " + sourceKind);
        }
        Instant observedAt = checkTimestamp(issuerId, raw.observedAt());
        Instant ingestedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);

        if (raw instanceof PricePoint point) {
            String metric = requireMetric(issuerId, point.metricName());
            double value = requireFinite(issuerId, metric, point.value());
            if (PricePoint.PRICE.equals(metric) && value <= 0.0) {
                throw reject(issuerId, ValidationReason.NON_POSITIVE_PRICE, "Price must be positive, got " + value);
            }
            return new Observation(new ObservationKey(issuerId, sourceKind, metric, observedAt), value, Map.of(),
                    ingestedAt);
        }
        if (raw instanceof MacroPrint print) {
            String metric = requireMetric(issuerId, print.indicator());
            double value = requireFinite(issuerId, metric, print.value());
            return new Observation(new ObservationKey(issuerId, sourceKind, metric, observedAt), value, Map.of(),
                    ingestedAt);
        }
        HeadlineSentiment sentiment = (HeadlineSentiment) raw;
        if (sentiment.headline() == null || sentiment.headline().isBlank()) {
            throw reject(issuerId, ValidationReason.BLANK_HEADLINE, "Headline is blank");
        }
        double polarity = rescale(issuerId, sentiment);
        Map<String, String> attributes = new TreeMap<>();
        String source = normalizeSource(sentiment.source());
        if (source != null) {
            attributes.put(Observation.ATTR_SOURCE, source);
        }
        attributes.put(Observation.ATTR_DOCUMENT_ID, documentId(sentiment));
        ObservationKey key = new ObservationKey(issuerId, sourceKind, HeadlineSentiment.METRIC, observedAt);
        return new Observation(key, polarity, attributes, ingestedAt);
    }

    /**
     * Stable id for a news item: issuer, url (or headline when absent) and publication time.
     */
    public static String documentId(HeadlineSentiment sentiment) {
        String locator = sentiment.url() != null && !sentiment.url().isBlank() ? sentiment.url() : sentiment.headline();
        Instant publishedAt = sentiment.publishedAt() == null
                ? null
                : sentiment.publishedAt().truncatedTo(ChronoUnit.MICROS);
        return HashUtils.sha256Hex(sentiment.issuerId() + "|" + locator + "|" + publishedAt);
    }

    public static String normalizeSource(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }
        return source.trim().toLowerCase(Locale.ROOT);
    }

    private SourceKind expectedKind(RawObservation raw) {
        if (raw instanceof PricePoint) {
            return SourceKind.MARKET;
        }
        if (raw instanceof MacroPrint) {
            return SourceKind.MACRO;
        }
        if (raw instanceof HeadlineSentiment) {
            return SourceKind.NEWS_SENTIMENT;
        }
        throw new IllegalArgumentException("Unsupported raw observation type " + raw.getClass().getName());
    }

    private Instant checkTimestamp(String issuerId, Instant observedAt) {
        if (observedAt == null) {
            throw reject(issuerId, ValidationReason.MISSING_TIMESTAMP, "Observation has no timestamp");
        }
        Instant latestAccepted = clock.instant().plus(properties.getNormalizer().getClockSkewTolerance());
        if (observedAt.isAfter(latestAccepted)) {
            throw reject(issuerId, ValidationReason.FUTURE_TIMESTAMP,
                    "Observation at " + observedAt + " is beyond the clock skew tolerance");
        }
        return observedAt.truncatedTo(ChronoUnit.MICROS);
    }

    private String requireMetric(String issuerId, String metric) {
        if (metric == null || metric.isBlank()) {
            throw reject(issuerId, ValidationReason.BLANK_METRIC, "Metric name is blank");
        }
        return metric;
    }

    private double requireFinite(String issuerId, String metric, double value) {
        if (!Double.isFinite(value)) {
            throw reject(issuerId, ValidationReason.NON_FINITE_VALUE, metric + " value is not finite: " + value);
        }
        return value;
    }

    private double rescale(String issuerId, HeadlineSentiment sentiment) {
        double min = sentiment.scaleMin();
        double max = sentiment.scaleMax();
        if (!Double.isFinite(min) || !Double.isFinite(max) || !(max > min)) {
            throw reject(issuerId, ValidationReason.INVALID_SCALE,
                    "Sentiment scale [" + min + ", " + max + "] is not a valid range");
        }
        double raw = requireFinite(issuerId, HeadlineSentiment.METRIC, sentiment.rawScore());
        double polarity = (min == -1.0 && max == 1.0) ? raw : -1.0 + 2.0 * (raw - min) / (max - min);
        if (polarity < -1.0 || polarity > 1.0) {
            throw reject(issuerId, ValidationReason.SENTIMENT_OUT_OF_RANGE,
                    "Sentiment " + raw + " lies outside its scale [" + min + ", " + max + "]");
        }
        return polarity;
    }

    private static ObservationValidationException reject(String issuerId, ValidationReason reason, String message) {
        return new ObservationValidationException(issuerId, reason, message);
    }
}

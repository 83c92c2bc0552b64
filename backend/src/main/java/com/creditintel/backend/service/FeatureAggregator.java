package com.creditintel.backend.service;

import com.creditintel.backend.pipeline.Aggregation;
import com.creditintel.backend.pipeline.FeatureDefinition;
import com.creditintel.backend.pipeline.FeatureProvenance;
import com.creditintel.backend.pipeline.ImputationKind;
import com.creditintel.backend.pipeline.ImputationPolicy;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationKey;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Applies one feature's windowing and aggregation rule to an issuer's observations.
 * The window is {@code (asOf - lookback, asOf]}.
 */
@Component
public class FeatureAggregator {

    public record FeatureValue(double value, FeatureProvenance provenance) {
    }

    public FeatureValue aggregate(FeatureDefinition definition, List<Observation> observations, Instant asOf) {
        List<Observation> history = latestRevisions(definition, observations, asOf);
        Instant windowStart = asOf.minus(definition.lookback());
        List<Observation> window = new ArrayList<>();
        Observation beforeWindow = null;
        for (Observation observation : history) {
            if (observation.observedAt().isAfter(windowStart)) {
                window.add(observation);
            } else {
                beforeWindow = observation;
            }
        }

        if (window.size() >= definition.aggregation().minimumPoints()) {
            OptionalDouble value = compute(definition, window, asOf);
            if (value.isPresent()) {
                return new FeatureValue(value.getAsDouble(), FeatureProvenance.observed(sourcesOf(definition, window)));
            }
        }
        return impute(definition, beforeWindow);
    }

    private FeatureValue impute(FeatureDefinition definition, Observation beforeWindow) {
        if (definition.imputation() == ImputationPolicy.CARRY_FORWARD
                && definition.aggregation().carryForwardSupported()
                && beforeWindow != null) {
            return new FeatureValue(beforeWindow.value(),
                    new FeatureProvenance(List.of(beforeWindow.key()), ImputationKind.CARRY_FORWARD));
        }
        return new FeatureValue(definition.neutralValue(), FeatureProvenance.neutral());
    }

    /**
     * Matching observations up to {@code asOf}, one per identity (latest ingestion wins), ordered by
     * observed-at.
     */
    private List<Observation> latestRevisions(FeatureDefinition definition, List<Observation> observations,
                                              Instant asOf) {
        Map<ObservationKey, Observation> latest = new TreeMap<>();
        for (Observation observation : observations) {
            if (!definition.matches(observation) || observation.observedAt().isAfter(asOf)) {
                continue;
            }
            latest.merge(observation.key(), observation,
                    (current, candidate) -> candidate.ingestedAt().isBefore(current.ingestedAt()) ? current : candidate);
        }
        List<Observation> ordered = new ArrayList<>(latest.values());
        ordered.sort((a, b) -> a.observedAt().compareTo(b.observedAt()));
        return ordered;
    }

    private List<ObservationKey> sourcesOf(FeatureDefinition definition, List<Observation> window) {
        if (definition.aggregation() == Aggregation.LAST_VALUE) {
            return List.of(window.get(window.size() - 1).key());
        }
        return window.stream().map(Observation::key).toList();
    }

    private OptionalDouble compute(FeatureDefinition definition, List<Observation> window, Instant asOf) {
        OptionalDouble value = switch (definition.aggregation()) {
            case LAST_VALUE -> OptionalDouble.of(window.get(window.size() - 1).value());
            case MEAN -> mean(window);
            case WEIGHTED_MEAN -> weightedMean(window, asOf, definition.lookback());
            case RATE_OF_CHANGE -> rateOfChange(window);
            case VOLATILITY -> volatility(window);
        };
        if (value.isPresent() && !Double.isFinite(value.getAsDouble())) {
            return OptionalDouble.empty();
        }
        return value;
    }

    private OptionalDouble mean(List<Observation> window) {
        double sum = 0.0;
        for (Observation observation : window) {
            sum += observation.value();
        }
        return OptionalDouble.of(sum / window.size());
    }

    private OptionalDouble weightedMean(List<Observation> window, Instant asOf, Duration lookback) {
        double lookbackSeconds = lookback.toMillis() / 1000.0;
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Observation observation : window) {
            double ageSeconds = Duration.between(observation.observedAt(), asOf).toMillis() / 1000.0;
            double recency = Math.max(0.1, 1.0 - ageSeconds / lookbackSeconds);
            double weight = recency * SourceCredibility.weight(observation.attribute(Observation.ATTR_SOURCE));
            weightedSum += observation.value() * weight;
            totalWeight += weight;
        }
        if (totalWeight <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(weightedSum / totalWeight);
    }

    private OptionalDouble rateOfChange(List<Observation> window) {
        double first = window.get(0).value();
        double last = window.get(window.size() - 1).value();
        if (first == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((last - first) / Math.abs(first));
    }

    private OptionalDouble volatility(List<Observation> window) {
        double[] returns = new double[window.size() - 1];
        for (int i = 1; i < window.size(); i++) {
            double previous = window.get(i - 1).value();
            if (previous == 0.0) {
                return OptionalDouble.empty();
            }
            returns[i - 1] = (window.get(i).value() - previous) / Math.abs(previous);
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        return OptionalDouble.of(Math.sqrt(variance / returns.length));
    }
}

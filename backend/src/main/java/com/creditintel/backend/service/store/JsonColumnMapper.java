package com.creditintel.backend.service.store;

import com.creditintel.backend.pipeline.FeatureAttribution;
import com.creditintel.backend.pipeline.FeatureProvenance;
import com.creditintel.backend.pipeline.ImputationKind;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ObservationKey;
import com.creditintel.backend.pipeline.ReferencePopulation;
import com.creditintel.backend.pipeline.SourceKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON encoding for the structured columns of the JPA adapters. Key order is preserved so that
 * snapshots read back with the feature order they were written with.
 */
class JsonColumnMapper {

    private static final TypeReference<LinkedHashMap<String, Double>> FEATURES = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, ProvenanceJson>> PROVENANCE = new TypeReference<>() {
    };
    private static final TypeReference<List<FeatureAttribution>> ATTRIBUTIONS = new TypeReference<>() {
    };
    private static final TypeReference<TreeMap<String, String>> ATTRIBUTES = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };
    private static final TypeReference<List<double[]>> ROWS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    String writeFeatures(Map<String, Double> features) {
        return write(features);
    }

    Map<String, Double> readFeatures(String json) {
        return read(json, FEATURES);
    }

    String writeProvenance(Map<String, FeatureProvenance> provenance) {
        Map<String, ProvenanceJson> encoded = new LinkedHashMap<>();
        provenance.forEach((feature, entry) -> encoded.put(feature, new ProvenanceJson(
                entry.imputation().name(),
                entry.sources().stream().map(KeyJson::of).toList())));
        return write(encoded);
    }

    Map<String, FeatureProvenance> readProvenance(String json) {
        Map<String, FeatureProvenance> decoded = new LinkedHashMap<>();
        read(json, PROVENANCE).forEach((feature, entry) -> decoded.put(feature, new FeatureProvenance(
                entry.sources().stream().map(KeyJson::toKey).toList(),
                ImputationKind.valueOf(entry.imputation()))));
        return decoded;
    }

    String writeAttributions(List<FeatureAttribution> attributions) {
        return write(attributions);
    }

    List<FeatureAttribution> readAttributions(String json) {
        return read(json, ATTRIBUTIONS);
    }

    String writeAttributes(Map<String, String> attributes) {
        return write(attributes);
    }

    Map<String, String> readAttributes(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        return read(json, ATTRIBUTES);
    }

    String writeStrings(List<String> values) {
        return write(values);
    }

    List<String> readStrings(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        return read(json, STRINGS);
    }

    String writeParameters(LogisticParameters parameters) {
        int dimension = parameters.dimension();
        double[] means = new double[dimension];
        double[] scales = new double[dimension];
        double[] coefficients = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            means[i] = parameters.mean(i);
            scales[i] = parameters.scale(i);
            coefficients[i] = parameters.coefficient(i);
        }
        return write(new ParametersJson(means, scales, coefficients, parameters.intercept()));
    }

    LogisticParameters readParameters(String json) {
        ParametersJson decoded = read(json, new TypeReference<ParametersJson>() {
        });
        return new LogisticParameters(decoded.means(), decoded.scales(), decoded.coefficients(), decoded.intercept());
    }

    String writeMetrics(ModelMetrics metrics) {
        return write(metrics);
    }

    ModelMetrics readMetrics(String json) {
        return read(json, new TypeReference<ModelMetrics>() {
        });
    }

    String writePopulation(ReferencePopulation population) {
        List<double[]> rows = new ArrayList<>(population.size());
        for (int i = 0; i < population.size(); i++) {
            rows.add(population.row(i));
        }
        return write(rows);
    }

    ReferencePopulation readPopulation(String json) {
        if (json == null || json.isBlank()) {
            return ReferencePopulation.empty();
        }
        return new ReferencePopulation(read(json, ROWS));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize column payload", e);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored column payload unreadable", e);
        }
    }

    record ParametersJson(double[] means, double[] scales, double[] coefficients, double intercept) {
    }

    record ProvenanceJson(String imputation, List<KeyJson> sources) {
    }

    record KeyJson(String issuerId, String sourceKind, String metricName, String observedAt) {

        static KeyJson of(ObservationKey key) {
            return new KeyJson(key.issuerId(), key.sourceKind().name(), key.metricName(), key.observedAt().toString());
        }

        ObservationKey toKey() {
            return new ObservationKey(issuerId, SourceKind.valueOf(sourceKind), metricName, Instant.parse(observedAt));
        }
    }
}

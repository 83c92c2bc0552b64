package com.creditintel.backend.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of feature definitions by name, in declaration order.
 */
public final class FeatureCatalog {

    private final Map<String, FeatureDefinition> definitions;

    public FeatureCatalog(List<FeatureDefinition> definitions) {
        Map<String, FeatureDefinition> byName = new LinkedHashMap<>();
        for (FeatureDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate feature definition: " + definition.name());
            }
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public Optional<FeatureDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public FeatureDefinition require(String name) {
        FeatureDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Feature " + name + " is not in the catalog");
        }
        return definition;
    }

    public String label(String name) {
        FeatureDefinition definition = definitions.get(name);
        return definition == null ? name : definition.label();
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    public List<FeatureDefinition> definitions() {
        return List.copyOf(definitions.values());
    }
}

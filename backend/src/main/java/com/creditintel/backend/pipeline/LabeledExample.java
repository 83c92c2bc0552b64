package com.creditintel.backend.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LabeledExample(String issuerId, Map<String, Double> features, boolean defaulted) {

    public LabeledExample {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public static LabeledExample fromSnapshot(FeatureSnapshot snapshot, boolean defaulted) {
        return new LabeledExample(snapshot.issuerId(), snapshot.features(), defaulted);
    }
}

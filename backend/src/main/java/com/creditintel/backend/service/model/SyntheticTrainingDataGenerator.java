package com.creditintel.backend.service.model;

import com.creditintel.backend.pipeline.FeatureDefinition;
import com.creditintel.backend.pipeline.LabeledExample;
import com.creditintel.backend.pipeline.LogisticParameters;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded synthetic population used to train the first model when no outcome history exists.
 * Features are drawn around each definition's reference mean; default risk rises with every
 * feature's documented risk direction.
 */
@Component
public class SyntheticTrainingDataGenerator {

    static final double RISK_SLOPE = 1.5;

    public List<LabeledExample> generate(List<FeatureDefinition> definitions, int samples, long seed,
                                         double defaultRate) {
        Random random = new Random(seed);
        double baseLogit = Math.log(defaultRate / (1.0 - defaultRate));
        double normalization = Math.sqrt(definitions.size());
        List<LabeledExample> examples = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            Map<String, Double> features = new LinkedHashMap<>();
            double risk = 0.0;
            for (FeatureDefinition definition : definitions) {
                double std = definition.referenceStd() > 0.0 ? definition.referenceStd() : 1.0;
                double z = random.nextGaussian();
                features.put(definition.name(), definition.referenceMean() + std * z);
                risk += definition.riskDirection() * z;
            }
            double pDefault = LogisticParameters.sigmoid(baseLogit + RISK_SLOPE * risk / normalization);
            boolean defaulted = random.nextDouble() < pDefault;
            examples.add(new LabeledExample("SYNTH-" + i, features, defaulted));
        }
        return examples;
    }
}

package com.creditintel.backend.service.model;

import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ModelScore;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.ScoringModel;
import org.springframework.stereotype.Component;

/**
 * Logistic regression over standardized features. The score is the probability of not defaulting
 * scaled to [0, 100]; confidence is the probability of the predicted class.
 */
@Component
public class LogisticScoringModel implements ScoringModel {

    @Override
    public ModelScore score(FeatureSnapshot snapshot, ModelVersion modelVersion) {
        double[] x = SchemaGuard.vector(snapshot, modelVersion.featureSchema());
        LogisticParameters parameters = modelVersion.parameters();
        double pDefault = parameters.defaultProbability(x);
        double score = parameters.creditScore(x);
        double confidence = Math.max(pDefault, 1.0 - pDefault);
        return new ModelScore(score, modelVersion.thresholds().classify(score), confidence);
    }
}

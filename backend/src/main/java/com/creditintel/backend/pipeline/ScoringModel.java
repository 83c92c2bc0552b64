package com.creditintel.backend.pipeline;

public interface ScoringModel {

    ModelScore score(FeatureSnapshot snapshot, ModelVersion modelVersion);
}

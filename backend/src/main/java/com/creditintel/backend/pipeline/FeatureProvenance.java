package com.creditintel.backend.pipeline;

import java.util.List;
import java.util.Objects;

public record FeatureProvenance(List<ObservationKey> sources, ImputationKind imputation) {

    public FeatureProvenance {
        Objects.requireNonNull(imputation, "imputation");
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static FeatureProvenance observed(List<ObservationKey> sources) {
        return new FeatureProvenance(sources, ImputationKind.NONE);
    }

    public static FeatureProvenance neutral() {
        return new FeatureProvenance(List.of(), ImputationKind.NEUTRAL);
    }

    public boolean imputed() {
        return imputation != ImputationKind.NONE;
    }
}

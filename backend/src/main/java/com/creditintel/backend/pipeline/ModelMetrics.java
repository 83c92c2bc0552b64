package com.creditintel.backend.pipeline;

/**
 * Holdout metrics of a model version. The two explanation metrics stay {@code null} until the
 * version has been validated against the active model.
 */
public record ModelMetrics(
        double accuracy,
        double precision,
        double recall,
        double f1Score,
        double aucRoc,
        Double shapConsistency,
        Double featureImportanceStability,
        int trainingSamples,
        int holdoutSamples
) {

    public ModelMetrics withExplanationMetrics(double shapConsistency, double featureImportanceStability) {
        return new ModelMetrics(accuracy, precision, recall, f1Score, aucRoc, shapConsistency,
                featureImportanceStability, trainingSamples, holdoutSamples);
    }
}

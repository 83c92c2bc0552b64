package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.exception.TrainingException;
import com.creditintel.backend.pipeline.LabeledExample;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ModelMetrics;
import com.creditintel.backend.pipeline.ReferencePopulation;
import com.creditintel.backend.pipeline.TrainingData;
import com.creditintel.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic L2-regularized logistic regression fitted by batch gradient descent on
 * standardized features. Every {@code holdoutStride}-th row is held out for evaluation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogisticTrainer {

    static final double MIN_SCALE = 1e-12;

    private final ScoringProperties properties;

    public record TrainedModel(
            LogisticParameters parameters,
            ModelMetrics metrics,
            ReferencePopulation referencePopulation,
            ReferencePopulation evaluationSet,
            double baselineScore
    ) {
    }

    public TrainedModel train(TrainingData data, CancellationToken token) {
        ScoringProperties.Retraining config = properties.getRetraining();
        List<String> schema = data.featureSchema();
        if (schema.isEmpty()) {
            throw new TrainingException("Training data has no feature schema");
        }
        if (data.examples().isEmpty()) {
            throw new TrainingException("Training data is empty");
        }
        double[][] rows = matrix(data);
        boolean[] labels = new boolean[rows.length];
        for (int i = 0; i < rows.length; i++) {
            labels[i] = data.examples().get(i).defaulted();
        }

        List<double[]> trainRows = new ArrayList<>();
        List<Boolean> trainLabels = new ArrayList<>();
        List<double[]> holdoutRows = new ArrayList<>();
        List<Boolean> holdoutLabels = new ArrayList<>();
        int stride = config.getHoldoutStride();
        for (int i = 0; i < rows.length; i++) {
            if (i % stride == stride - 1) {
                holdoutRows.add(rows[i]);
                holdoutLabels.add(labels[i]);
            } else {
                trainRows.add(rows[i]);
                trainLabels.add(labels[i]);
            }
        }
        if (holdoutRows.size() < config.getMinHoldoutRows()) {
            throw new TrainingException("Holdout has " + holdoutRows.size() + " rows, at least "
                    + config.getMinHoldoutRows() + " required");
        }
        long trainDefaults = trainLabels.stream().filter(Boolean::booleanValue).count();
        if (trainDefaults == 0 || trainDefaults == trainRows.size()) {
            throw new TrainingException("Training rows contain a single outcome class");
        }

        int d = schema.size();
        double[] means = new double[d];
        double[] scales = new double[d];
        standardization(trainRows, means, scales);

        double[] weights = new double[d];
        double intercept = Math.log((double) trainDefaults / (trainRows.size() - trainDefaults));
        double[][] z = standardize(trainRows, means, scales);
        int n = z.length;
        for (int iteration = 0; iteration < config.getIterations(); iteration++) {
            token.throwIfCancelled();
            double[] gradient = new double[d];
            double interceptGradient = 0.0;
            for (int i = 0; i < n; i++) {
                double logit = intercept;
                for (int j = 0; j < d; j++) {
                    logit += weights[j] * z[i][j];
                }
                double error = LogisticParameters.sigmoid(logit) - (trainLabels.get(i) ? 1.0 : 0.0);
                for (int j = 0; j < d; j++) {
                    gradient[j] += error * z[i][j];
                }
                interceptGradient += error;
            }
            for (int j = 0; j < d; j++) {
                weights[j] -= config.getLearningRate() * (gradient[j] / n + config.getL2() * weights[j]);
            }
            intercept -= config.getLearningRate() * interceptGradient / n;
            if (!Double.isFinite(intercept) || !allFinite(weights)) {
                throw new TrainingException("Gradient descent diverged at iteration " + iteration);
            }
        }

        LogisticParameters parameters = new LogisticParameters(means, scales, weights, intercept);
        double[] holdoutProbabilities = new double[holdoutRows.size()];
        boolean[] holdoutDefaults = new boolean[holdoutRows.size()];
        for (int i = 0; i < holdoutRows.size(); i++) {
            holdoutProbabilities[i] = parameters.defaultProbability(holdoutRows.get(i));
            holdoutDefaults[i] = holdoutLabels.get(i);
        }
        ClassificationMetrics holdout = ClassificationMetrics.evaluate(holdoutProbabilities, holdoutDefaults);
        ModelMetrics metrics = new ModelMetrics(holdout.accuracy(), holdout.precision(), holdout.recall(),
                holdout.f1Score(), holdout.aucRoc(), null, null, trainRows.size(), holdoutRows.size());

        ReferencePopulation reference = new ReferencePopulation(strided(trainRows, config.getReferenceSize()));
        ReferencePopulation evaluation = new ReferencePopulation(
                holdoutRows.subList(0, Math.min(config.getEvaluationSize(), holdoutRows.size())));
        double baseline = reference.meanScore(parameters);
        log.info("Trained logistic model on {} rows ({} holdout): accuracy={} auc={}",
                trainRows.size(), holdoutRows.size(), holdout.accuracy(), holdout.aucRoc());
        return new TrainedModel(parameters, metrics, reference, evaluation, baseline);
    }

    private double[][] matrix(TrainingData data) {
        List<String> schema = data.featureSchema();
        double[][] rows = new double[data.examples().size()][schema.size()];
        for (int i = 0; i < rows.length; i++) {
            LabeledExample example = data.examples().get(i);
            for (int j = 0; j < schema.size(); j++) {
                Double value = example.features().get(schema.get(j));
                if (value == null) {
                    throw new TrainingException("Row " + i + " (" + example.issuerId() + ") is missing feature "
                            + schema.get(j));
                }
                if (!Double.isFinite(value)) {
                    throw new TrainingException("Row " + i + " (" + example.issuerId() + ") has non-finite "
                            + schema.get(j));
                }
                rows[i][j] = value;
            }
        }
        return rows;
    }

    private static void standardization(List<double[]> rows, double[] means, double[] scales) {
        int d = means.length;
        for (double[] row : rows) {
            for (int j = 0; j < d; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < d; j++) {
            means[j] /= rows.size();
        }
        for (double[] row : rows) {
            for (int j = 0; j < d; j++) {
                scales[j] += (row[j] - means[j]) * (row[j] - means[j]);
            }
        }
        for (int j = 0; j < d; j++) {
            double std = Math.sqrt(scales[j] / rows.size());
            scales[j] = std < MIN_SCALE ? 1.0 : std;
        }
    }

    private static double[][] standardize(List<double[]> rows, double[] means, double[] scales) {
        double[][] z = new double[rows.size()][means.length];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < means.length; j++) {
                z[i][j] = (rows.get(i)[j] - means[j]) / scales[j];
            }
        }
        return z;
    }

    static List<double[]> strided(List<double[]> rows, int limit) {
        if (rows.size() <= limit) {
            return rows;
        }
        List<double[]> sample = new ArrayList<>(limit);
        double step = (double) rows.size() / limit;
        for (int i = 0; i < limit; i++) {
            sample.add(rows.get((int) Math.floor(i * step)));
        }
        return sample;
    }

    private static boolean allFinite(double[] values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}

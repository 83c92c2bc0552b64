package com.creditintel.backend.pipeline;

import java.util.Arrays;

/**
 * Fitted logistic-regression parameters over standardized features. The modelled event is default,
 * so the credit score is {@code 100 * (1 - P(default))}.
 */
public final class LogisticParameters {

    private final double[] means;
    private final double[] scales;
    private final double[] coefficients;
    private final double intercept;

    public LogisticParameters(double[] means, double[] scales, double[] coefficients, double intercept) {
        if (means.length != scales.length || means.length != coefficients.length) {
            throw new IllegalArgumentException("Parameter arrays must have equal length");
        }
        for (double scale : scales) {
            if (!(scale > 0.0) || !Double.isFinite(scale)) {
                throw new IllegalArgumentException("Scales must be positive and finite");
            }
        }
        this.means = means.clone();
        this.scales = scales.clone();
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    public int dimension() {
        return coefficients.length;
    }

    public double mean(int index) {
        return means[index];
    }

    public double scale(int index) {
        return scales[index];
    }

    public double coefficient(int index) {
        return coefficients[index];
    }

    public double intercept() {
        return intercept;
    }

    public double logit(double[] x) {
        double z = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            z += coefficients[i] * ((x[i] - means[i]) / scales[i]);
        }
        return z;
    }

    public double defaultProbability(double[] x) {
        return sigmoid(logit(x));
    }

    public double creditScore(double[] x) {
        return 100.0 * (1.0 - defaultProbability(x));
    }

    public static double sigmoid(double z) {
        if (z >= 0) {
            return 1.0 / (1.0 + Math.exp(-z));
        }
        double e = Math.exp(z);
        return e / (1.0 + e);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof LogisticParameters that)) {
            return false;
        }
        return Double.compare(intercept, that.intercept) == 0
                && Arrays.equals(means, that.means)
                && Arrays.equals(scales, that.scales)
                && Arrays.equals(coefficients, that.coefficients);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(means);
        result = 31 * result + Arrays.hashCode(scales);
        result = 31 * result + Arrays.hashCode(coefficients);
        return 31 * result + Double.hashCode(intercept);
    }

    @Override
    public String toString() {
        return "LogisticParameters{coefficients=" + Arrays.toString(coefficients) + ", intercept=" + intercept + "}";
    }
}

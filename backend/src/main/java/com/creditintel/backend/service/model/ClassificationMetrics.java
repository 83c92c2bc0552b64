package com.creditintel.backend.service.model;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Holdout metrics for a binary classifier whose positive class is default.
 */
public record ClassificationMetrics(double accuracy, double precision, double recall, double f1Score,
                                    double aucRoc) {

    static final double DECISION_THRESHOLD = 0.5;

    public static ClassificationMetrics evaluate(double[] defaultProbabilities, boolean[] defaulted) {
        int n = defaultProbabilities.length;
        int tp = 0;
        int fp = 0;
        int tn = 0;
        int fn = 0;
        for (int i = 0; i < n; i++) {
            boolean predicted = defaultProbabilities[i] >= DECISION_THRESHOLD;
            if (predicted && defaulted[i]) {
                tp++;
            } else if (predicted) {
                fp++;
            } else if (defaulted[i]) {
                fn++;
            } else {
                tn++;
            }
        }
        double accuracy = n == 0 ? 0.0 : (double) (tp + tn) / n;
        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0.0 ? 0.0 : 2.0 * precision * recall / (precision + recall);
        return new ClassificationMetrics(accuracy, precision, recall, f1, auc(defaultProbabilities, defaulted));
    }

    /**
     * Mann-Whitney rank statistic with average ranks for ties.
     */
    static double auc(double[] scores, boolean[] positive) {
        int n = scores.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));
        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = averageRank;
            }
            i = j + 1;
        }
        long positives = 0;
        double positiveRankSum = 0.0;
        for (int k = 0; k < n; k++) {
            if (positive[k]) {
                positives++;
                positiveRankSum += ranks[k];
            }
        }
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return 0.5;
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }
}

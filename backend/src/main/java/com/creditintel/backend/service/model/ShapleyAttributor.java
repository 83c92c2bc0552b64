package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ReferencePopulation;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Interventional Shapley values of the credit score against a reference population. Exact subset
 * enumeration for small schemas, seeded permutation sampling otherwise. In both cases the values sum
 * to {@code f(x) - baseline}.
 */
@Component
@RequiredArgsConstructor
public class ShapleyAttributor {

    /** Widest schema enumerated exactly, whatever the configuration says. */
    static final int EXACT_FEATURE_LIMIT = 20;

    private final ScoringProperties properties;

    public double[] attribute(LogisticParameters parameters, double[] x, ReferencePopulation background,
                              double baseline, long seed) {
        int n = x.length;
        if (n <= Math.min(properties.getExplanation().getMaxExactFeatures(), EXACT_FEATURE_LIMIT)) {
            return exact(parameters, x, background, baseline);
        }
        return sampled(parameters, x, background, seed, properties.getExplanation().getSamplePermutations());
    }

    double[] exact(LogisticParameters parameters, double[] x, ReferencePopulation background, double baseline) {
        int n = x.length;
        int full = (1 << n) - 1;
        double[] coalitionValue = new double[1 << n];
        for (int mask = 1; mask < full; mask++) {
            coalitionValue[mask] = coalitionValue(parameters, x, background, mask);
        }
        coalitionValue[0] = baseline;
        coalitionValue[full] = parameters.creditScore(x);

        double[] weights = coalitionWeights(n);
        double[] phi = new double[n];
        for (int i = 0; i < n; i++) {
            int bit = 1 << i;
            for (int mask = 0; mask <= full; mask++) {
                if ((mask & bit) != 0) {
                    continue;
                }
                phi[i] += weights[Integer.bitCount(mask)] * (coalitionValue[mask | bit] - coalitionValue[mask]);
            }
        }
        return phi;
    }

    double[] sampled(LogisticParameters parameters, double[] x, ReferencePopulation background, long seed,
                     int permutations) {
        int n = x.length;
        Random random = new Random(seed);
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        double[] phi = new double[n];
        for (int p = 0; p < permutations; p++) {
            Collections.shuffle(order, random);
            for (int r = 0; r < background.size(); r++) {
                double[] z = background.row(r);
                double previous = parameters.creditScore(z);
                for (int feature : order) {
                    z[feature] = x[feature];
                    double current = parameters.creditScore(z);
                    phi[feature] += current - previous;
                    previous = current;
                }
            }
        }
        double samples = (double) permutations * background.size();
        for (int i = 0; i < n; i++) {
            phi[i] /= samples;
        }
        return phi;
    }

    private double coalitionValue(LogisticParameters parameters, double[] x, ReferencePopulation background,
                                  int mask) {
        double sum = 0.0;
        double[] z = new double[x.length];
        for (int r = 0; r < background.size(); r++) {
            for (int j = 0; j < x.length; j++) {
                z[j] = (mask & (1 << j)) != 0 ? x[j] : background.value(r, j);
            }
            sum += parameters.creditScore(z);
        }
        return sum / background.size();
    }

    /**
     * {@code |S|! (n - |S| - 1)! / n!} indexed by coalition size.
     */
    private static double[] coalitionWeights(int n) {
        double[] factorial = new double[n + 1];
        factorial[0] = 1.0;
        for (int i = 1; i <= n; i++) {
            factorial[i] = factorial[i - 1] * i;
        }
        double[] weights = new double[n];
        for (int size = 0; size < n; size++) {
            weights[size] = factorial[size] * factorial[n - size - 1] / factorial[n];
        }
        return weights;
    }
}

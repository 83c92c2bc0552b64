package com.creditintel.backend.service.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClassificationMetricsTest {

    @Test
    void countsConfusionMatrixAtHalfThreshold() {
        double[] p = {0.9, 0.6, 0.4, 0.2, 0.7};
        boolean[] defaulted = {true, false, true, false, true};

        ClassificationMetrics metrics = ClassificationMetrics.evaluate(p, defaulted);

        assertThat(metrics.accuracy()).isCloseTo(0.6, within(1e-12));
        assertThat(metrics.precision()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(metrics.recall()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(metrics.f1Score()).isCloseTo(2.0 / 3.0, within(1e-12));
    }

    @Test
    void aucIsOneForPerfectRanking() {
        assertThat(ClassificationMetrics.auc(new double[]{0.1, 0.2, 0.8, 0.9},
                new boolean[]{false, false, true, true})).isEqualTo(1.0);
    }

    @Test
    void tiedScoresShareRanks() {
        assertThat(ClassificationMetrics.auc(new double[]{0.5, 0.5, 0.5, 0.5},
                new boolean[]{false, true, false, true})).isEqualTo(0.5);
    }

    @Test
    void singleClassHasNoInformativeAuc() {
        assertThat(ClassificationMetrics.auc(new double[]{0.1, 0.9}, new boolean[]{true, true})).isEqualTo(0.5);
    }

    @Test
    void noPositivePredictionsGiveZeroPrecision() {
        ClassificationMetrics metrics = ClassificationMetrics.evaluate(new double[]{0.1, 0.2},
                new boolean[]{true, false});

        assertThat(metrics.precision()).isZero();
        assertThat(metrics.f1Score()).isZero();
    }
}

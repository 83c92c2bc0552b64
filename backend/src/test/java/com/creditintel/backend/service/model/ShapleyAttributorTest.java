package com.creditintel.backend.service.model;

import com.creditintel.backend.TestModels;
import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.pipeline.LogisticParameters;
import com.creditintel.backend.pipeline.ReferencePopulation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ShapleyAttributorTest {

    private final ScoringProperties properties = new ScoringProperties();
    private final ShapleyAttributor attributor = new ShapleyAttributor(properties);

    @Test
    void exactValuesSumToScoreMinusBaseline() {
        LogisticParameters parameters = TestModels.aaplParameters();
        ReferencePopulation reference = TestModels.aaplReference();
        double baseline = reference.meanScore(parameters);
        double[] x = {150.0, -0.6};

        double[] phi = attributor.attribute(parameters, x, reference, baseline, 7L);

        assertThat(phi[0] + phi[1]).isCloseTo(parameters.creditScore(x) - baseline, within(1e-9));
        assertThat(phi[1]).isNegative();
        assertThat(Math.abs(phi[1])).isGreaterThan(Math.abs(phi[0]));
    }

    @Test
    void featureAtReferenceValueGetsNothingInALinearSlice() {
        LogisticParameters parameters = new LogisticParameters(new double[]{0.0}, new double[]{1.0},
                new double[]{2.0}, 0.0);
        ReferencePopulation reference = new ReferencePopulation(List.of(new double[]{1.0}));

        double[] phi = attributor.attribute(parameters, new double[]{1.0}, reference,
                reference.meanScore(parameters), 1L);

        assertThat(phi[0]).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void sampledValuesSumToScoreMinusBaselineAndRepeatForTheSameSeed() {
        int d = 12;
        LogisticParameters parameters = wideModel(d);
        ReferencePopulation reference = randomRows(d, 20, 3L);
        double baseline = reference.meanScore(parameters);
        double[] x = randomRows(d, 1, 9L).row(0);

        double[] first = attributor.attribute(parameters, x, reference, baseline, 42L);
        double[] second = attributor.attribute(parameters, x, reference, baseline, 42L);

        double sum = 0.0;
        for (double value : first) {
            sum += value;
        }
        assertThat(sum).isCloseTo(parameters.creditScore(x) - baseline, within(1e-9));
        assertThat(first).containsExactly(second);
    }

    @Test
    void sampledEstimateTracksExactValues() {
        int d = 4;
        LogisticParameters parameters = wideModel(d);
        ReferencePopulation reference = randomRows(d, 10, 5L);
        double baseline = reference.meanScore(parameters);
        double[] x = {1.5, -1.0, 0.5, 2.0};

        double[] exact = attributor.exact(parameters, x, reference, baseline);
        double[] sampled = attributor.sampled(parameters, x, reference, 11L, 2000);

        for (int i = 0; i < d; i++) {
            assertThat(sampled[i]).isCloseTo(exact[i], within(0.5));
        }
    }

    @Test
    void wideSchemaIsSampledWhateverTheConfiguredExactLimit() {
        properties.getExplanation().setMaxExactFeatures(64);
        int d = 40;
        LogisticParameters parameters = wideModel(d);
        ReferencePopulation reference = randomRows(d, 5, 3L);
        double baseline = reference.meanScore(parameters);
        double[] x = randomRows(d, 1, 9L).row(0);

        double[] phi = attributor.attribute(parameters, x, reference, baseline, 42L);

        assertThat(phi).hasSize(d);
        assertThat(phi).containsExactly(attributor.sampled(parameters, x, reference, 42L,
                properties.getExplanation().getSamplePermutations()));
    }

    private static LogisticParameters wideModel(int d) {
        double[] means = new double[d];
        double[] scales = new double[d];
        double[] coefficients = new double[d];
        for (int i = 0; i < d; i++) {
            scales[i] = 1.0;
            coefficients[i] = (i % 2 == 0 ? 0.4 : -0.3) * (1.0 + i / 10.0);
        }
        return new LogisticParameters(means, scales, coefficients, -1.0);
    }

    private static ReferencePopulation randomRows(int d, int rows, long seed) {
        Random random = new Random(seed);
        List<double[]> data = new ArrayList<>();
        for (int r = 0; r < rows; r++) {
            double[] row = new double[d];
            for (int j = 0; j < d; j++) {
                row[j] = random.nextGaussian();
            }
            data.add(row);
        }
        return new ReferencePopulation(data);
    }
}

package com.creditintel.backend.service.model;

import com.creditintel.backend.TestModels;
import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.exception.TrainingException;
import com.creditintel.backend.pipeline.FeatureCatalog;
import com.creditintel.backend.pipeline.LabeledExample;
import com.creditintel.backend.pipeline.TrainingData;
import com.creditintel.backend.util.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LogisticTrainerTest {

    private final ScoringProperties properties = new ScoringProperties();
    private final LogisticTrainer trainer = new LogisticTrainer(properties);
    private final FeatureCatalog catalog = TestModels.catalog();
    private final SyntheticTrainingDataGenerator generator = new SyntheticTrainingDataGenerator();

    @Test
    void learnsTheDocumentedRiskDirections() {
        LogisticTrainer.TrainedModel model = trainer.train(syntheticData(1000), CancellationToken.none());

        List<String> schema = catalog.names();
        assertThat(model.metrics().aucRoc()).isGreaterThan(0.65);
        assertThat(model.metrics().trainingSamples()).isEqualTo(800);
        assertThat(model.metrics().holdoutSamples()).isEqualTo(200);
        assertThat(model.parameters().coefficient(schema.indexOf("price"))).isNegative();
        assertThat(model.parameters().coefficient(schema.indexOf("debt_to_equity"))).isPositive();
        assertThat(model.referencePopulation().size()).isEqualTo(properties.getRetraining().getReferenceSize());
        assertThat(model.evaluationSet().size()).isEqualTo(properties.getRetraining().getEvaluationSize());
        assertThat(model.baselineScore())
                .isCloseTo(model.referencePopulation().meanScore(model.parameters()), within(1e-12));
    }

    @Test
    void trainingIsDeterministic() {
        LogisticTrainer.TrainedModel first = trainer.train(syntheticData(500), CancellationToken.none());
        LogisticTrainer.TrainedModel second = trainer.train(syntheticData(500), CancellationToken.none());

        assertThat(first.parameters()).isEqualTo(second.parameters());
        assertThat(first.metrics()).isEqualTo(second.metrics());
    }

    @Test
    void missingFeatureFailsTraining() {
        List<LabeledExample> examples = new ArrayList<>(syntheticData(200).examples());
        examples.set(3, new LabeledExample("BROKEN", Map.of("price", 10.0), true));

        assertThatThrownBy(() -> trainer.train(new TrainingData(catalog.names(), TestModels.THRESHOLDS, examples,
                "broken"), CancellationToken.none()))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("BROKEN");
    }

    @Test
    void tooSmallHoldoutFailsTraining() {
        assertThatThrownBy(() -> trainer.train(syntheticData(20), CancellationToken.none()))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("Holdout");
    }

    @Test
    void singleOutcomeClassFailsTraining() {
        List<LabeledExample> examples = syntheticData(200).examples().stream()
                .map(example -> new LabeledExample(example.issuerId(), example.features(), false))
                .toList();

        assertThatThrownBy(() -> trainer.train(new TrainingData(catalog.names(), TestModels.THRESHOLDS, examples,
                "no defaults"), CancellationToken.none()))
                .isInstanceOf(TrainingException.class);
    }

    @Test
    void cancelledTrainingStops() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> trainer.train(syntheticData(200), token)).isInstanceOf(CancellationException.class);
    }

    @Test
    void stridedSampleSpansTheRows() {
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            rows.add(new double[]{i});
        }

        assertThat(LogisticTrainer.strided(rows, 5)).extracting(row -> row[0])
                .containsExactly(0.0, 2.0, 4.0, 6.0, 8.0);
    }

    private TrainingData syntheticData(int samples) {
        return new TrainingData(catalog.names(), TestModels.THRESHOLDS,
                generator.generate(catalog.definitions(), samples, 42L, 0.3), "synthetic");
    }
}

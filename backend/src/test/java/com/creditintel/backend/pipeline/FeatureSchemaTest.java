package com.creditintel.backend.pipeline;

import com.creditintel.backend.TestModels;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureSchemaTest {

    @Test
    void modelVersionRejectsRepeatedFeatures() {
        assertThatThrownBy(() -> TestModels.model(1L, ModelStatus.CANDIDATE, List.of("price", "price"),
                TestModels.aaplParameters(), TestModels.aaplReference()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate feature in schema: price");
    }

    @Test
    void trainingDataRejectsRepeatedFeatures() {
        assertThatThrownBy(() -> new TrainingData(List.of("price", "sentiment_30d", "price"), TestModels.THRESHOLDS,
                List.of(), "repeated"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("price");
    }

    @Test
    void distinctSchemaIsAccepted() {
        TrainingData data = new TrainingData(TestModels.AAPL_SCHEMA, TestModels.THRESHOLDS, null, "ok");

        assertThat(data.featureSchema()).containsExactly("price", "sentiment_30d");
        assertThat(data.examples()).isEmpty();
    }
}

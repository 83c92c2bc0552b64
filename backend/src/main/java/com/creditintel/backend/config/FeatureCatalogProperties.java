package com.creditintel.backend.config;

import com.creditintel.backend.pipeline.Aggregation;
import com.creditintel.backend.pipeline.FeatureDefinition;
import com.creditintel.backend.pipeline.ImputationPolicy;
import com.creditintel.backend.pipeline.SourceKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Feature catalog. Each entry documents how one feature is aggregated from observations.
 */
@Configuration
@ConfigurationProperties(prefix = "credit.features")
@Data
@Validated
public class FeatureCatalogProperties {

    @Valid
    @NotEmpty
    private List<Definition> definitions = defaults();

    public List<FeatureDefinition> toDefinitions() {
        return definitions.stream().map(Definition::toFeatureDefinition).toList();
    }

    @Data
    @NoArgsConstructor
    public static class Definition {
        @NotBlank
        private String name;
        @NotNull
        private SourceKind sourceKind;
        @NotBlank
        private String metric;
        @NotNull
        private Aggregation aggregation;
        @NotNull
        private Duration lookback;
        @NotNull
        private ImputationPolicy imputation = ImputationPolicy.NEUTRAL;
        private double neutralValue;
        private String label;
        private double referenceMean;
        private double referenceStd = 1.0;
        private int riskDirection = 1;

        Definition(String name, SourceKind sourceKind, String metric, Aggregation aggregation, Duration lookback,
                   ImputationPolicy imputation, double neutralValue, String label,
                   double referenceMean, double referenceStd, int riskDirection) {
            this.name = name;
            this.sourceKind = sourceKind;
            this.metric = metric;
            this.aggregation = aggregation;
            this.lookback = lookback;
            this.imputation = imputation;
            this.neutralValue = neutralValue;
            this.label = label;
            this.referenceMean = referenceMean;
            this.referenceStd = referenceStd;
            this.riskDirection = riskDirection;
        }

        FeatureDefinition toFeatureDefinition() {
            return new FeatureDefinition(name, sourceKind, metric, aggregation, lookback, imputation, neutralValue,
                    label, referenceMean, referenceStd, riskDirection);
        }
    }

    private static List<Definition> defaults() {
        List<Definition> defaults = new ArrayList<>();
        defaults.add(new Definition("price", SourceKind.MARKET, "price", Aggregation.LAST_VALUE,
                Duration.ofDays(7), ImputationPolicy.CARRY_FORWARD, 100.0, "Latest share price", 100.0, 40.0, -1));
        defaults.add(new Definition("price_change_30d", SourceKind.MARKET, "price", Aggregation.RATE_OF_CHANGE,
                Duration.ofDays(30), ImputationPolicy.NEUTRAL, 0.0, "30-day price change", 0.0, 0.1, -1));
        defaults.add(new Definition("volatility_30d", SourceKind.MARKET, "price", Aggregation.VOLATILITY,
                Duration.ofDays(30), ImputationPolicy.NEUTRAL, 0.02, "30-day price volatility", 0.02, 0.01, 1));
        defaults.add(new Definition("sentiment_30d", SourceKind.NEWS_SENTIMENT, "headline_sentiment",
                Aggregation.WEIGHTED_MEAN, Duration.ofDays(30), ImputationPolicy.NEUTRAL, 0.0,
                "30-day news sentiment", 0.0, 0.4, -1));
        defaults.add(new Definition("debt_to_equity", SourceKind.MARKET, "debt_to_equity", Aggregation.LAST_VALUE,
                Duration.ofDays(400), ImputationPolicy.CARRY_FORWARD, 0.5, "Debt-to-equity ratio", 0.5, 0.3, 1));
        defaults.add(new Definition("current_ratio", SourceKind.MARKET, "current_ratio", Aggregation.LAST_VALUE,
                Duration.ofDays(400), ImputationPolicy.CARRY_FORWARD, 1.5, "Current ratio", 1.5, 0.5, -1));
        defaults.add(new Definition("gdp_growth", SourceKind.MACRO, "gdp_growth", Aggregation.LAST_VALUE,
                Duration.ofDays(400), ImputationPolicy.CARRY_FORWARD, 2.0, "GDP growth", 2.0, 1.5, -1));
        return defaults;
    }
}

package com.creditintel.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "credit")
@Data
@Validated
public class ScoringProperties {

    @Valid
    private Normalizer normalizer = new Normalizer();
    @Valid
    private Snapshot snapshot = new Snapshot();
    @Valid
    private Explanation explanation = new Explanation();
    @Valid
    private Retraining retraining = new Retraining();
    @Valid
    private Ingestion ingestion = new Ingestion();
    @Valid
    private Bootstrap bootstrap = new Bootstrap();
    @Valid
    private Storage storage = new Storage();
    @Valid
    private Scheduler scheduler = new Scheduler();

    /** Asset class name to member issuers, used for roll-up scores. */
    private Map<String, List<String>> assetClasses = new LinkedHashMap<>();

    @Data
    public static class Normalizer {
        @NotNull
        private Duration clockSkewTolerance = Duration.ofMinutes(5);
    }

    @Data
    public static class Snapshot {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double lowCoverageThreshold = 0.5;
    }

    @Data
    public static class Explanation {
        @Min(1)
        private int topK = 5;

        /** Exact Shapley enumerates 2^n coalitions; wider models fall back to sampling. */
        @Min(1)
        @Max(20)
        private int maxExactFeatures = 10;

        @Min(1)
        private int samplePermutations = 256;
    }

    @Data
    public static class Retraining {
        @Min(1)
        private int iterations = 500;

        @Positive
        private double learningRate = 0.1;

        @DecimalMin("0.0")
        private double l2 = 0.001;

        @Min(2)
        private int holdoutStride = 5;

        @Min(1)
        private int minHoldoutRows = 10;

        @Min(1)
        @Max(2000)
        private int referenceSize = 100;

        @Min(1)
        @Max(2000)
        private int evaluationSize = 50;

        @DecimalMin("0.0")
        private double metricTolerance = 0.02;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minimumAuc = 0.55;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minShapConsistency = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minFeatureImportanceStability = 0.6;

        @Min(1)
        private int stabilityTopK = 3;
    }

    @Data
    public static class Ingestion {
        private boolean storeRawDocuments = true;
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = true;

        @Min(50)
        private int samples = 1000;

        private long seed = 42L;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double lowMin = 70.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double mediumMin = 40.0;

        @DecimalMin("0.01")
        @DecimalMax("0.99")
        private double defaultRate = 0.3;
    }

    @Data
    public static class Storage {
        @NotBlank
        private String mode = "jpa";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;

        private List<String> issuers = new ArrayList<>();

        @Positive
        private long refreshIntervalMs = 300_000L;
    }
}

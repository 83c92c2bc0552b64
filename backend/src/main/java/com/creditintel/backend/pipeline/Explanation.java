package com.creditintel.backend.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Attribution of one score relative to the model baseline. {@code attributions} covers every schema
 * feature in schema order; {@code keyFactors} is the ranked top-K subset.
 */
public record Explanation(
        ScoreKey scoreKey,
        double baselineScore,
        List<FeatureAttribution> attributions,
        List<FeatureAttribution> keyFactors,
        String narrative
) {

    public Explanation {
        Objects.requireNonNull(scoreKey, "scoreKey");
        Objects.requireNonNull(narrative, "narrative");
        attributions = List.copyOf(attributions);
        keyFactors = List.copyOf(keyFactors);
    }

    public double contributionSum() {
        double sum = 0.0;
        for (FeatureAttribution attribution : attributions) {
            sum += attribution.contribution();
        }
        return sum;
    }
}

package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.exception.ExplanationMismatchException;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.FeatureAttribution;
import com.creditintel.backend.pipeline.FeatureCatalog;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.ScoreRecord;
import com.creditintel.backend.util.HashUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class ExplanationGenerator {

    static final double SCORE_TOLERANCE = 1e-9;

    private static final Comparator<FeatureAttribution> RANKING = Comparator
            .comparingDouble((FeatureAttribution attribution) -> Math.abs(attribution.contribution()))
            .reversed()
            .thenComparing(FeatureAttribution::feature);

    private final ShapleyAttributor attributor;
    private final FeatureCatalog catalog;
    private final ScoringProperties properties;

    public Explanation explain(FeatureSnapshot snapshot, ModelVersion modelVersion, ScoreRecord scoreRecord) {
        checkCoherence(snapshot, modelVersion, scoreRecord);
        List<String> schema = modelVersion.featureSchema();
        double[] x = SchemaGuard.vector(snapshot, schema);
        double recomputed = modelVersion.scoreVector(x);
        if (Math.abs(recomputed - scoreRecord.score()) > SCORE_TOLERANCE) {
            throw new ExplanationMismatchException(snapshot.issuerId(),
                    "Score " + scoreRecord.score() + " was not produced by this snapshot and model",
                    List.of("recomputed:" + recomputed));
        }

        double[] contributions = attributor.attribute(modelVersion.parameters(), x,
                modelVersion.referencePopulation(), modelVersion.baselineScore(), seedFor(snapshot));

        List<FeatureAttribution> attributions = new ArrayList<>(schema.size());
        for (int i = 0; i < schema.size(); i++) {
            String feature = schema.get(i);
            attributions.add(new FeatureAttribution(feature, catalog.label(feature), x[i], contributions[i]));
        }
        List<FeatureAttribution> keyFactors = rank(attributions, properties.getExplanation().getTopK());
        String narrative = narrate(snapshot, scoreRecord, keyFactors);
        return new Explanation(scoreRecord.key(), modelVersion.baselineScore(), attributions, keyFactors, narrative);
    }

    public static List<FeatureAttribution> rank(List<FeatureAttribution> attributions, int topK) {
        return attributions.stream().sorted(RANKING).limit(topK).toList();
    }

    static long seedFor(FeatureSnapshot snapshot) {
        return HashUtils.seedOf(snapshot.issuerId() + "|" + snapshot.snapshotVersion() + "|" + snapshot.contentHash());
    }

    private void checkCoherence(FeatureSnapshot snapshot, ModelVersion modelVersion, ScoreRecord scoreRecord) {
        List<String> problems = new ArrayList<>();
        if (!scoreRecord.issuerId().equals(snapshot.issuerId())) {
            problems.add("issuer:" + scoreRecord.issuerId() + "!=" + snapshot.issuerId());
        }
        if (scoreRecord.snapshotVersion() != snapshot.snapshotVersion()) {
            problems.add("snapshot_version:" + scoreRecord.snapshotVersion() + "!=" + snapshot.snapshotVersion());
        }
        if (scoreRecord.modelVersionId() != modelVersion.versionId()) {
            problems.add("model_version:" + scoreRecord.modelVersionId() + "!=" + modelVersion.versionId());
        }
        if (!problems.isEmpty()) {
            throw new ExplanationMismatchException(scoreRecord.issuerId(),
                    "Score record does not belong to the given snapshot and model", problems);
        }
    }

    private String narrate(FeatureSnapshot snapshot, ScoreRecord scoreRecord, List<FeatureAttribution> keyFactors) {
        StringBuilder text = new StringBuilder(String.format(Locale.ROOT, "%s scores %.1f (%s risk).",
                scoreRecord.issuerId(), scoreRecord.score(), scoreRecord.riskLevel().wireName()));
        if (!keyFactors.isEmpty()) {
            FeatureAttribution primary = keyFactors.get(0);
            boolean primaryLifts = primary.contribution() >= 0.0;
            text.append(" The score is driven primarily by ").append(describe(primary));
            keyFactors.stream().skip(1)
                    .filter(factor -> (factor.contribution() >= 0.0) == primaryLifts)
                    .findFirst()
                    .ifPresent(factor -> text.append(primaryLifts ? ", also lifted by " : ", also weighed down by ")
                            .append(describe(factor)));
            keyFactors.stream().skip(1)
                    .filter(factor -> (factor.contribution() >= 0.0) != primaryLifts)
                    .findFirst()
                    .ifPresent(factor -> text.append(", offset by ").append(describe(factor)));
            text.append('.');
        }
        if (snapshot.lowCoverage()) {
            text.append(String.format(Locale.ROOT, " Low data coverage: %d of %d features imputed.",
                    snapshot.imputedFeatures().size(), snapshot.features().size()));
        }
        return text.toString();
    }

    private static String describe(FeatureAttribution factor) {
        return String.format(Locale.ROOT, "%s (%+.2f)", factor.label(), factor.contribution());
    }
}

package com.creditintel.backend.service.model;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.ReferencePopulation;
import com.creditintel.backend.util.CancellationToken;
import com.creditintel.backend.util.HashUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Compares how a candidate and the active model explain the candidate's evaluation rows.
 * Only features present in both schemas are compared. Active-model features the candidate does not
 * know are filled with the active model's training mean.
 */
@Component
@RequiredArgsConstructor
public class ExplanationConsistency {

    private final ShapleyAttributor attributor;
    private final ScoringProperties properties;

    public record Report(double shapConsistency, double featureImportanceStability) {

        public static Report identical() {
            return new Report(1.0, 1.0);
        }
    }

    public Report compare(ModelVersion candidate, ModelVersion active, CancellationToken token) {
        List<String> common = candidate.featureSchema().stream()
                .filter(active.featureSchema()::contains)
                .toList();
        ReferencePopulation rows = candidate.evaluationSet();
        if (common.isEmpty()) {
            return new Report(0.0, 0.0);
        }
        if (rows.isEmpty()) {
            return Report.identical();
        }
        int[] candidateIndex = common.stream().mapToInt(candidate::featureIndex).toArray();
        int[] activeIndex = common.stream().mapToInt(active::featureIndex).toArray();

        double[] candidateImportance = new double[common.size()];
        double[] activeImportance = new double[common.size()];
        double cosineSum = 0.0;
        for (int r = 0; r < rows.size(); r++) {
            token.throwIfCancelled();
            double[] x = rows.row(r);
            long seed = HashUtils.seedOf("consistency|" + candidate.versionId() + "|" + r);
            double[] phiCandidate = attributor.attribute(candidate.parameters(), x, candidate.referencePopulation(),
                    candidate.baselineScore(), seed);
            double[] phiActive = attributor.attribute(active.parameters(), toActiveRow(x, candidate, active),
                    active.referencePopulation(), active.baselineScore(), seed);

            double[] a = new double[common.size()];
            double[] b = new double[common.size()];
            for (int k = 0; k < common.size(); k++) {
                a[k] = phiCandidate[candidateIndex[k]];
                b[k] = phiActive[activeIndex[k]];
                candidateImportance[k] += Math.abs(a[k]);
                activeImportance[k] += Math.abs(b[k]);
            }
            cosineSum += Math.max(0.0, cosine(a, b));
        }
        double consistency = cosineSum / rows.size();
        int topK = Math.min(properties.getRetraining().getStabilityTopK(), common.size());
        Set<String> candidateTop = new HashSet<>(top(common, candidateImportance, topK));
        List<String> activeTop = top(common, activeImportance, topK);
        long overlap = activeTop.stream().filter(candidateTop::contains).count();
        return new Report(consistency, (double) overlap / topK);
    }

    private static double[] toActiveRow(double[] candidateRow, ModelVersion candidate, ModelVersion active) {
        List<String> activeSchema = active.featureSchema();
        double[] row = new double[activeSchema.size()];
        for (int j = 0; j < activeSchema.size(); j++) {
            int index = candidate.featureIndex(activeSchema.get(j));
            row[j] = index >= 0 ? candidateRow[index] : active.parameters().mean(j);
        }
        return row;
    }

    static double cosine(double[] a, double[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 && normB == 0.0) {
            return 1.0;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static List<String> top(List<String> features, double[] importance, int k) {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < features.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> importance[i]).reversed()
                .thenComparing(features::get));
        return order.stream().limit(k).map(features::get).toList();
    }
}

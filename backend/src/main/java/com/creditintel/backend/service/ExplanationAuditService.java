package com.creditintel.backend.service;

import com.creditintel.backend.exception.CreditIntelligenceException;
import com.creditintel.backend.pipeline.Explanation;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.ScoredResult;
import com.creditintel.backend.service.model.ExplanationGenerator;
import com.creditintel.backend.service.model.ModelRegistry;
import com.creditintel.backend.service.store.FeatureSnapshotStore;
import com.creditintel.backend.service.store.ScoreStore;
import com.creditintel.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Regenerates stored explanations from their snapshot and retained model version and checks they
 * come out identical. Model retraining must never change a historical explanation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExplanationAuditService {

    private final ScoreStore scoreStore;
    private final FeatureSnapshotStore snapshotStore;
    private final ModelRegistry modelRegistry;
    private final ExplanationGenerator explanationGenerator;

    public record AuditReport(int checked, int reproduced, List<String> mismatches, boolean cancelled) {

        public boolean clean() {
            return mismatches.isEmpty() && !cancelled;
        }
    }

    public Explanation regenerate(ScoredResult stored) {
        FeatureSnapshot snapshot = snapshotStore.find(stored.key().issuerId(), stored.key().snapshotVersion())
                .orElseThrow(() -> new IllegalStateException("Snapshot for " + stored.key() + " is missing"));
        ModelVersion model = modelRegistry.require(stored.key().modelVersionId());
        return explanationGenerator.explain(snapshot, model, stored.scoreRecord());
    }

    public AuditReport audit(List<String> issuers, Instant from, Instant to, CancellationToken token) {
        int checked = 0;
        int reproduced = 0;
        List<String> mismatches = new ArrayList<>();
        for (String issuerId : issuers) {
            for (ScoredResult stored : scoreStore.findByIssuer(issuerId, from, to)) {
                if (token.isCancelled()) {
                    log.info("Explanation audit cancelled after {} checks", checked);
                    return new AuditReport(checked, reproduced, mismatches, true);
                }
                checked++;
                Optional<String> problem = verify(stored);
                if (problem.isEmpty()) {
                    reproduced++;
                } else {
                    mismatches.add(stored.key() + ": " + problem.get());
                }
            }
        }
        if (!mismatches.isEmpty()) {
            log.warn("Explanation audit found {} mismatches out of {}", mismatches.size(), checked);
        }
        return new AuditReport(checked, reproduced, mismatches, false);
    }

    private Optional<String> verify(ScoredResult stored) {
        Explanation regenerated;
        try {
            regenerated = regenerate(stored);
        } catch (CreditIntelligenceException | IllegalStateException ex) {
            return Optional.of(ex.getMessage());
        }
        if (!regenerated.equals(stored.explanation())) {
            return Optional.of("regenerated explanation differs");
        }
        return Optional.empty();
    }
}

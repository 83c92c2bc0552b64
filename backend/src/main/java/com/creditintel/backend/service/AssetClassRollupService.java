package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.dto.CreditScoreResponse;
import com.creditintel.backend.dto.ScoringResult;
import com.creditintel.backend.pipeline.AssetClassScore;
import com.creditintel.backend.pipeline.RiskLevel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Asset-class granularity: scores every member issuer at the same instant and aggregates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetClassRollupService {

    private final CreditScoringService scoringService;
    private final ScoringProperties properties;

    public Set<String> assetClasses() {
        return properties.getAssetClasses().keySet();
    }

    public AssetClassScore score(String assetClass, Instant asOf) {
        List<String> members = properties.getAssetClasses().get(assetClass);
        if (members == null) {
            throw new IllegalArgumentException("Unknown asset class " + assetClass);
        }
        Map<String, ScoringResult> results = scoringService.evaluateAll(members, asOf);

        Map<RiskLevel, Integer> distribution = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            distribution.put(level, 0);
        }
        List<String> failed = new ArrayList<>();
        int scored = 0;
        int lowCoverage = 0;
        double sum = 0.0;
        double min = Double.NaN;
        double max = Double.NaN;
        for (Map.Entry<String, ScoringResult> entry : results.entrySet()) {
            if (!entry.getValue().isSuccess()) {
                failed.add(entry.getKey());
                continue;
            }
            CreditScoreResponse score = entry.getValue().getScore();
            scored++;
            sum += score.getScore();
            min = Double.isNaN(min) ? score.getScore() : Math.min(min, score.getScore());
            max = Double.isNaN(max) ? score.getScore() : Math.max(max, score.getScore());
            distribution.merge(score.getRiskLevel(), 1, Integer::sum);
            if (score.isLowCoverage()) {
                lowCoverage++;
            }
        }
        if (!failed.isEmpty()) {
            log.warn("Asset class {}: {} of {} issuers failed to score: {}", assetClass, failed.size(),
                    members.size(), failed);
        }
        return new AssetClassScore(assetClass, List.copyOf(members), scored, scored == 0 ? 0.0 : sum / scored,
                scored == 0 ? 0.0 : min, scored == 0 ? 0.0 : max, distribution, lowCoverage, failed, asOf);
    }
}

package com.creditintel.backend.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AssetClassScore(
        String assetClass,
        List<String> issuers,
        int scoredIssuers,
        double averageScore,
        double minScore,
        double maxScore,
        Map<RiskLevel, Integer> riskDistribution,
        int lowCoverageCount,
        List<String> failedIssuers,
        Instant asOf
) {}

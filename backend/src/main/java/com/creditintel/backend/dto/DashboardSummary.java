package com.creditintel.backend.dto;

import com.creditintel.backend.pipeline.RiskLevel;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DashboardSummary {

    private int totalIssuers;
    private double averageScore;
    private Map<RiskLevel, Integer> riskDistribution;
    private int lowCoverageIssuers;
    private Long activeModelVersion;
    private Instant generatedAt;
}

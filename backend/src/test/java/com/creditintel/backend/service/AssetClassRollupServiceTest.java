package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.dto.ApiError;
import com.creditintel.backend.dto.CreditScoreResponse;
import com.creditintel.backend.dto.ScoringResult;
import com.creditintel.backend.exception.ErrorKind;
import com.creditintel.backend.pipeline.AssetClassScore;
import com.creditintel.backend.pipeline.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssetClassRollupServiceTest {

    private static final Instant AS_OF = Instant.parse("2024-06-03T12:00:00Z");
    private static final List<String> TECHNOLOGY = List.of("AAPL", "MSFT", "GOOGL");

    @Mock
    private CreditScoringService scoringService;

    private AssetClassRollupService rollupService;

    @BeforeEach
    void setUp() {
        ScoringProperties properties = new ScoringProperties();
        properties.getAssetClasses().put("technology", TECHNOLOGY);
        rollupService = new AssetClassRollupService(scoringService, properties);
    }

    @Test
    void aggregatesMemberScoresAndReportsFailures() {
        Map<String, ScoringResult> results = new LinkedHashMap<>();
        results.put("AAPL", ScoringResult.success(score("AAPL", 55.0, RiskLevel.MEDIUM, false)));
        results.put("MSFT", ScoringResult.success(score("MSFT", 85.0, RiskLevel.LOW, true)));
        results.put("GOOGL", ScoringResult.failure(ApiError.builder()
                .kind(ErrorKind.SCHEMA_MISMATCH)
                .issuerId("GOOGL")
                .message("missing features")
                .timestamp(AS_OF)
                .build()));
        when(scoringService.evaluateAll(TECHNOLOGY, AS_OF)).thenReturn(results);

        AssetClassScore rollup = rollupService.score("technology", AS_OF);

        assertThat(rollup.issuers()).containsExactlyElementsOf(TECHNOLOGY);
        assertThat(rollup.scoredIssuers()).isEqualTo(2);
        assertThat(rollup.averageScore()).isCloseTo(70.0, within(1e-9));
        assertThat(rollup.minScore()).isEqualTo(55.0);
        assertThat(rollup.maxScore()).isEqualTo(85.0);
        assertThat(rollup.riskDistribution())
                .containsEntry(RiskLevel.LOW, 1)
                .containsEntry(RiskLevel.MEDIUM, 1)
                .containsEntry(RiskLevel.HIGH, 0);
        assertThat(rollup.lowCoverageCount()).isEqualTo(1);
        assertThat(rollup.failedIssuers()).containsExactly("GOOGL");
        assertThat(rollup.asOf()).isEqualTo(AS_OF);
    }

    @Test
    void allFailuresYieldAnEmptyAggregate() {
        Map<String, ScoringResult> results = new LinkedHashMap<>();
        TECHNOLOGY.forEach(issuer -> results.put(issuer, ScoringResult.failure(ApiError.builder()
                .kind(ErrorKind.NO_ACTIVE_MODEL)
                .issuerId(issuer)
                .timestamp(AS_OF)
                .build())));
        when(scoringService.evaluateAll(TECHNOLOGY, AS_OF)).thenReturn(results);

        AssetClassScore rollup = rollupService.score("technology", AS_OF);

        assertThat(rollup.scoredIssuers()).isZero();
        assertThat(rollup.averageScore()).isZero();
        assertThat(rollup.failedIssuers()).containsExactlyElementsOf(TECHNOLOGY);
    }

    @Test
    void unknownAssetClassIsRejected() {
        assertThatThrownBy(() -> rollupService.score("energy", AS_OF))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("energy");
        verifyNoInteractions(scoringService);
    }

    @Test
    void listsConfiguredAssetClasses() {
        assertThat(rollupService.assetClasses()).containsExactly("technology");
    }

    private static CreditScoreResponse score(String issuerId, double score, RiskLevel riskLevel, boolean lowCoverage) {
        return CreditScoreResponse.builder()
                .issuerId(issuerId)
                .score(score)
                .riskLevel(riskLevel)
                .confidence(score / 100.0)
                .explanation(issuerId + " scores " + score)
                .keyFactors(List.of())
                .lowCoverage(lowCoverage)
                .imputedFeatures(List.of())
                .computedAt(AS_OF)
                .build();
    }
}

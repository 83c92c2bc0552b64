package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.dto.ScoringResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Periodic ingest-then-score cycle over the configured issuers. Disabled unless
 * {@code credit.scheduler.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "credit.scheduler", name = "enabled", havingValue = "true")
public class ScoringRefreshScheduler {

    private final ObservationIngestionService ingestionService;
    private final CreditScoringService scoringService;
    private final ScoringProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${credit.scheduler.refresh-interval-ms:300000}",
            initialDelayString = "${credit.scheduler.refresh-interval-ms:300000}")
    public void refresh() {
        List<String> issuers = properties.getScheduler().getIssuers();
        if (issuers.isEmpty()) {
            return;
        }
        for (String issuerId : issuers) {
            ingestionService.ingestFromAdapters(issuerId);
        }
        Instant asOf = clock.instant();
        Map<String, ScoringResult> results = scoringService.evaluateAll(issuers, asOf);
        long failures = results.values().stream().filter(result -> !result.isSuccess()).count();
        log.info("Refresh cycle scored {} issuers ({} failed)", results.size(), failures);
    }
}

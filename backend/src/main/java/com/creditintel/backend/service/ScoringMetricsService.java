package com.creditintel.backend.service;

import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.pipeline.RiskLevel;
import com.creditintel.backend.pipeline.SourceKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringMetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong activeModelVersion = new AtomicLong();
    private final AtomicLong scoresComputed = new AtomicLong();
    private final ConcurrentHashMap<String, AtomicLong> rejectsByReason = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        Gauge.builder("credit_active_model_version", activeModelVersion, AtomicLong::get).register(meterRegistry);
    }

    public void recordObservationAccepted(SourceKind sourceKind) {
        Counter.builder("credit_observations_accepted_total")
                .tag("source_kind", sourceKind.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordObservationDuplicate(SourceKind sourceKind) {
        Counter.builder("credit_observations_duplicate_total")
                .tag("source_kind", sourceKind.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordObservationRejected(String reason) {
        String tag = reason == null ? "unknown" : reason;
        rejectsByReason.computeIfAbsent(tag, key -> new AtomicLong()).incrementAndGet();
        Counter.builder("credit_observations_rejected_total")
                .tag("reason", tag)
                .register(meterRegistry)
                .increment();
    }

    public void recordAdapterFailure(SourceKind sourceKind) {
        Counter.builder("credit_adapter_failures_total")
                .tag("source_kind", sourceKind == null ? "unknown" : sourceKind.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordScore(RiskLevel riskLevel, boolean lowCoverage) {
        scoresComputed.incrementAndGet();
        Counter.builder("credit_scores_total")
                .tag("risk_level", riskLevel.wireName())
                .register(meterRegistry)
                .increment();
        if (lowCoverage) {
            Counter.builder("credit_scores_low_coverage_total").register(meterRegistry).increment();
        }
    }

    public void recordScoringFailure(String kind) {
        Counter.builder("credit_scoring_failures_total")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordPromotion(ModelVersion promoted) {
        activeModelVersion.set(promoted.versionId());
        Counter.builder("credit_model_promotions_total").register(meterRegistry).increment();
    }

    public long scoresComputed() {
        return scoresComputed.get();
    }

    public Map<String, Long> rejectCounts() {
        return rejectsByReason.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get()));
    }
}

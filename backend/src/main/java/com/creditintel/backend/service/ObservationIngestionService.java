package com.creditintel.backend.service;

import com.creditintel.backend.config.ScoringProperties;
import com.creditintel.backend.dto.IngestionReport;
import com.creditintel.backend.exception.ObservationValidationException;
import com.creditintel.backend.pipeline.HeadlineSentiment;
import com.creditintel.backend.pipeline.Observation;
import com.creditintel.backend.pipeline.ObservationAdapter;
import com.creditintel.backend.pipeline.RawDocument;
import com.creditintel.backend.pipeline.RawObservation;
import com.creditintel.backend.pipeline.SourceKind;
import com.creditintel.backend.service.store.AppendResult;
import com.creditintel.backend.service.store.ObservationStore;
import com.creditintel.backend.service.store.RawDocumentStore;
import com.creditintel.backend.util.IssuerLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Normalizes and stores adapter output. A bad observation is rejected on its own and never fails
 * the rest of its batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObservationIngestionService {

    static final String STORE_FAILURE = "STORE_FAILURE";

    private final ObservationNormalizer normalizer;
    private final ObservationStore observationStore;
    private final RawDocumentStore rawDocumentStore;
    private final NewsRiskTagger riskTagger;
    private final IssuerLocks issuerLocks;
    private final ScoringMetricsService metricsService;
    private final ScoringProperties properties;
    private final ObjectProvider<ObservationAdapter> adapters;

    public IngestionReport ingest(SourceKind sourceKind, List<? extends RawObservation> batch) {
        IngestionReport report = new IngestionReport(null);
        for (RawObservation raw : batch) {
            ingestOne(sourceKind, raw, report);
        }
        return report;
    }

    /**
     * Pulls from every registered adapter. An adapter that throws counts as having no data.
     */
    public IngestionReport ingestFromAdapters(String issuerId) {
        IngestionReport report = new IngestionReport(issuerId);
        adapters.orderedStream().forEach(adapter -> {
            List<RawObservation> fetched;
            try {
                fetched = adapter.fetch(issuerId);
            } catch (RuntimeException ex) {
                log.warn("Adapter {} failed for {}: {}", adapter.sourceKind(), issuerId, ex.getMessage());
                metricsService.recordAdapterFailure(adapter.sourceKind());
                report.setFailedAdapters(report.getFailedAdapters() + 1);
                return;
            }
            if (fetched != null) {
                report.merge(ingest(adapter.sourceKind(), fetched));
            }
        });
        log.info("Ingested for {}: accepted={} revised={} duplicates={} rejected={}", issuerId,
                report.getAccepted(), report.getRevised(), report.getDuplicates(), report.getRejected());
        return report;
    }

    private void ingestOne(SourceKind sourceKind, RawObservation raw, IngestionReport report) {
        Observation observation;
        try {
            observation = normalizer.normalize(raw, sourceKind);
        } catch (ObservationValidationException ex) {
            log.warn("Rejected {} observation for {}: {}", sourceKind, ex.getIssuerId(), ex.getMessage());
            report.recordRejection(ex.getReason().name());
            metricsService.recordObservationRejected(ex.getReason().name());
            return;
        }
        AppendResult result;
        try {
            result = issuerLocks.withLock(observation.issuerId(), () -> observationStore.append(observation));
        } catch (RuntimeException ex) {
            log.error("Failed to store observation {}", observation.key(), ex);
            report.recordRejection(STORE_FAILURE);
            metricsService.recordObservationRejected(STORE_FAILURE);
            return;
        }
        switch (result) {
            case APPENDED -> report.setAccepted(report.getAccepted() + 1);
            case REVISED -> report.setRevised(report.getRevised() + 1);
            case DUPLICATE -> report.setDuplicates(report.getDuplicates() + 1);
        }
        if (result == AppendResult.DUPLICATE) {
            metricsService.recordObservationDuplicate(sourceKind);
            return;
        }
        metricsService.recordObservationAccepted(sourceKind);
        if (raw instanceof HeadlineSentiment sentiment && properties.getIngestion().isStoreRawDocuments()) {
            if (rawDocumentStore.append(toDocument(sentiment, observation))) {
                report.setRawDocuments(report.getRawDocuments() + 1);
            }
        }
    }

    private RawDocument toDocument(HeadlineSentiment sentiment, Observation observation) {
        String text = sentiment.body() == null ? sentiment.headline() : sentiment.headline() + " " + sentiment.body();
        return new RawDocument(
                observation.attribute(Observation.ATTR_DOCUMENT_ID),
                observation.issuerId(),
                sentiment.headline(),
                sentiment.body(),
                observation.attribute(Observation.ATTR_SOURCE),
                sentiment.url(),
                sentiment.publishedAt().truncatedTo(ChronoUnit.MICROS),
                riskTagger.tag(text));
    }
}

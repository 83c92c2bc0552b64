package com.creditintel.backend.config;

import com.creditintel.backend.repository.CreditScoreRepository;
import com.creditintel.backend.repository.FeatureSnapshotEntryRepository;
import com.creditintel.backend.repository.ModelPerformanceRepository;
import com.creditintel.backend.repository.ModelVersionEntryRepository;
import com.creditintel.backend.repository.ObservationEntryRepository;
import com.creditintel.backend.service.store.FeatureSnapshotStore;
import com.creditintel.backend.service.store.InMemoryFeatureSnapshotStore;
import com.creditintel.backend.service.store.InMemoryModelPerformanceStore;
import com.creditintel.backend.service.store.InMemoryModelVersionStore;
import com.creditintel.backend.service.store.InMemoryObservationStore;
import com.creditintel.backend.service.store.InMemoryRawDocumentStore;
import com.creditintel.backend.service.store.InMemoryScoreStore;
import com.creditintel.backend.service.store.JpaFeatureSnapshotStore;
import com.creditintel.backend.service.store.JpaModelPerformanceStore;
import com.creditintel.backend.service.store.JpaModelVersionStore;
import com.creditintel.backend.service.store.JpaObservationStore;
import com.creditintel.backend.service.store.JpaScoreStore;
import com.creditintel.backend.service.store.ModelPerformanceStore;
import com.creditintel.backend.service.store.ModelVersionStore;
import com.creditintel.backend.service.store.ObservationStore;
import com.creditintel.backend.service.store.RawDocumentStore;
import com.creditintel.backend.service.store.ScoreStore;
import com.creditintel.backend.util.IssuerLocks;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Chooses the persistence adapters. {@code credit.storage.mode=jpa} (default) keeps structured data
 * in the relational store; {@code memory} keeps everything in process.
 */
@Configuration
public class StorageConfig {

    @Bean
    public IssuerLocks issuerLocks() {
        return new IssuerLocks();
    }

    @Bean
    public RawDocumentStore rawDocumentStore() {
        return new InMemoryRawDocumentStore();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "credit.storage", name = "mode", havingValue = "jpa", matchIfMissing = true)
    static class JpaStorage {

        @Bean
        public ObservationStore observationStore(ObservationEntryRepository repository) {
            return new JpaObservationStore(repository);
        }

        @Bean
        public FeatureSnapshotStore featureSnapshotStore(FeatureSnapshotEntryRepository repository, Clock clock) {
            return new JpaFeatureSnapshotStore(repository, clock);
        }

        @Bean
        public ScoreStore scoreStore(CreditScoreRepository repository) {
            return new JpaScoreStore(repository);
        }

        @Bean
        public ModelPerformanceStore modelPerformanceStore(ModelPerformanceRepository repository) {
            return new JpaModelPerformanceStore(repository);
        }

        @Bean
        public ModelVersionStore modelVersionStore(ModelVersionEntryRepository repository, Clock clock) {
            return new JpaModelVersionStore(repository, clock);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "credit.storage", name = "mode", havingValue = "memory")
    static class InMemoryStorage {

        @Bean
        public ObservationStore observationStore() {
            return new InMemoryObservationStore();
        }

        @Bean
        public FeatureSnapshotStore featureSnapshotStore() {
            return new InMemoryFeatureSnapshotStore();
        }

        @Bean
        public ScoreStore scoreStore() {
            return new InMemoryScoreStore();
        }

        @Bean
        public ModelPerformanceStore modelPerformanceStore() {
            return new InMemoryModelPerformanceStore();
        }

        @Bean
        public ModelVersionStore modelVersionStore() {
            return new InMemoryModelVersionStore();
        }
    }
}

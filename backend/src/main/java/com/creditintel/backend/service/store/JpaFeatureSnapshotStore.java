package com.creditintel.backend.service.store;

import com.creditintel.backend.model.FeatureSnapshotEntry;
import com.creditintel.backend.pipeline.FeatureSnapshot;
import com.creditintel.backend.repository.FeatureSnapshotEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RequiredArgsConstructor
public class JpaFeatureSnapshotStore implements FeatureSnapshotStore {

    private final FeatureSnapshotEntryRepository repository;
    private final Clock clock;
    private final JsonColumnMapper jsonColumnMapper = new JsonColumnMapper();

    @Override
    public void append(FeatureSnapshot snapshot) {
        if (snapshot.isDraft()) {
            throw new IllegalArgumentException("Draft snapshots cannot be stored");
        }
        FeatureSnapshotEntry entry = FeatureSnapshotEntry.builder()
                .issuerId(snapshot.issuerId())
                .snapshotVersion(snapshot.snapshotVersion())
                .asOf(snapshot.asOf())
                .featuresJson(jsonColumnMapper.writeFeatures(snapshot.features()))
                .provenanceJson(jsonColumnMapper.writeProvenance(snapshot.provenance()))
                .imputedFraction(snapshot.imputedFraction())
                .lowCoverage(snapshot.lowCoverage())
                .contentHash(snapshot.contentHash())
                .createdAt(clock.instant())
                .build();
        try {
            repository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException ex) {
            throw new IllegalStateException("Snapshot " + snapshot.issuerId() + "#" + snapshot.snapshotVersion()
                    + " already stored", ex);
        }
    }

    @Override
    public Optional<FeatureSnapshot> find(String issuerId, long snapshotVersion) {
        return repository.findByIssuerIdAndSnapshotVersion(issuerId, snapshotVersion).map(this::toSnapshot);
    }

    @Override
    public Optional<FeatureSnapshot> latest(String issuerId) {
        return repository.findFirstByIssuerIdOrderBySnapshotVersionDesc(issuerId).map(this::toSnapshot);
    }

    @Override
    public List<FeatureSnapshot> findByIssuer(String issuerId, Instant from, Instant to) {
        return repository.findByIssuerIdAndAsOfBetweenOrderBySnapshotVersionAsc(issuerId, from, to).stream()
                .map(this::toSnapshot)
                .toList();
    }

    private FeatureSnapshot toSnapshot(FeatureSnapshotEntry entry) {
        return new FeatureSnapshot(
                entry.getIssuerId(),
                entry.getSnapshotVersion(),
                entry.getAsOf(),
                jsonColumnMapper.readFeatures(entry.getFeaturesJson()),
                jsonColumnMapper.readProvenance(entry.getProvenanceJson()),
                entry.getImputedFraction(),
                entry.getLowCoverage(),
                entry.getContentHash());
    }
}

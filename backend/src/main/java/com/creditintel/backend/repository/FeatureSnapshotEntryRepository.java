package com.creditintel.backend.repository;

import com.creditintel.backend.model.FeatureSnapshotEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FeatureSnapshotEntryRepository extends JpaRepository<FeatureSnapshotEntry, Long> {

    Optional<FeatureSnapshotEntry> findByIssuerIdAndSnapshotVersion(String issuerId, Long snapshotVersion);

    Optional<FeatureSnapshotEntry> findFirstByIssuerIdOrderBySnapshotVersionDesc(String issuerId);

    List<FeatureSnapshotEntry> findByIssuerIdAndAsOfBetweenOrderBySnapshotVersionAsc(String issuerId, Instant from,
                                                                                     Instant to);
}

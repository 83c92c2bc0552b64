package com.creditintel.backend.repository;

import com.creditintel.backend.model.CreditScore;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CreditScoreRepository extends JpaRepository<CreditScore, Long> {

    Optional<CreditScore> findByIssuerIdAndSnapshotVersionAndModelVersion(String issuerId, Long snapshotVersion,
                                                                          Long modelVersion);

    List<CreditScore> findByIssuerIdAndComputedAtBetweenOrderByComputedAtAscSnapshotVersionAscModelVersionAsc(
            String issuerId, Instant from, Instant to);

    Optional<CreditScore> findFirstByIssuerIdOrderByComputedAtDescSnapshotVersionDescModelVersionDesc(
            String issuerId);

    @Query("select distinct c.issuerId from CreditScore c order by c.issuerId")
    List<String> findDistinctIssuerIds();
}

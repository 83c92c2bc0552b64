package com.creditintel.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "feature_snapshots", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"issuer_id", "snapshot_version"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureSnapshotEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "issuer_id", nullable = false, length = 64)
    private String issuerId;

    @Column(name = "snapshot_version", nullable = false)
    private Long snapshotVersion;

    @Column(name = "as_of", nullable = false)
    private Instant asOf;

    @Column(name = "features_json", nullable = false, length = 65535)
    private String featuresJson;

    @Column(name = "provenance_json", nullable = false, length = 65535)
    private String provenanceJson;

    @Column(name = "imputed_fraction", nullable = false)
    private Double imputedFraction;

    @Column(name = "low_coverage", nullable = false)
    private Boolean lowCoverage;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}

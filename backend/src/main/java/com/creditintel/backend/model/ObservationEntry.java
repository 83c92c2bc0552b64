package com.creditintel.backend.model;

import com.creditintel.backend.pipeline.SourceKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(name = "observations", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"issuer_id", "source_kind", "metric_name", "observed_at", "ingested_at"})
}, indexes = {
        @Index(name = "idx_observations_issuer_observed", columnList = "issuer_id, observed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObservationEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "issuer_id", nullable = false, length = 64)
    private String issuerId;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR)
    @Column(name = "source_kind", nullable = false, length = 32)
    private SourceKind sourceKind;

    @Column(name = "metric_name", nullable = false, length = 128)
    private String metricName;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(name = "metric_value", nullable = false)
    private Double metricValue;

    @Column(name = "attributes_json", length = 4000)
    private String attributesJson;

    @Column(name = "ingested_at", nullable = false)
    private Instant ingestedAt;
}

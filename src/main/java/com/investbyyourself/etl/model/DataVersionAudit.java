package com.investbyyourself.etl.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

/**
 * Row of the {@code data_versions} audit table. Every committed scope load on any
 * backend appends one row; rows are never updated.
 */
@Entity
@Table(name = "data_versions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataVersionAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "audit_id", updatable = false, nullable = false)
    private UUID auditId;

    @Column(name = "version_id", nullable = false, columnDefinition = "TEXT")
    private String versionId;

    @Column(name = "dataset", nullable = false)
    private String dataset;

    @Enumerated(EnumType.STRING)
    @Column(name = "backend", nullable = false)
    private BackendKind backend;

    @Column(name = "scope_key", nullable = false, columnDefinition = "TEXT")
    private String scopeKey;

    @Column(name = "record_count", nullable = false)
    private Integer recordCount;

    @Column(name = "source_tag")
    private String sourceTag;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, String> metadata;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public static DataVersionAudit of(DataVersion version) {
        return DataVersionAudit.builder()
                .versionId(version.versionId())
                .dataset(version.dataset())
                .backend(version.backend())
                .scopeKey(version.scopeKey())
                .recordCount(version.recordCount())
                .sourceTag(version.sourceTag())
                .metadata(version.metadata())
                .createdAt(version.createdAt().atOffset(ZoneOffset.UTC))
                .build();
    }

    public DataVersion toDataVersion() {
        return new DataVersion(versionId, dataset, scopeKey, backend, createdAt.toInstant(),
                recordCount, sourceTag, metadata);
    }
}

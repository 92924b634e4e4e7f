package com.batchbridge.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Opaque merchant configuration snapshot. Immutable: one row per
 * (merchant_id, captured_at), never updated.
 */
@Entity
@Table(name = "config_snapshots", uniqueConstraints = {
    @UniqueConstraint(name = "uq_config_snapshots_key", columnNames = {"merchant_id", "captured_at"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigSnapshotEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(name = "merchant_id", nullable = false, length = 64)
    private String merchantId;

    @Column(name = "captured_at", nullable = false)
    private Instant capturedAt;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false, length = 64)
    private String contentHash;

    @Column(nullable = false, length = 255)
    private String sourceFileReference;

    @Column(nullable = false)
    private Instant createdAt;
}

package com.batchbridge.infrastructure.persistence.entity;

import com.batchbridge.domain.model.PayloadType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A file picked up from the drop location, keyed by its content checksum.
 *
 * The unique constraint on checksum is the dedup authority: a second sighting
 * of the same bytes never creates a second row. Rows are never deleted; only
 * the status moves.
 *
 * publishedAt stays null until the ingest event has been acknowledged by the
 * broker. Until then the row is a pending publication, owned by whoever holds
 * the claim in publishClaimedUntil.
 */
@Entity
@Table(name = "raw_files", indexes = {
    @Index(name = "uq_raw_files_checksum", columnList = "checksum", unique = true),
    @Index(name = "idx_raw_files_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawFileEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, unique = true, length = 64)
    private String checksum;

    @Column(nullable = false, length = 255)
    private String storageKey;

    @Column(nullable = false, length = 512)
    private String sourceFilename;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PayloadType payloadType;

    @Column(nullable = false)
    private Long sizeBytes;

    @Column(nullable = false)
    private Instant receivedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RawFileStatus status;

    @Column
    private Instant statusUpdatedAt;

    @Column
    private Instant publishedAt;

    @Column(nullable = false)
    private Instant publishClaimedUntil;

    public enum RawFileStatus {
        RECEIVED,
        PROCESSED,
        FAILED
    }
}

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
 * One processing attempt of an ingest event.
 *
 * Audit trail, not a dedup key: redelivery of the same event creates a new row.
 */
@Entity
@Table(name = "ingest_jobs", indexes = {
    @Index(name = "idx_ingest_jobs_file_reference", columnList = "fileReference"),
    @Index(name = "idx_ingest_jobs_outcome_started", columnList = "outcome,startedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, length = 255)
    private String fileReference;

    @Column(length = 64)
    private String checksum;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private PayloadType payloadType;

    @Column(nullable = false)
    private Instant startedAt;

    @Column
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobOutcome outcome = JobOutcome.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer recordCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer appliedCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer unchangedCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer errorCount = 0;

    @Column(columnDefinition = "TEXT")
    private String errorDetail;

    @Column
    private Integer kafkaPartition;

    @Column
    private Long kafkaOffset;

    public enum JobOutcome {
        PENDING,
        SUCCESS,
        PARTIAL,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (startedAt == null) {
            startedAt = Instant.now();
        }
    }

    public boolean isFinished() {
        return outcome != JobOutcome.PENDING;
    }
}

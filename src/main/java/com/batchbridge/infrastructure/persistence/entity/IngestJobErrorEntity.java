package com.batchbridge.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * A candidate record rejected during a job.
 */
@Entity
@Table(name = "ingest_job_errors", indexes = {
    @Index(name = "idx_ingest_job_errors_job", columnList = "jobId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestJobErrorEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID jobId;

    @Column
    private Integer lineNumber;

    @Column(length = 255)
    private String businessKey;

    @Column(nullable = false, length = 1000)
    private String message;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}

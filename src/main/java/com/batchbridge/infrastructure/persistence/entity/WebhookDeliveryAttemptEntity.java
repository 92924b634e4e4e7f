package com.batchbridge.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * History row for a single webhook attempt.
 */
@Entity
@Table(name = "webhook_delivery_attempts", indexes = {
    @Index(name = "idx_webhook_attempts_delivery", columnList = "deliveryId,attemptNumber")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDeliveryAttemptEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID deliveryId;

    @Column(nullable = false)
    private Integer attemptNumber;

    @Column(nullable = false)
    private Instant startedAt;

    @Column(nullable = false)
    private Instant finishedAt;

    @Column(nullable = false)
    private Long durationMs;

    @Column
    private Integer responseStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AttemptOutcome outcome;

    @Column(length = 1000)
    private String errorMessage;

    public enum AttemptOutcome {
        SUCCEEDED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}

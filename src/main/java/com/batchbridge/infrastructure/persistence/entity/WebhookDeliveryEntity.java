package com.batchbridge.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbound webhook delivery and its retry state.
 *
 * State machine: PENDING -> DELIVERING -> {DELIVERED | PENDING (backoff) | ABANDONED}.
 * FAILED is used when a delivery cannot be attempted at all (subscriber no
 * longer configured). DELIVERED is terminal; ABANDONED and FAILED only leave
 * through an explicit operator replay. A replay grants a fresh retry budget:
 * the attempt limit and the backoff count only attempts made since the last
 * replay, while attemptCount keeps the lifetime total.
 *
 * Rows are written in the same transaction as the domain change that
 * triggered them; the unique (triggering_event_ref, subscriber) constraint
 * folds re-enqueues of the same change.
 */
@Entity
@Table(name = "webhook_deliveries", uniqueConstraints = {
    @UniqueConstraint(name = "uq_webhook_deliveries_event_subscriber",
            columnNames = {"triggering_event_ref", "subscriber"})
}, indexes = {
    @Index(name = "idx_webhook_deliveries_due", columnList = "status,nextAttemptAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDeliveryEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID deliveryId;

    @Column(name = "triggering_event_ref", nullable = false, length = 512)
    private String triggeringEventRef;

    @Column(nullable = false, length = 64)
    private String eventType;

    @Column(name = "subscriber", nullable = false, length = 100)
    private String subscriber;

    @Column(nullable = false, length = 1000)
    private String targetEndpoint;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Column(length = 1000)
    private String lastError;

    @Column
    private Integer lastResponseStatus;

    @Column(nullable = false)
    private Instant nextAttemptAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column
    private Instant deliveredAt;

    @Column(nullable = false)
    @Builder.Default
    private Integer replayCount = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer attemptsBeforeReplay = 0;

    @Version
    private Long version;

    public enum DeliveryStatus {
        PENDING,
        DELIVERING,
        DELIVERED,
        FAILED,
        ABANDONED;

        public boolean isReplayable() {
            return this == ABANDONED || this == FAILED;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (deliveryId == null) {
            deliveryId = UUID.randomUUID();
        }
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = now;
        }
    }

    public void markDelivering(Instant now) {
        requireStatus(DeliveryStatus.PENDING);
        this.status = DeliveryStatus.DELIVERING;
        this.updatedAt = now;
    }

    public void markDelivered(int responseStatus, Instant now) {
        requireStatus(DeliveryStatus.DELIVERING);
        this.attemptCount++;
        this.status = DeliveryStatus.DELIVERED;
        this.lastResponseStatus = responseStatus;
        this.lastError = null;
        this.deliveredAt = now;
        this.updatedAt = now;
    }

    /**
     * Counts a failed attempt. Returns the new attempt count.
     */
    public int registerFailedAttempt(String error, Integer responseStatus, Instant now) {
        requireStatus(DeliveryStatus.DELIVERING);
        this.attemptCount++;
        this.lastError = truncate(error);
        this.lastResponseStatus = responseStatus;
        this.updatedAt = now;
        return attemptCount;
    }

    public void scheduleRetry(Instant nextAttemptAt) {
        this.status = DeliveryStatus.PENDING;
        this.nextAttemptAt = nextAttemptAt;
    }

    public void abandon() {
        this.status = DeliveryStatus.ABANDONED;
    }

    public void markFailed(String reason, Instant now) {
        this.status = DeliveryStatus.FAILED;
        this.lastError = truncate(reason);
        this.updatedAt = now;
    }

    /** Attempts made since the last replay, or since creation. */
    public int attemptsSinceReplay() {
        return attemptCount - attemptsBeforeReplay;
    }

    /**
     * Operator replay. Attempt count is kept for audit; the retry budget
     * starts over.
     */
    public void replay(Instant now) {
        if (!status.isReplayable()) {
            throw new IllegalStateException(
                    "Delivery " + deliveryId + " is " + status + " and cannot be replayed");
        }
        this.attemptsBeforeReplay = attemptCount;
        this.status = DeliveryStatus.PENDING;
        this.nextAttemptAt = now;
        this.replayCount++;
        this.updatedAt = now;
    }

    private void requireStatus(DeliveryStatus expected) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Delivery " + deliveryId + " expected " + expected + " but was " + status);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 1000) {
            return value;
        }
        return value.substring(0, 1000);
    }
}

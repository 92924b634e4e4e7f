package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDeliveryEntity, UUID> {

    Page<WebhookDeliveryEntity> findByStatus(WebhookDeliveryEntity.DeliveryStatus status, Pageable pageable);

    long countByStatus(WebhookDeliveryEntity.DeliveryStatus status);

    /**
     * Locks due PENDING rows. Rows locked by another dispatcher instance are skipped.
     */
    @Query(value = """
            SELECT * FROM webhook_deliveries
            WHERE status = 'PENDING' AND next_attempt_at <= :now
            ORDER BY next_attempt_at
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<WebhookDeliveryEntity> lockDue(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Locks DELIVERING rows whose attempt never reported back.
     */
    @Query(value = """
            SELECT * FROM webhook_deliveries
            WHERE status = 'DELIVERING' AND updated_at < :cutoff
            ORDER BY updated_at
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<WebhookDeliveryEntity> lockStale(@Param("cutoff") Instant cutoff, @Param("limit") int limit);

    @Modifying
    @Query(value = """
            INSERT INTO webhook_deliveries (delivery_id, triggering_event_ref, event_type, subscriber,
                                            target_endpoint, payload, attempt_count, status,
                                            next_attempt_at, created_at, updated_at, replay_count, version)
            VALUES (:deliveryId, :eventRef, :eventType, :subscriber,
                    :targetEndpoint, :payload, 0, 'PENDING',
                    :now, :now, :now, 0, 0)
            ON CONFLICT (triggering_event_ref, subscriber) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("deliveryId") UUID deliveryId,
                       @Param("eventRef") String eventRef,
                       @Param("eventType") String eventType,
                       @Param("subscriber") String subscriber,
                       @Param("targetEndpoint") String targetEndpoint,
                       @Param("payload") String payload,
                       @Param("now") Instant now);
}

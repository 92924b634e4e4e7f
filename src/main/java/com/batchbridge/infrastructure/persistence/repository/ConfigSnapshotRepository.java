package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.ConfigSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ConfigSnapshotRepository extends JpaRepository<ConfigSnapshotEntity, UUID> {

    List<ConfigSnapshotEntity> findByMerchantIdOrderByCapturedAtDesc(String merchantId);

    /**
     * Snapshots are immutable: a second write for the same key is dropped.
     */
    @Modifying
    @Query(value = """
            INSERT INTO config_snapshots (id, merchant_id, captured_at, payload, content_hash,
                                          source_file_reference, created_at)
            VALUES (:id, :merchantId, :capturedAt, :payload, :contentHash,
                    :sourceFileReference, :now)
            ON CONFLICT (merchant_id, captured_at) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("merchantId") String merchantId,
                       @Param("capturedAt") Instant capturedAt,
                       @Param("payload") String payload,
                       @Param("contentHash") String contentHash,
                       @Param("sourceFileReference") String sourceFileReference,
                       @Param("now") Instant now);
}

package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RawFileRepository extends JpaRepository<RawFileEntity, UUID> {

    boolean existsByChecksum(String checksum);

    Optional<RawFileEntity> findByChecksum(String checksum);

    Optional<RawFileEntity> findByStorageKey(String storageKey);

    Page<RawFileEntity> findByStatus(RawFileEntity.RawFileStatus status, Pageable pageable);

    /**
     * Insert guarded by the checksum unique constraint.
     *
     * Returns 1 when this caller created the row, 0 when the checksum already
     * exists (including a concurrent insert that committed first). The new
     * row starts unpublished and claimed by the caller until claimedUntil.
     */
    @Transactional
    @Modifying
    @Query(value = """
            INSERT INTO raw_files (id, checksum, storage_key, source_filename, payload_type,
                                   size_bytes, received_at, status, status_updated_at,
                                   publish_claimed_until)
            VALUES (:id, :checksum, :storageKey, :sourceFilename, :payloadType,
                    :sizeBytes, :receivedAt, 'RECEIVED', :receivedAt, :claimedUntil)
            ON CONFLICT (checksum) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("checksum") String checksum,
                       @Param("storageKey") String storageKey,
                       @Param("sourceFilename") String sourceFilename,
                       @Param("payloadType") String payloadType,
                       @Param("sizeBytes") long sizeBytes,
                       @Param("receivedAt") Instant receivedAt,
                       @Param("claimedUntil") Instant claimedUntil);

    /**
     * Rows whose ingest event was never acknowledged and whose publish claim
     * has lapsed.
     */
    @Query("SELECT r FROM RawFileEntity r WHERE r.publishedAt IS NULL AND r.publishClaimedUntil <= :now "
            + "ORDER BY r.receivedAt")
    List<RawFileEntity> findPendingPublication(@Param("now") Instant now, Pageable pageable);

    /**
     * Takes the publish claim on a pending row. Returns 0 when the row was
     * published meanwhile or another watcher holds a live claim.
     */
    @Transactional
    @Modifying
    @Query("UPDATE RawFileEntity r SET r.publishClaimedUntil = :claimedUntil "
            + "WHERE r.id = :id AND r.publishedAt IS NULL AND r.publishClaimedUntil <= :now")
    int claimPublication(@Param("id") UUID id,
                         @Param("now") Instant now,
                         @Param("claimedUntil") Instant claimedUntil);

    /** Gives the claim up after a failed publish so the next poll retries at once. */
    @Transactional
    @Modifying
    @Query("UPDATE RawFileEntity r SET r.publishClaimedUntil = :now WHERE r.id = :id AND r.publishedAt IS NULL")
    int releasePublication(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("UPDATE RawFileEntity r SET r.publishedAt = :now WHERE r.id = :id")
    int markPublished(@Param("id") UUID id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("UPDATE RawFileEntity r SET r.status = :status, r.statusUpdatedAt = :now "
            + "WHERE r.storageKey = :storageKey")
    int updateStatusByStorageKey(@Param("storageKey") String storageKey,
                                 @Param("status") RawFileEntity.RawFileStatus status,
                                 @Param("now") Instant now);
}

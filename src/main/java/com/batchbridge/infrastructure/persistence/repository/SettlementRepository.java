package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.SettlementEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    Optional<SettlementEntity> findByMerchantIdAndBusinessDateAndBatchId(
            String merchantId, LocalDate businessDate, String batchId);

    /**
     * Single-statement upsert on (merchant_id, business_date, batch_id).
     *
     * The update branch only fires when the content differs and the incoming
     * version sorts after the stored one on (revision, publication time,
     * content hash), compared as one tuple. A missing revision sorts below
     * every explicit revision. Being a total order, any arrival order of the
     * same set of versions converges to the same row.
     *
     * Returns 1 when a row was inserted or changed, 0 for a no-op.
     */
    @Modifying
    @Query(value = """
            INSERT INTO settlements (id, merchant_id, business_date, batch_id, currency,
                                     gross_amount, fee_amount, net_amount, transaction_count,
                                     revision, content_hash, source_file_reference,
                                     source_published_at, created_at, updated_at)
            VALUES (:id, :merchantId, :businessDate, :batchId, :currency,
                    :grossAmount, :feeAmount, :netAmount, :transactionCount,
                    CAST(:revision AS BIGINT), :contentHash, :sourceFileReference,
                    :sourcePublishedAt, :now, :now)
            ON CONFLICT (merchant_id, business_date, batch_id) DO UPDATE SET
                currency = EXCLUDED.currency,
                gross_amount = EXCLUDED.gross_amount,
                fee_amount = EXCLUDED.fee_amount,
                net_amount = EXCLUDED.net_amount,
                transaction_count = EXCLUDED.transaction_count,
                revision = EXCLUDED.revision,
                content_hash = EXCLUDED.content_hash,
                source_file_reference = EXCLUDED.source_file_reference,
                source_published_at = EXCLUDED.source_published_at,
                updated_at = EXCLUDED.updated_at
            WHERE settlements.content_hash <> EXCLUDED.content_hash
              AND (COALESCE(EXCLUDED.revision, -1), EXCLUDED.source_published_at, EXCLUDED.content_hash)
                > (COALESCE(settlements.revision, -1), settlements.source_published_at, settlements.content_hash)
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("merchantId") String merchantId,
               @Param("businessDate") LocalDate businessDate,
               @Param("batchId") String batchId,
               @Param("currency") String currency,
               @Param("grossAmount") BigDecimal grossAmount,
               @Param("feeAmount") BigDecimal feeAmount,
               @Param("netAmount") BigDecimal netAmount,
               @Param("transactionCount") int transactionCount,
               @Param("revision") Long revision,
               @Param("contentHash") String contentHash,
               @Param("sourceFileReference") String sourceFileReference,
               @Param("sourcePublishedAt") Instant sourcePublishedAt,
               @Param("now") Instant now);
}

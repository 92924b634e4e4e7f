package com.batchbridge.infrastructure.persistence.repository;

import com.batchbridge.infrastructure.persistence.entity.DisputeEntity;
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
public interface DisputeRepository extends JpaRepository<DisputeEntity, UUID> {

    Optional<DisputeEntity> findByMerchantIdAndCaseReference(String merchantId, String caseReference);

    /**
     * Upsert on (merchant_id, case_reference); same ordering rule as settlements.
     */
    @Modifying
    @Query(value = """
            INSERT INTO disputes (id, merchant_id, case_reference, transaction_reference, amount,
                                  currency, reason_code, status, opened_on, respond_by, revision,
                                  content_hash, source_file_reference, source_published_at,
                                  created_at, updated_at)
            VALUES (:id, :merchantId, :caseReference, :transactionReference, :amount,
                    :currency, :reasonCode, :status, :openedOn, CAST(:respondBy AS DATE),
                    CAST(:revision AS BIGINT), :contentHash, :sourceFileReference,
                    :sourcePublishedAt, :now, :now)
            ON CONFLICT (merchant_id, case_reference) DO UPDATE SET
                transaction_reference = EXCLUDED.transaction_reference,
                amount = EXCLUDED.amount,
                currency = EXCLUDED.currency,
                reason_code = EXCLUDED.reason_code,
                status = EXCLUDED.status,
                opened_on = EXCLUDED.opened_on,
                respond_by = EXCLUDED.respond_by,
                revision = EXCLUDED.revision,
                content_hash = EXCLUDED.content_hash,
                source_file_reference = EXCLUDED.source_file_reference,
                source_published_at = EXCLUDED.source_published_at,
                updated_at = EXCLUDED.updated_at
            WHERE disputes.content_hash <> EXCLUDED.content_hash
              AND (COALESCE(EXCLUDED.revision, -1), EXCLUDED.source_published_at, EXCLUDED.content_hash)
                > (COALESCE(disputes.revision, -1), disputes.source_published_at, disputes.content_hash)
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("merchantId") String merchantId,
               @Param("caseReference") String caseReference,
               @Param("transactionReference") String transactionReference,
               @Param("amount") BigDecimal amount,
               @Param("currency") String currency,
               @Param("reasonCode") String reasonCode,
               @Param("status") String status,
               @Param("openedOn") LocalDate openedOn,
               @Param("respondBy") LocalDate respondBy,
               @Param("revision") Long revision,
               @Param("contentHash") String contentHash,
               @Param("sourceFileReference") String sourceFileReference,
               @Param("sourcePublishedAt") Instant sourcePublishedAt,
               @Param("now") Instant now);
}

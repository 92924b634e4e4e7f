package com.batchbridge.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Settlement batch, keyed by (merchant_id, business_date, batch_id).
 *
 * Written only through the conditional upsert in SettlementRepository.
 */
@Entity
@Table(name = "settlements", uniqueConstraints = {
    @UniqueConstraint(name = "uq_settlements_business_key",
            columnNames = {"merchant_id", "business_date", "batch_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(name = "merchant_id", nullable = false, length = 64)
    private String merchantId;

    @Column(name = "business_date", nullable = false)
    private LocalDate businessDate;

    @Column(name = "batch_id", nullable = false, length = 64)
    private String batchId;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal grossAmount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal feeAmount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal netAmount;

    @Column(nullable = false)
    private Integer transactionCount;

    @Column
    private Long revision;

    @Column(nullable = false, length = 64)
    private String contentHash;

    @Column(nullable = false, length = 255)
    private String sourceFileReference;

    @Column(nullable = false)
    private Instant sourcePublishedAt;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;
}

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
 * Dispute case, keyed by (merchant_id, case_reference).
 */
@Entity
@Table(name = "disputes", uniqueConstraints = {
    @UniqueConstraint(name = "uq_disputes_business_key",
            columnNames = {"merchant_id", "case_reference"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID id;

    @Column(name = "merchant_id", nullable = false, length = 64)
    private String merchantId;

    @Column(name = "case_reference", nullable = false, length = 64)
    private String caseReference;

    @Column(length = 64)
    private String transactionReference;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(nullable = false, length = 32)
    private String reasonCode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DisputeStatus status;

    @Column(nullable = false)
    private LocalDate openedOn;

    @Column
    private LocalDate respondBy;

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

    public enum DisputeStatus {
        OPEN,
        UNDER_REVIEW,
        WON,
        LOST,
        ACCEPTED,
        CLOSED
    }
}

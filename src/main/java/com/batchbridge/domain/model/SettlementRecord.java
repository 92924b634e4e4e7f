package com.batchbridge.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class SettlementRecord implements CandidateRecord {
    int lineNumber;
    String merchantId;
    LocalDate businessDate;
    String batchId;
    String currency;
    BigDecimal grossAmount;
    BigDecimal feeAmount;
    BigDecimal netAmount;
    int transactionCount;
    Long revision;
    String contentHash;

    @Override
    public String getBusinessKey() {
        return merchantId + "/" + businessDate + "/" + batchId;
    }
}

package com.batchbridge.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class DisputeRecord implements CandidateRecord {
    int lineNumber;
    String merchantId;
    String caseReference;
    String transactionReference;
    BigDecimal amount;
    String currency;
    String reasonCode;
    String status;
    LocalDate openedOn;
    LocalDate respondBy;
    Long revision;
    String contentHash;

    @Override
    public String getBusinessKey() {
        return merchantId + "/" + caseReference;
    }
}

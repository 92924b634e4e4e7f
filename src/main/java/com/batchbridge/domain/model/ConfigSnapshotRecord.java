package com.batchbridge.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Configuration snapshot; the payload is kept as the original JSON text.
 */
@Value
@Builder
public class ConfigSnapshotRecord implements CandidateRecord {
    int lineNumber;
    String merchantId;
    Instant capturedAt;
    String payload;
    String contentHash;

    @Override
    public String getBusinessKey() {
        return merchantId + "@" + capturedAt;
    }
}

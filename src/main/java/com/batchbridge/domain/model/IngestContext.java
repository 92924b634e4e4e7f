package com.batchbridge.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Identifies the job and event a candidate write belongs to.
 */
@Value
public class IngestContext {
    UUID jobId;
    UUID eventId;
    String fileReference;
    Instant publishedAt;
}

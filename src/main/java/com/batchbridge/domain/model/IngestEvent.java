package com.batchbridge.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Announcement that a raw file has been stored and is ready for ingestion.
 *
 * Immutable once published. Consumers may see the same event more than once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestEvent {

    private UUID eventId;
    private String checksum;
    private String fileReference;
    private String sourceFilename;
    private PayloadType payloadType;
    private Instant publishedAt;

    /** Set when an operator replays an earlier job. */
    private UUID replayOfJobId;
}

package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.exception.ResourceNotFoundException;
import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.infrastructure.messaging.IngestEventPublisher;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Operator-triggered reprocessing of stored raw files.
 *
 * A replay publishes a fresh ingest event for bytes already in the object
 * store. The event carries the file's original receipt time as its
 * publication time, so replaying an old file cannot outrank a newer version
 * of the same records. Record writes stay idempotent; only a new job row and
 * whatever the upserts still change are produced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestReplayService {

    private final IngestJobRepository jobRepository;
    private final RawFileRepository rawFileRepository;
    private final IngestEventPublisher publisher;
    private final Clock clock;

    @Transactional
    public IngestEvent replayJob(UUID jobId, PayloadType overrideType) {
        IngestJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Ingest job", jobId));
        if (!job.isFinished()) {
            throw new IllegalStateException("Ingest job " + jobId + " is still running");
        }
        RawFileEntity rawFile = rawFileRepository.findByStorageKey(job.getFileReference())
                .orElseThrow(() -> new ResourceNotFoundException("Raw file", job.getFileReference()));
        return republish(rawFile, overrideType, jobId);
    }

    @Transactional
    public IngestEvent replayRawFile(UUID rawFileId, PayloadType overrideType) {
        RawFileEntity rawFile = rawFileRepository.findById(rawFileId)
                .orElseThrow(() -> new ResourceNotFoundException("Raw file", rawFileId));
        return republish(rawFile, overrideType, null);
    }

    private IngestEvent republish(RawFileEntity rawFile, PayloadType overrideType, UUID replayOfJobId) {
        if (overrideType != null && overrideType != rawFile.getPayloadType()) {
            log.info("Reclassifying raw file {} from {} to {}", rawFile.getChecksum(), rawFile.getPayloadType(), overrideType);
            rawFile.setPayloadType(overrideType);
        }
        rawFile.setStatus(RawFileEntity.RawFileStatus.RECEIVED);
        rawFile.setStatusUpdatedAt(clock.instant());
        rawFileRepository.save(rawFile);

        IngestEvent event = IngestEvent.builder()
                .eventId(UUID.randomUUID())
                .checksum(rawFile.getChecksum())
                .fileReference(rawFile.getStorageKey())
                .sourceFilename(rawFile.getSourceFilename())
                .payloadType(rawFile.getPayloadType())
                .publishedAt(rawFile.getReceivedAt())
                .replayOfJobId(replayOfJobId)
                .build();

        publisher.publish(event);
        log.info("Replayed raw file {} as event {} (replay of job {})",
                rawFile.getChecksum(), event.getEventId(), replayOfJobId);
        return event;
    }
}

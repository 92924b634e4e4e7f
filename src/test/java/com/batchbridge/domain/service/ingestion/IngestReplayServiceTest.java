package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.exception.ResourceNotFoundException;
import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.infrastructure.messaging.IngestEventPublisher;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestReplayServiceTest {

    private static final Instant RECEIVED_AT = Instant.parse("2024-02-01T09:00:00Z");
    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @Mock private IngestJobRepository jobRepository;
    @Mock private RawFileRepository rawFileRepository;
    @Mock private IngestEventPublisher publisher;

    private IngestReplayService replayService;

    @BeforeEach
    void setUp() {
        replayService = new IngestReplayService(jobRepository, rawFileRepository, publisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void replayJob_publishesFreshEventWithOriginalReceiptTime() {
        RawFileEntity rawFile = rawFile(PayloadType.SETTLEMENT);
        IngestJobEntity job = finishedJob(rawFile);
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));
        when(rawFileRepository.findByStorageKey(rawFile.getStorageKey())).thenReturn(Optional.of(rawFile));

        IngestEvent event = replayService.replayJob(job.getJobId(), null);

        assertNotEquals(job.getEventId(), event.getEventId());
        assertEquals(job.getJobId(), event.getReplayOfJobId());
        assertEquals(RECEIVED_AT, event.getPublishedAt());
        assertEquals(rawFile.getStorageKey(), event.getFileReference());
        assertEquals(RawFileEntity.RawFileStatus.RECEIVED, rawFile.getStatus());
        verify(publisher).publish(event);
    }

    @Test
    void replayJob_overrideReclassifiesRawFile() {
        RawFileEntity rawFile = rawFile(PayloadType.UNKNOWN);
        IngestJobEntity job = finishedJob(rawFile);
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));
        when(rawFileRepository.findByStorageKey(rawFile.getStorageKey())).thenReturn(Optional.of(rawFile));

        IngestEvent event = replayService.replayJob(job.getJobId(), PayloadType.DISPUTE);

        assertEquals(PayloadType.DISPUTE, event.getPayloadType());
        assertEquals(PayloadType.DISPUTE, rawFile.getPayloadType());
    }

    @Test
    void replayJob_runningJobIsRejected() {
        RawFileEntity rawFile = rawFile(PayloadType.SETTLEMENT);
        IngestJobEntity job = finishedJob(rawFile);
        job.setOutcome(IngestJobEntity.JobOutcome.PENDING);
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));

        assertThrows(IllegalStateException.class, () -> replayService.replayJob(job.getJobId(), null));
        verifyNoInteractions(publisher);
    }

    @Test
    void replayRawFile_unknownIdIsNotFound() {
        UUID id = UUID.randomUUID();
        when(rawFileRepository.findById(id)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> replayService.replayRawFile(id, null));
        verify(publisher, never()).publish(any());
    }

    private static RawFileEntity rawFile(PayloadType type) {
        return RawFileEntity.builder()
                .id(UUID.randomUUID())
                .checksum("cd" + "1".repeat(62))
                .storageKey("raw/cd/cd" + "1".repeat(62))
                .sourceFilename("upload.csv")
                .payloadType(type)
                .sizeBytes(120L)
                .receivedAt(RECEIVED_AT)
                .status(RawFileEntity.RawFileStatus.FAILED)
                .build();
    }

    private static IngestJobEntity finishedJob(RawFileEntity rawFile) {
        return IngestJobEntity.builder()
                .jobId(UUID.randomUUID())
                .eventId(UUID.randomUUID())
                .fileReference(rawFile.getStorageKey())
                .payloadType(rawFile.getPayloadType())
                .startedAt(RECEIVED_AT)
                .outcome(IngestJobEntity.JobOutcome.FAILED)
                .build();
    }
}

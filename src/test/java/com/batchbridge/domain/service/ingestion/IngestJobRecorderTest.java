package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.RecordRejection;
import com.batchbridge.domain.service.delivery.WebhookEnqueuer;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity.JobOutcome;
import com.batchbridge.infrastructure.persistence.entity.IngestJobErrorEntity;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity.RawFileStatus;
import com.batchbridge.infrastructure.persistence.repository.IngestJobErrorRepository;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestJobRecorderTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:05:00Z");

    @Mock private IngestJobRepository jobRepository;
    @Mock private IngestJobErrorRepository jobErrorRepository;
    @Mock private RawFileRepository rawFileRepository;
    @Mock private WebhookEnqueuer webhookEnqueuer;

    private IngestJobRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new IngestJobRecorder(jobRepository, jobErrorRepository, rawFileRepository, webhookEnqueuer,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void open_savesPendingJobWithBrokerPosition() {
        IngestEvent event = IngestEvent.builder()
                .eventId(UUID.randomUUID())
                .checksum("abc")
                .fileReference("raw/ab/abc")
                .payloadType(PayloadType.DISPUTE)
                .build();
        when(jobRepository.save(any(IngestJobEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        IngestJobEntity job = recorder.open(event, 2, 77L);

        assertNotNull(job.getJobId());
        assertEquals(event.getEventId(), job.getEventId());
        assertEquals(JobOutcome.PENDING, job.getOutcome());
        assertEquals(NOW, job.getStartedAt());
        assertEquals(2, job.getKafkaPartition());
        assertEquals(77L, job.getKafkaOffset());
    }

    @Test
    void complete_partialWritesErrorsAndMarksFileProcessed() {
        IngestJobEntity job = pendingJob();
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));
        when(jobRepository.save(job)).thenReturn(job);
        JobSummary summary = JobSummary.of(10, 7, 1, List.of(
                new RecordRejection(3, "m-1/c-3", "amount must be positive: 0"),
                new RecordRejection(9, "m-1/c-9", "unknown dispute status: LOST?")));

        recorder.complete(job.getJobId(), summary);

        assertEquals(JobOutcome.PARTIAL, job.getOutcome());
        assertEquals(NOW, job.getFinishedAt());
        assertEquals(10, job.getRecordCount());
        assertEquals(2, job.getErrorCount());
        assertTrue(job.getErrorDetail().startsWith("2 of 10 records rejected"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IngestJobErrorEntity>> errors = ArgumentCaptor.forClass(List.class);
        verify(jobErrorRepository).saveAll(errors.capture());
        assertEquals(2, errors.getValue().size());
        assertEquals(job.getJobId(), errors.getValue().get(0).getJobId());

        verify(rawFileRepository).updateStatusByStorageKey("raw/ab/abc", RawFileStatus.PROCESSED, NOW);
        verify(webhookEnqueuer).enqueue(eq(NotificationType.INGEST_JOB_COMPLETED),
                eq("ingest.job.completed:" + job.getJobId()), anyMap());
    }

    @Test
    void complete_failedMarksFileFailedAndNotifies() {
        IngestJobEntity job = pendingJob();
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));
        when(jobRepository.save(job)).thenReturn(job);

        recorder.complete(job.getJobId(), JobSummary.failed("Raw file not found: raw/ab/abc"));

        assertEquals(JobOutcome.FAILED, job.getOutcome());
        verify(jobErrorRepository, never()).saveAll(any());
        verify(rawFileRepository).updateStatusByStorageKey("raw/ab/abc", RawFileStatus.FAILED, NOW);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> data = ArgumentCaptor.forClass(Map.class);
        verify(webhookEnqueuer).enqueue(eq(NotificationType.INGEST_JOB_FAILED),
                eq("ingest.job.failed:" + job.getJobId()), data.capture());
        assertEquals("FAILED", data.getValue().get("outcome"));
        assertEquals("Raw file not found: raw/ab/abc", data.getValue().get("error_detail"));
    }

    @Test
    void complete_truncatesLongErrorDetail() {
        IngestJobEntity job = pendingJob();
        when(jobRepository.findById(job.getJobId())).thenReturn(Optional.of(job));
        when(jobRepository.save(job)).thenReturn(job);

        recorder.complete(job.getJobId(), JobSummary.failed("x".repeat(10_000)));

        assertEquals(4000, job.getErrorDetail().length());
    }

    private static IngestJobEntity pendingJob() {
        return IngestJobEntity.builder()
                .jobId(UUID.randomUUID())
                .eventId(UUID.randomUUID())
                .fileReference("raw/ab/abc")
                .payloadType(PayloadType.DISPUTE)
                .startedAt(NOW.minusSeconds(30))
                .build();
    }
}

package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.RecordRejection;
import com.batchbridge.domain.service.delivery.WebhookEnqueuer;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.IngestJobErrorEntity;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import com.batchbridge.infrastructure.persistence.repository.IngestJobErrorRepository;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job bookkeeping for the ingestion worker.
 *
 * open() commits on its own so the attempt is visible even if the worker dies
 * mid-file. complete() writes the outcome, the rejected rows, the raw file
 * status and the job notification in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestJobRecorder {

    private static final int MAX_ERROR_DETAIL = 4000;

    private final IngestJobRepository jobRepository;
    private final IngestJobErrorRepository jobErrorRepository;
    private final RawFileRepository rawFileRepository;
    private final WebhookEnqueuer webhookEnqueuer;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestJobEntity open(IngestEvent event, Integer partition, Long offset) {
        IngestJobEntity job = IngestJobEntity.builder()
                .jobId(UUID.randomUUID())
                .eventId(event.getEventId() != null ? event.getEventId() : UUID.randomUUID())
                .fileReference(event.getFileReference())
                .checksum(event.getChecksum())
                .payloadType(event.getPayloadType() != null ? event.getPayloadType() : PayloadType.UNKNOWN)
                .startedAt(clock.instant())
                .kafkaPartition(partition)
                .kafkaOffset(offset)
                .build();

        job = jobRepository.save(job);
        log.info("Opened ingest job {} for event {} ({})", job.getJobId(), job.getEventId(), job.getFileReference());
        return job;
    }

    @Transactional
    public IngestJobEntity complete(UUID jobId, JobSummary summary) {
        IngestJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("Ingest job vanished: " + jobId));

        Instant now = clock.instant();
        job.setOutcome(summary.getOutcome());
        job.setFinishedAt(now);
        job.setRecordCount(summary.getRecordCount());
        job.setAppliedCount(summary.getAppliedCount());
        job.setUnchangedCount(summary.getUnchangedCount());
        job.setErrorCount(summary.getErrorCount());
        job.setErrorDetail(truncate(summary.getErrorDetail()));
        job = jobRepository.save(job);

        List<IngestJobErrorEntity> errors = summary.getRejections().stream()
                .map(rejection -> toErrorRow(jobId, rejection))
                .toList();
        if (!errors.isEmpty()) {
            jobErrorRepository.saveAll(errors);
        }

        RawFileEntity.RawFileStatus fileStatus = summary.getOutcome() == IngestJobEntity.JobOutcome.FAILED
                ? RawFileEntity.RawFileStatus.FAILED
                : RawFileEntity.RawFileStatus.PROCESSED;
        rawFileRepository.updateStatusByStorageKey(job.getFileReference(), fileStatus, now);

        NotificationType notification = summary.getOutcome() == IngestJobEntity.JobOutcome.FAILED
                ? NotificationType.INGEST_JOB_FAILED
                : NotificationType.INGEST_JOB_COMPLETED;
        webhookEnqueuer.enqueue(notification, notification.wireName() + ":" + jobId, toNotification(job));

        log.info("Ingest job {} finished: outcome={}, records={}, applied={}, unchanged={}, errors={}",
                jobId, job.getOutcome(), job.getRecordCount(), job.getAppliedCount(),
                job.getUnchangedCount(), job.getErrorCount());
        return job;
    }

    private static IngestJobErrorEntity toErrorRow(UUID jobId, RecordRejection rejection) {
        return IngestJobErrorEntity.builder()
                .id(UUID.randomUUID())
                .jobId(jobId)
                .lineNumber(rejection.getLineNumber())
                .businessKey(truncate(rejection.getBusinessKey(), 255))
                .message(truncate(rejection.getMessage(), 1000))
                .build();
    }

    private static Map<String, Object> toNotification(IngestJobEntity job) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("job_id", job.getJobId().toString());
        data.put("event_id", job.getEventId().toString());
        data.put("file_reference", job.getFileReference());
        data.put("payload_type", job.getPayloadType().name());
        data.put("outcome", job.getOutcome().name());
        data.put("record_count", job.getRecordCount());
        data.put("applied_count", job.getAppliedCount());
        data.put("error_count", job.getErrorCount());
        data.put("error_detail", job.getErrorDetail());
        return data;
    }

    private static String truncate(String value) {
        return truncate(value, MAX_ERROR_DETAIL);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}

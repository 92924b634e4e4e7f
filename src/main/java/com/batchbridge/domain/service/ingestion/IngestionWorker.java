package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.CandidateRecord;
import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.ParseResult;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.RecordRejection;
import com.batchbridge.domain.model.UpsertOutcome;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.storage.ObjectStore;
import com.batchbridge.infrastructure.storage.ObjectStoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns one ingest event into domain record writes.
 *
 * Processing Flow:
 * 1. Open an IngestJob (committed on its own)
 * 2. Fetch the raw bytes from the object store
 * 3. Parse with the handler for the event's payload type
 * 4. Apply each candidate in its own transaction
 * 5. Record outcome, rejected rows and the job notification
 *
 * Failure Handling:
 * - Missing object, store error, unreadable payload: job FAILED, returns normally
 * - Constraint violation on a single record: rejected, other records continue
 * - Any other exception: job FAILED, exception rethrown so the event is redelivered
 *
 * Every apply is an idempotent upsert, so reprocessing the same file after a
 * partial run only writes what is still missing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionWorker {

    private final ObjectStore objectStore;
    private final PayloadHandlerRegistry handlerRegistry;
    private final IngestJobRecorder jobRecorder;
    private final MeterRegistry meterRegistry;

    public IngestJobEntity process(IngestEvent event, Integer partition, Long offset) {
        Timer.Sample sample = Timer.start(meterRegistry);
        IngestJobEntity job = jobRecorder.open(event, partition, offset);
        UUID jobId = job.getJobId();

        IngestContext context = new IngestContext(
                jobId,
                job.getEventId(),
                event.getFileReference(),
                event.getPublishedAt() != null ? event.getPublishedAt() : job.getStartedAt());

        JobSummary summary;
        try {
            summary = run(event, context);
        } catch (RuntimeException e) {
            log.error("Ingest job {} aborted on {}: {}", jobId, event.getFileReference(), e.getMessage(), e);
            recordAbort(jobId, e);
            countJob(job.getPayloadType(), "aborted");
            throw e;
        }

        IngestJobEntity completed = jobRecorder.complete(jobId, summary);

        sample.stop(Timer.builder("ingest.job.latency")
                .tag("type", job.getPayloadType().name())
                .register(meterRegistry));
        countJob(job.getPayloadType(), summary.getOutcome().name().toLowerCase());
        Counter.builder("ingest.records")
                .tag("result", "rejected")
                .register(meterRegistry)
                .increment(summary.getErrorCount());
        Counter.builder("ingest.records")
                .tag("result", "applied")
                .register(meterRegistry)
                .increment(summary.getAppliedCount());

        return completed;
    }

    private JobSummary run(IngestEvent event, IngestContext context) {
        Optional<byte[]> content;
        try {
            content = objectStore.get(event.getFileReference());
        } catch (ObjectStoreException e) {
            log.warn("Object store unavailable for {}: {}", event.getFileReference(), e.getMessage());
            return JobSummary.failed("Object store unavailable: " + e.getMessage());
        }
        if (content.isEmpty()) {
            log.warn("Raw file {} not found in object store", event.getFileReference());
            return JobSummary.failed("Raw file not found: " + event.getFileReference());
        }

        try {
            return ingest(handlerRegistry.forType(event.getPayloadType()), content.get(), context);
        } catch (PayloadParseException e) {
            log.warn("Payload {} rejected as a whole: {}", event.getFileReference(), e.getMessage());
            return JobSummary.failed("Unreadable payload: " + e.getMessage());
        }
    }

    private <T extends CandidateRecord> JobSummary ingest(PayloadHandler<T> handler, byte[] content,
                                                          IngestContext context) {
        ParseResult<T> parsed = handler.parse(content);
        List<RecordRejection> rejections = new ArrayList<>(parsed.getRejections());
        int applied = 0;
        int unchanged = 0;

        for (T candidate : parsed.getCandidates()) {
            try {
                if (handler.apply(candidate, context) == UpsertOutcome.APPLIED) {
                    applied++;
                } else {
                    unchanged++;
                }
            } catch (DataIntegrityViolationException e) {
                String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                log.warn("Write rejected for {} (line {}): {}",
                        candidate.getBusinessKey(), candidate.getLineNumber(), reason);
                rejections.add(new RecordRejection(candidate.getLineNumber(), candidate.getBusinessKey(),
                        "Write rejected: " + reason));
            }
        }

        rejections.sort(Comparator.comparingInt(RecordRejection::getLineNumber));
        log.debug("Job {}: {} candidates, {} applied, {} unchanged, {} rejected",
                context.getJobId(), parsed.size(), applied, unchanged, rejections.size());
        return JobSummary.of(parsed.size(), applied, unchanged, rejections);
    }

    private void recordAbort(UUID jobId, RuntimeException cause) {
        try {
            jobRecorder.complete(jobId, JobSummary.failed(
                    "Aborted: " + cause.getClass().getSimpleName() + ": " + cause.getMessage()));
        } catch (RuntimeException e) {
            // The job row stays PENDING; the redelivered event opens a new one.
            log.error("Could not record failure of ingest job {}: {}", jobId, e.getMessage());
        }
    }

    private void countJob(PayloadType type, String outcome) {
        Counter.builder("ingest.jobs")
                .tag("type", type.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}

package com.batchbridge.api;

import com.batchbridge.domain.exception.ResourceNotFoundException;
import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.service.delivery.WebhookDeliveryService;
import com.batchbridge.domain.service.ingestion.IngestReplayService;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import com.batchbridge.infrastructure.persistence.repository.IngestJobErrorRepository;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryAttemptRepository;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Operational control surface.
 *
 * Read endpoints expose jobs, raw files and deliveries for inspection.
 * Replay endpoints re-run ingestion of a stored file or requeue an
 * abandoned delivery; both are safe to repeat.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/ops")
@RequiredArgsConstructor
public class OperationsController {

    private static final int MAX_PAGE_SIZE = 200;

    private final IngestJobRepository jobRepository;
    private final IngestJobErrorRepository jobErrorRepository;
    private final RawFileRepository rawFileRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryAttemptRepository attemptRepository;
    private final IngestReplayService replayService;
    private final WebhookDeliveryService deliveryService;

    @GetMapping("/jobs")
    public Page<IngestJobEntity> listJobs(@RequestParam(required = false) IngestJobEntity.JobOutcome outcome,
                                          @RequestParam(defaultValue = "0") int page,
                                          @RequestParam(defaultValue = "50") int size) {
        Pageable pageable = page(page, size, "startedAt");
        return outcome == null ? jobRepository.findAll(pageable) : jobRepository.findByOutcome(outcome, pageable);
    }

    @GetMapping("/jobs/{jobId}")
    public JobDetailResponse getJob(@PathVariable UUID jobId) {
        IngestJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Ingest job", jobId));
        return new JobDetailResponse(job, jobErrorRepository.findByJobIdOrderByLineNumberAsc(jobId));
    }

    /**
     * POST /api/v1/ops/jobs/{jobId}/replay[?payloadType=SETTLEMENT]
     *
     * The optional payload type reclassifies the raw file before replay.
     */
    @PostMapping("/jobs/{jobId}/replay")
    public ResponseEntity<IngestEvent> replayJob(@PathVariable UUID jobId,
                                                 @RequestParam(required = false) PayloadType payloadType) {
        log.info("Operator replay of job {}", jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(replayService.replayJob(jobId, payloadType));
    }

    @GetMapping("/raw-files")
    public Page<RawFileEntity> listRawFiles(@RequestParam(required = false) RawFileEntity.RawFileStatus status,
                                            @RequestParam(defaultValue = "0") int page,
                                            @RequestParam(defaultValue = "50") int size) {
        Pageable pageable = page(page, size, "receivedAt");
        return status == null ? rawFileRepository.findAll(pageable) : rawFileRepository.findByStatus(status, pageable);
    }

    @GetMapping("/raw-files/{rawFileId}")
    public RawFileEntity getRawFile(@PathVariable UUID rawFileId) {
        return rawFileRepository.findById(rawFileId)
                .orElseThrow(() -> new ResourceNotFoundException("Raw file", rawFileId));
    }

    @PostMapping("/raw-files/{rawFileId}/replay")
    public ResponseEntity<IngestEvent> replayRawFile(@PathVariable UUID rawFileId,
                                                     @RequestParam(required = false) PayloadType payloadType) {
        log.info("Operator replay of raw file {}", rawFileId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(replayService.replayRawFile(rawFileId, payloadType));
    }

    @GetMapping("/deliveries")
    public Page<WebhookDeliveryEntity> listDeliveries(
            @RequestParam(required = false) WebhookDeliveryEntity.DeliveryStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        Pageable pageable = page(page, size, "createdAt");
        return status == null ? deliveryRepository.findAll(pageable) : deliveryRepository.findByStatus(status, pageable);
    }

    @GetMapping("/deliveries/{deliveryId}")
    public DeliveryDetailResponse getDelivery(@PathVariable UUID deliveryId) {
        WebhookDeliveryEntity delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook delivery", deliveryId));
        return new DeliveryDetailResponse(delivery, attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId));
    }

    @PostMapping("/deliveries/{deliveryId}/replay")
    public WebhookDeliveryEntity replayDelivery(@PathVariable UUID deliveryId) {
        log.info("Operator replay of delivery {}", deliveryId);
        return deliveryService.replay(deliveryId);
    }

    private static Pageable page(int page, int size, String sortField) {
        int boundedSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return PageRequest.of(Math.max(0, page), boundedSize, Sort.by(Sort.Direction.DESC, sortField));
    }
}

package com.batchbridge.domain.service.delivery;

import com.batchbridge.config.DeliveryProperties;
import com.batchbridge.domain.exception.ResourceNotFoundException;
import com.batchbridge.infrastructure.http.WebhookResponse;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryAttemptEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryAttemptEntity.AttemptOutcome;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity.DeliveryStatus;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryAttemptRepository;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Persists delivery state transitions. Each method is one short transaction;
 * none of them performs network I/O.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeliveryRecorder {

    static final String INTERRUPTED = "attempt interrupted";

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookDeliveryAttemptRepository attemptRepository;
    private final ExponentialBackoffPolicy backoffPolicy;
    private final DeliveryProperties properties;

    /**
     * Locks due rows (skipping those held by other dispatchers) and commits
     * them as DELIVERING.
     */
    @Transactional
    public List<WebhookDeliveryEntity> claimDue(Instant now, int limit) {
        List<WebhookDeliveryEntity> due = deliveryRepository.lockDue(now, limit);
        for (WebhookDeliveryEntity delivery : due) {
            delivery.markDelivering(now);
        }
        return deliveryRepository.saveAll(due);
    }

    @Transactional
    public DeliveryStatus recordAttempt(UUID deliveryId, WebhookResponse response, Instant startedAt, Instant finishedAt) {
        WebhookDeliveryEntity delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook delivery", deliveryId));

        if (delivery.getStatus() != DeliveryStatus.DELIVERING) {
            log.warn("Delivery {} moved to {} while its attempt was in flight, result discarded",
                    deliveryId, delivery.getStatus());
            return delivery.getStatus();
        }

        saveAttempt(delivery, response.isSuccess() ? AttemptOutcome.SUCCEEDED : AttemptOutcome.FAILED,
                response.getStatusCode(), response.getError(), startedAt, finishedAt);

        if (response.isSuccess()) {
            delivery.markDelivered(response.getStatusCode(), finishedAt);
        } else {
            applyFailure(delivery, response.getError(), response.getStatusCode(), finishedAt);
        }
        deliveryRepository.save(delivery);
        return delivery.getStatus();
    }

    @Transactional
    public void markUndeliverable(UUID deliveryId, String reason, Instant now) {
        deliveryRepository.findById(deliveryId).ifPresent(delivery -> {
            delivery.markFailed(reason, now);
            deliveryRepository.save(delivery);
        });
    }

    /**
     * Deliveries stuck in DELIVERING past the stale threshold lost their
     * attempt to a crash. They are counted as a failed attempt.
     */
    @Transactional
    public int recoverStale(Instant now, Duration staleAfter, int limit) {
        List<WebhookDeliveryEntity> stale = deliveryRepository.lockStale(now.minus(staleAfter), limit);
        for (WebhookDeliveryEntity delivery : stale) {
            saveAttempt(delivery, AttemptOutcome.FAILED, null, INTERRUPTED, delivery.getUpdatedAt(), now);
            applyFailure(delivery, INTERRUPTED, null, now);
            log.warn("Recovered stale delivery {} to {} (attempt {})",
                    delivery.getDeliveryId(), delivery.getStatus(), delivery.getAttemptCount());
        }
        deliveryRepository.saveAll(stale);
        return stale.size();
    }

    @Transactional
    public WebhookDeliveryEntity replay(UUID deliveryId, Instant now) {
        WebhookDeliveryEntity delivery = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook delivery", deliveryId));
        delivery.replay(now);
        return deliveryRepository.save(delivery);
    }

    private void applyFailure(WebhookDeliveryEntity delivery, String error, Integer responseStatus, Instant now) {
        delivery.registerFailedAttempt(error, responseStatus, now);
        int attempts = delivery.attemptsSinceReplay();
        if (attempts >= properties.getMaxAttempts()) {
            delivery.abandon();
            log.warn("Delivery {} to {} abandoned after {} attempts: {}",
                    delivery.getDeliveryId(), delivery.getSubscriber(), attempts, error);
        } else {
            delivery.scheduleRetry(now.plus(backoffPolicy.delayFor(attempts)));
            log.info("Delivery {} to {} failed (attempt {}), next attempt at {}",
                    delivery.getDeliveryId(), delivery.getSubscriber(), attempts, delivery.getNextAttemptAt());
        }
    }

    private void saveAttempt(WebhookDeliveryEntity delivery, AttemptOutcome outcome, Integer responseStatus,
                             String error, Instant startedAt, Instant finishedAt) {
        attemptRepository.save(WebhookDeliveryAttemptEntity.builder()
                .id(UUID.randomUUID())
                .deliveryId(delivery.getDeliveryId())
                .attemptNumber(delivery.getAttemptCount() + 1)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationMs(Duration.between(startedAt, finishedAt).toMillis())
                .responseStatus(responseStatus)
                .outcome(outcome)
                .errorMessage(error == null || error.length() <= 1000 ? error : error.substring(0, 1000))
                .build());
    }
}

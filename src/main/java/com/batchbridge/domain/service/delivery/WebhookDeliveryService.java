package com.batchbridge.domain.service.delivery;

import com.batchbridge.config.DeliveryProperties;
import com.batchbridge.config.WebhookProperties;
import com.batchbridge.infrastructure.http.WebhookClient;
import com.batchbridge.infrastructure.http.WebhookResponse;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity.DeliveryStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Webhook delivery lifecycle.
 *
 * Claims are committed before any HTTP call is made, and the attempt result
 * is written in a second transaction, so no row lock is ever held across
 * network I/O. The endpoint is the one captured at enqueue time; the signing
 * secret is read from current configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeliveryService {

    private final WebhookDeliveryRecorder recorder;
    private final WebhookClient webhookClient;
    private final WebhookProperties webhookProperties;
    private final DeliveryProperties deliveryProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public List<WebhookDeliveryEntity> claimDue(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return recorder.claimDue(clock.instant(), limit);
    }

    public DeliveryStatus attempt(WebhookDeliveryEntity delivery) {
        UUID deliveryId = delivery.getDeliveryId();
        Optional<WebhookProperties.Subscriber> subscriber = webhookProperties.findSubscriber(delivery.getSubscriber());

        if (subscriber.isEmpty()) {
            log.warn("Delivery {} targets unknown subscriber {}, marking FAILED", deliveryId, delivery.getSubscriber());
            recorder.markUndeliverable(deliveryId, "Subscriber not configured: " + delivery.getSubscriber(), clock.instant());
            count("failed");
            return DeliveryStatus.FAILED;
        }

        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        WebhookResponse response = webhookClient.post(delivery.getTargetEndpoint(), deliveryId,
                delivery.getEventType(), delivery.getPayload(), subscriber.get().getSecret());
        sample.stop(Timer.builder("webhook.attempt.latency")
                .tag("subscriber", delivery.getSubscriber())
                .tag("success", String.valueOf(response.isSuccess()))
                .register(meterRegistry));

        DeliveryStatus status = recorder.recordAttempt(deliveryId, response, startedAt, clock.instant());
        count(status.name().toLowerCase());

        if (response.isSuccess()) {
            log.info("Delivered {} ({}) to {}", deliveryId, delivery.getEventType(), delivery.getSubscriber());
        }
        return status;
    }

    public int recoverStale() {
        Duration staleAfter = deliveryProperties.getStaleAfter();
        int recovered = recorder.recoverStale(clock.instant(), staleAfter, deliveryProperties.getBatchSize());
        if (recovered > 0) {
            Counter.builder("webhook.deliveries.recovered")
                    .register(meterRegistry)
                    .increment(recovered);
        }
        return recovered;
    }

    /**
     * Operator replay of an ABANDONED or FAILED delivery.
     *
     * @throws com.batchbridge.domain.exception.ResourceNotFoundException if no such delivery
     * @throws IllegalStateException if the delivery is in any other status
     */
    public WebhookDeliveryEntity replay(UUID deliveryId) {
        WebhookDeliveryEntity delivery = recorder.replay(deliveryId, clock.instant());
        log.info("Delivery {} replayed by operator (replay #{})", deliveryId, delivery.getReplayCount());
        count("replayed");
        return delivery;
    }

    private void count(String result) {
        Counter.builder("webhook.deliveries")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}

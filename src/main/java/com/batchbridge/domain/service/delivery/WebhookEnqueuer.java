package com.batchbridge.domain.service.delivery;

import com.batchbridge.config.WebhookProperties;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
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
 * Creates PENDING webhook deliveries for a domain change.
 *
 * Must run inside the transaction that writes the change (transactional
 * outbox): the deliveries exist if and only if the change committed. The
 * (event ref, subscriber) unique constraint makes re-enqueueing the same
 * change a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEnqueuer {

    private final WebhookDeliveryRepository deliveryRepository;
    private final WebhookProperties webhookProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Transactional(propagation = Propagation.MANDATORY)
    public int enqueue(NotificationType type, String eventRef, Map<String, Object> data) {
        List<WebhookProperties.Subscriber> subscribers = webhookProperties.getSubscribers().stream()
                .filter(s -> s.isSubscribedTo(type.wireName()))
                .toList();

        if (subscribers.isEmpty()) {
            return 0;
        }

        Instant now = clock.instant();
        String body = toBody(type, eventRef, now, data);

        int created = 0;
        for (WebhookProperties.Subscriber subscriber : subscribers) {
            created += deliveryRepository.insertIfAbsent(
                    UUID.randomUUID(), eventRef, type.wireName(), subscriber.getName(), subscriber.getUrl(), body, now);
        }

        if (created > 0) {
            log.debug("Enqueued {} deliveries for {}", created, eventRef);
            Counter.builder("webhook.deliveries.enqueued")
                    .tag("type", type.wireName())
                    .register(meterRegistry)
                    .increment(created);
        }
        return created;
    }

    private String toBody(NotificationType type, String eventRef, Instant occurredAt, Map<String, Object> data) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("event_type", type.wireName());
        envelope.put("event_ref", eventRef);
        envelope.put("occurred_at", occurredAt.toString());
        envelope.put("data", data);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize webhook payload for " + eventRef, e);
        }
    }
}

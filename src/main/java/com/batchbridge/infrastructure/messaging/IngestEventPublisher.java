package com.batchbridge.infrastructure.messaging;

import com.batchbridge.domain.model.IngestEvent;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes ingest events and waits for the broker acknowledgment.
 *
 * The send is synchronous with a bounded timeout so callers can roll back
 * their own writes when publication fails. Events are keyed by checksum, so
 * all announcements of one file land on the same partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestEventPublisher {

    private final KafkaTemplate<String, IngestEvent> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.file-ingested}")
    private String fileIngestedTopic;

    @Value("${app.kafka.publish-timeout-ms:10000}")
    private long publishTimeoutMs;

    @Retry(name = "ingestPublish")
    public void publish(IngestEvent event) {
        try {
            SendResult<String, IngestEvent> result = kafkaTemplate
                    .send(fileIngestedTopic, event.getChecksum(), event)
                    .get(publishTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("Published ingest event {} for {} (partition={}, offset={})",
                    event.getEventId(), event.getFileReference(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());

            Counter.builder("ingest.events.published")
                    .tag("type", event.getPayloadType().name())
                    .register(meterRegistry)
                    .increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestPublishException("Interrupted publishing event " + event.getEventId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IngestPublishException("Failed to publish event " + event.getEventId(), e);
        }
    }
}

package com.batchbridge.infrastructure.messaging;

import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.service.ingestion.IngestionWorker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for ingest events.
 *
 * Architecture:
 * - Manual offset management: the offset is committed only after the job
 *   outcome has been written, so a crash before that means redelivery and a
 *   fresh job row, never silent loss
 * - Parse and validation failures are recorded on the job and acknowledged
 * - Infrastructure failures propagate; the container error handler seeks back
 *   and redelivers with backoff
 *
 * Cross-partition ordering is not assumed anywhere downstream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestEventConsumer {

    private final IngestionWorker ingestionWorker;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            topics = "${app.kafka.topics.file-ingested}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "ingestListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, IngestEvent> record, Acknowledgment acknowledgment) {
        IngestEvent event = record.value();

        if (event == null || event.getFileReference() == null) {
            log.warn("Skipping ingest record without a file reference: partition={}, offset={}",
                    record.partition(), record.offset());
            count("skipped");
            acknowledgment.acknowledge();
            return;
        }

        log.debug("Consumed ingest event: partition={}, offset={}, eventId={}",
                record.partition(), record.offset(), event.getEventId());

        try {
            ingestionWorker.process(event, record.partition(), record.offset());

            // Commit offset only after the job outcome is durable
            acknowledgment.acknowledge();
            count("processed");

        } catch (RuntimeException e) {
            log.error("Ingest event {} not acknowledged, will be redelivered: {}",
                    event.getEventId(), e.getMessage());
            count("redeliver");
            throw e;
        }
    }

    private void count(String result) {
        Counter.builder("kafka.ingest.events.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}

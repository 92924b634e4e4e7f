package com.batchbridge.infrastructure.messaging;

import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.service.ingestion.IngestionWorker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestEventConsumerTest {

    @Mock private IngestionWorker ingestionWorker;
    @Mock private Acknowledgment acknowledgment;

    private MeterRegistry meterRegistry;
    private IngestEventConsumer consumer;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        consumer = new IngestEventConsumer(ingestionWorker, meterRegistry);
    }

    @Test
    void consume_acknowledgesAfterProcessing() {
        IngestEvent event = event();

        consumer.consume(new ConsumerRecord<>("batch.file-ingested", 1, 17L, event.getChecksum(), event), acknowledgment);

        InOrder order = inOrder(ingestionWorker, acknowledgment);
        order.verify(ingestionWorker).process(event, 1, 17L);
        order.verify(acknowledgment).acknowledge();
    }

    @Test
    void consume_infrastructureFailureIsNotAcknowledged() {
        IngestEvent event = event();
        when(ingestionWorker.process(eq(event), anyInt(), anyLong())).thenThrow(new QueryTimeoutException("timeout"));

        assertThrows(QueryTimeoutException.class, () -> consumer.consume(
                new ConsumerRecord<>("batch.file-ingested", 0, 3L, event.getChecksum(), event), acknowledgment));

        verify(acknowledgment, never()).acknowledge();
        assertEquals(1.0, meterRegistry.counter("kafka.ingest.events.consumed", "result", "redeliver").count());
    }

    @Test
    void consume_eventWithoutReferenceIsSkipped() {
        IngestEvent event = IngestEvent.builder().eventId(UUID.randomUUID()).build();

        consumer.consume(new ConsumerRecord<>("batch.file-ingested", 0, 4L, null, event), acknowledgment);

        verify(acknowledgment).acknowledge();
        verifyNoInteractions(ingestionWorker);
    }

    private static IngestEvent event() {
        return IngestEvent.builder()
                .eventId(UUID.randomUUID())
                .checksum("ab12")
                .fileReference("raw/ab/ab12")
                .sourceFilename("disputes.csv")
                .payloadType(PayloadType.DISPUTE)
                .publishedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .build();
    }
}

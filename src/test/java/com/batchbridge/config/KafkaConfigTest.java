package com.batchbridge.config;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.ListenerExecutionFailedException;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.serializer.DelegatingByTypeSerializer;
import org.springframework.util.backoff.BackOffExecution;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaConfigTest {

    @Mock private ConsumerRecordRecoverer recoverer;
    @Mock private Consumer<Object, Object> consumer;
    @Mock private MessageListenerContainer container;

    @Test
    void redeliveryBackOff_stopsOnceBudgetIsSpent() {
        BackOffExecution execution = KafkaConfig.redeliveryBackOff(1000, 60000, 600000).start();

        int redeliveries = 0;
        long elapsed = 0;
        long interval;
        while ((interval = execution.nextBackOff()) != BackOffExecution.STOP && redeliveries < 1000) {
            assertTrue(interval <= 60000);
            elapsed += interval;
            redeliveries++;
        }

        assertTrue(redeliveries > 5 && redeliveries < 20, "redeliveries: " + redeliveries);
        assertTrue(elapsed >= 600000 && elapsed < 600000 + 60000, "elapsed: " + elapsed);
    }

    @Test
    void ingestErrorHandler_deterministicFailureGoesStraightToDeadLetter() {
        DefaultErrorHandler errorHandler = KafkaConfig.ingestErrorHandler(recoverer, 1000, 60000, 600000);
        ConsumerRecord<Object, Object> record = new ConsumerRecord<>("batch.file-ingested", 0, 42L, "key", "value");
        ListenerExecutionFailedException failure =
                new ListenerExecutionFailedException("listener failed", new ArithmeticException("Underflow"));

        errorHandler.handleRemaining(failure, List.<ConsumerRecord<?, ?>>of(record), consumer, container);

        verify(recoverer).accept(eq(record), any(Exception.class));
        verify(consumer, never()).seek(any(), anyLong());
    }

    @Test
    void deadLetterValueSerializer_forwardsUndeserializableBytesUntouched() {
        DelegatingByTypeSerializer serializer = KafkaConfig.deadLetterValueSerializer();
        byte[] original = "not-json{".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(original, serializer.serialize("batch.file-ingested.dlq", original));
    }

    @Test
    void deadLetterValueSerializer_writesOtherValuesAsJson() {
        DelegatingByTypeSerializer serializer = KafkaConfig.deadLetterValueSerializer();

        byte[] written = serializer.serialize("batch.file-ingested.dlq", Map.of("checksum", "ab12"));

        assertEquals("{\"checksum\":\"ab12\"}", new String(written, StandardCharsets.UTF_8));
    }
}

package com.batchbridge.domain.service.delivery;

import com.batchbridge.config.WebhookProperties;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookEnqueuerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private WebhookDeliveryRepository deliveryRepository;

    private ObjectMapper objectMapper;
    private MeterRegistry meterRegistry;
    private WebhookEnqueuer enqueuer;

    @BeforeEach
    void setUp() {
        WebhookProperties properties = new WebhookProperties();
        properties.setSubscribers(List.of(
                subscriber("ledger", "https://ledger.example.com/hooks", Set.of("*")),
                subscriber("risk", "https://risk.example.com/in", Set.of("dispute.upserted"))));

        objectMapper = new ObjectMapper().findAndRegisterModules();
        meterRegistry = new SimpleMeterRegistry();
        enqueuer = new WebhookEnqueuer(deliveryRepository, properties, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);
    }

    @Test
    void enqueue_onlyMatchingSubscribersGetDeliveries() throws Exception {
        when(deliveryRepository.insertIfAbsent(any(), anyString(), anyString(), anyString(), anyString(),
                anyString(), any())).thenReturn(1);

        int created = enqueuer.enqueue(NotificationType.SETTLEMENT_UPSERTED, "settlement.upserted:m-1/2024-03-01/b-1:h1",
                Map.of("merchant_id", "m-1"));

        assertEquals(1, created);
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(deliveryRepository).insertIfAbsent(any(), eq("settlement.upserted:m-1/2024-03-01/b-1:h1"),
                eq("settlement.upserted"), eq("ledger"), eq("https://ledger.example.com/hooks"), body.capture(), eq(NOW));

        JsonNode envelope = objectMapper.readTree(body.getValue());
        assertEquals("settlement.upserted", envelope.get("event_type").asText());
        assertEquals("m-1", envelope.get("data").get("merchant_id").asText());
        assertEquals(NOW.toString(), envelope.get("occurred_at").asText());
    }

    @Test
    void enqueue_repeatOfSameChangeCreatesNothing() {
        when(deliveryRepository.insertIfAbsent(any(), anyString(), anyString(), anyString(), anyString(),
                anyString(), any())).thenReturn(0);

        int created = enqueuer.enqueue(NotificationType.DISPUTE_UPSERTED, "dispute.upserted:m-1/c-1:h1", Map.of());

        assertEquals(0, created);
        verify(deliveryRepository, times(2)).insertIfAbsent(any(), anyString(), anyString(), anyString(),
                anyString(), anyString(), any());
        assertNull(meterRegistry.find("webhook.deliveries.enqueued").counter());
    }

    private static WebhookProperties.Subscriber subscriber(String name, String url, Set<String> types) {
        WebhookProperties.Subscriber subscriber = new WebhookProperties.Subscriber();
        subscriber.setName(name);
        subscriber.setUrl(url);
        subscriber.setEventTypes(types);
        return subscriber;
    }
}

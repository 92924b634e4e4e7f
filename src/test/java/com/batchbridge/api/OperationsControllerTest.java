package com.batchbridge.api;

import com.batchbridge.domain.exception.ResourceNotFoundException;
import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.service.delivery.WebhookDeliveryService;
import com.batchbridge.domain.service.ingestion.IngestReplayService;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.IngestJobErrorEntity;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import com.batchbridge.infrastructure.persistence.repository.IngestJobErrorRepository;
import com.batchbridge.infrastructure.persistence.repository.IngestJobRepository;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryAttemptRepository;
import com.batchbridge.infrastructure.persistence.repository.WebhookDeliveryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OperationsControllerTest {

    @Mock private IngestJobRepository jobRepository;
    @Mock private IngestJobErrorRepository jobErrorRepository;
    @Mock private RawFileRepository rawFileRepository;
    @Mock private WebhookDeliveryRepository deliveryRepository;
    @Mock private WebhookDeliveryAttemptRepository attemptRepository;
    @Mock private IngestReplayService replayService;
    @Mock private WebhookDeliveryService deliveryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        OperationsController controller = new OperationsController(jobRepository, jobErrorRepository,
                rawFileRepository, deliveryRepository, attemptRepository, replayService, deliveryService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new OpsExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new ObjectMapper().findAndRegisterModules()))
                .build();
    }

    @Test
    void getJob_includesRejectedRows() throws Exception {
        UUID jobId = UUID.randomUUID();
        IngestJobEntity job = IngestJobEntity.builder()
                .jobId(jobId)
                .eventId(UUID.randomUUID())
                .fileReference("raw/ab/abc")
                .payloadType(PayloadType.SETTLEMENT)
                .startedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .outcome(IngestJobEntity.JobOutcome.PARTIAL)
                .errorCount(1)
                .build();
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job));
        when(jobErrorRepository.findByJobIdOrderByLineNumberAsc(jobId)).thenReturn(List.of(
                IngestJobErrorEntity.builder().id(UUID.randomUUID()).jobId(jobId).lineNumber(4)
                        .businessKey("m-1/2024-03-01/b-4").message("net_amount mismatch").build()));

        mockMvc.perform(get("/api/v1/ops/jobs/{jobId}", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job.outcome").value("PARTIAL"))
                .andExpect(jsonPath("$.errors[0].lineNumber").value(4));
    }

    @Test
    void getJob_unknownIs404() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/ops/jobs/{jobId}", jobId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void replayJob_acceptedWithOverride() throws Exception {
        UUID jobId = UUID.randomUUID();
        IngestEvent event = IngestEvent.builder()
                .eventId(UUID.randomUUID())
                .fileReference("raw/ab/abc")
                .payloadType(PayloadType.DISPUTE)
                .replayOfJobId(jobId)
                .build();
        when(replayService.replayJob(jobId, PayloadType.DISPUTE)).thenReturn(event);

        mockMvc.perform(post("/api/v1/ops/jobs/{jobId}/replay", jobId).param("payloadType", "DISPUTE"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.replayOfJobId").value(jobId.toString()));
    }

    @Test
    void replayDelivery_notReplayableIs409() throws Exception {
        UUID deliveryId = UUID.randomUUID();
        when(deliveryService.replay(deliveryId))
                .thenThrow(new IllegalStateException("Delivery " + deliveryId + " is DELIVERED and cannot be replayed"));

        mockMvc.perform(post("/api/v1/ops/deliveries/{deliveryId}/replay", deliveryId))
                .andExpect(status().isConflict());
    }

    @Test
    void replayDelivery_unknownIs404() throws Exception {
        UUID deliveryId = UUID.randomUUID();
        when(deliveryService.replay(deliveryId)).thenThrow(new ResourceNotFoundException("Webhook delivery", deliveryId));

        mockMvc.perform(post("/api/v1/ops/deliveries/{deliveryId}/replay", deliveryId))
                .andExpect(status().isNotFound());
    }

    @Test
    void getDelivery_includesAttempts() throws Exception {
        UUID deliveryId = UUID.randomUUID();
        WebhookDeliveryEntity delivery = WebhookDeliveryEntity.builder()
                .deliveryId(deliveryId)
                .subscriber("ledger")
                .status(WebhookDeliveryEntity.DeliveryStatus.ABANDONED)
                .attemptCount(8)
                .build();
        when(deliveryRepository.findById(deliveryId)).thenReturn(Optional.of(delivery));
        when(attemptRepository.findByDeliveryIdOrderByAttemptNumberAsc(deliveryId)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/ops/deliveries/{deliveryId}", deliveryId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivery.status").value("ABANDONED"))
                .andExpect(jsonPath("$.delivery.attemptCount").value(8))
                .andExpect(jsonPath("$.attempts").isEmpty());
    }

    @Test
    void listJobs_invalidOutcomeIs400() throws Exception {
        mockMvc.perform(get("/api/v1/ops/jobs").param("outcome", "MAYBE"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(jobRepository);
    }
}

package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.ConfigSnapshotRecord;
import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.NotificationType;
import com.batchbridge.domain.model.ParseResult;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.RecordRejection;
import com.batchbridge.domain.model.UpsertOutcome;
import com.batchbridge.domain.service.delivery.WebhookEnqueuer;
import com.batchbridge.domain.service.intake.ChecksumCalculator;
import com.batchbridge.infrastructure.persistence.repository.ConfigSnapshotRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Configuration snapshots are stored opaquely: only merchant_id and
 * captured_at are read, the document itself is kept as-is. Each snapshot is
 * an immutable row; a repeated (merchant_id, captured_at) is ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigSnapshotPayloadHandler implements PayloadHandler<ConfigSnapshotRecord> {

    private final ConfigSnapshotRepository configSnapshotRepository;
    private final WebhookEnqueuer webhookEnqueuer;
    private final ChecksumCalculator checksumCalculator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public PayloadType type() {
        return PayloadType.CONFIG_SNAPSHOT;
    }

    @Override
    public ParseResult<ConfigSnapshotRecord> parse(byte[] content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(new String(content, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PayloadParseException("Config snapshot is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || !(root.isObject() || root.isArray())) {
            throw new PayloadParseException("Config snapshot must be a JSON object or array");
        }

        JsonNode snapshots = root;
        if (root.isObject()) {
            JsonNode nested = root.get("snapshots");
            snapshots = nested != null && nested.isArray() ? nested : objectMapper.createArrayNode().add(root);
        }

        List<ConfigSnapshotRecord> candidates = new ArrayList<>();
        List<RecordRejection> rejections = new ArrayList<>();
        int line = 0;
        for (JsonNode snapshot : snapshots) {
            line++;
            String merchantId = text(snapshot, "merchant_id");
            String capturedAtText = text(snapshot, "captured_at");
            String key = merchantId + "@" + capturedAtText;

            if (!snapshot.isObject()) {
                rejections.add(new RecordRejection(line, null, "snapshot is not an object"));
                continue;
            }
            if (merchantId == null) {
                rejections.add(new RecordRejection(line, key, "merchant_id is required"));
                continue;
            }
            if (capturedAtText == null) {
                rejections.add(new RecordRejection(line, key, "captured_at is required"));
                continue;
            }
            Instant capturedAt;
            try {
                capturedAt = Instant.parse(capturedAtText);
            } catch (DateTimeParseException e) {
                rejections.add(new RecordRejection(line, key, "captured_at is not an ISO-8601 instant: " + capturedAtText));
                continue;
            }

            String payload = snapshot.toString();
            candidates.add(ConfigSnapshotRecord.builder()
                    .lineNumber(line)
                    .merchantId(merchantId)
                    .capturedAt(capturedAt)
                    .payload(payload)
                    .contentHash(checksumCalculator.sha256Hex(payload))
                    .build());
        }
        return new ParseResult<>(candidates, rejections);
    }

    @Override
    @Transactional
    public UpsertOutcome apply(ConfigSnapshotRecord record, IngestContext context) {
        int inserted = configSnapshotRepository.insertIfAbsent(
                UUID.randomUUID(),
                record.getMerchantId(),
                record.getCapturedAt(),
                record.getPayload(),
                record.getContentHash(),
                context.getFileReference(),
                clock.instant());

        if (inserted == 0) {
            log.debug("Config snapshot {} already stored", record.getBusinessKey());
            return UpsertOutcome.UNCHANGED;
        }

        // Snapshot content is not forwarded, only its identity
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("merchant_id", record.getMerchantId());
        data.put("captured_at", record.getCapturedAt().toString());
        data.put("content_hash", record.getContentHash());
        data.put("ingest_job_id", context.getJobId().toString());

        webhookEnqueuer.enqueue(NotificationType.CONFIG_SNAPSHOT_CAPTURED,
                NotificationType.CONFIG_SNAPSHOT_CAPTURED.wireName() + ":" + record.getBusinessKey(), data);
        return UpsertOutcome.APPLIED;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}

package com.batchbridge.domain.service.intake;

import com.batchbridge.domain.model.IngestEvent;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.infrastructure.messaging.IngestEventPublisher;
import com.batchbridge.infrastructure.persistence.entity.RawFileEntity;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import com.batchbridge.infrastructure.storage.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Stores, records and announces a new raw file.
 *
 * Flow:
 * 1. Upload bytes under the checksum-derived key (repeatable)
 * 2. Conditional insert of the RawFile row (ON CONFLICT DO NOTHING), committed
 *    with a publish claim held by this caller
 * 3. Publish the ingest event and wait for the broker ack
 * 4. Stamp published_at on the row
 *
 * No transaction spans the broker call, so a concurrent watcher inserting the
 * same checksum never waits on it. If step 3 fails the claim is released and
 * the row stays pending; {@link #republishPending(int)} publishes it on the
 * next poll. A row is only ever published by the holder of its claim.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawFileRegistrar {

    private static final String CONTENT_TYPE = "application/octet-stream";

    private final RawFileRepository rawFileRepository;
    private final ObjectStore objectStore;
    private final IngestEventPublisher ingestEventPublisher;
    private final Clock clock;

    /** Longer than a publish can take including its retries. */
    @Value("${app.intake.publish-claim-ttl:PT2M}")
    private Duration publishClaimTtl;

    public RegistrationResult register(String checksum, String sourceFilename, PayloadType payloadType, byte[] content) {
        String storageKey = ObjectStore.contentAddressedKey(checksum);
        objectStore.put(storageKey, content, CONTENT_TYPE);

        UUID rawFileId = UUID.randomUUID();
        Instant now = clock.instant();
        int inserted = rawFileRepository.insertIfAbsent(rawFileId, checksum, storageKey, sourceFilename,
                payloadType.name(), content.length, now, now.plus(publishClaimTtl));

        if (inserted == 0) {
            log.info("Checksum {} registered concurrently by another watcher, skipping {}", checksum, sourceFilename);
            return RegistrationResult.DUPLICATE;
        }

        IngestEvent event = IngestEvent.builder()
                .eventId(UUID.randomUUID())
                .checksum(checksum)
                .fileReference(storageKey)
                .sourceFilename(sourceFilename)
                .payloadType(payloadType)
                .publishedAt(now)
                .build();

        publishClaimed(rawFileId, event);

        log.info("Registered {} as {} (checksum={}, type={})", sourceFilename, storageKey, checksum, payloadType);
        return RegistrationResult.REGISTERED;
    }

    /**
     * Publishes rows that were recorded but never announced, oldest first.
     *
     * @return number of events published
     */
    public int republishPending(int limit) {
        Instant now = clock.instant();
        List<RawFileEntity> pending = rawFileRepository.findPendingPublication(now, PageRequest.of(0, limit));

        int published = 0;
        for (RawFileEntity rawFile : pending) {
            if (rawFileRepository.claimPublication(rawFile.getId(), now, now.plus(publishClaimTtl)) == 0) {
                continue;
            }

            IngestEvent event = IngestEvent.builder()
                    .eventId(UUID.randomUUID())
                    .checksum(rawFile.getChecksum())
                    .fileReference(rawFile.getStorageKey())
                    .sourceFilename(rawFile.getSourceFilename())
                    .payloadType(rawFile.getPayloadType())
                    .publishedAt(rawFile.getReceivedAt())
                    .build();

            try {
                publishClaimed(rawFile.getId(), event);
                published++;
                log.info("Published pending ingest event for {} (checksum={})",
                        rawFile.getStorageKey(), rawFile.getChecksum());
            } catch (RuntimeException e) {
                log.error("Pending publication of {} failed, will retry on next poll: {}",
                        rawFile.getStorageKey(), e.getMessage(), e);
            }
        }
        return published;
    }

    private void publishClaimed(UUID rawFileId, IngestEvent event) {
        try {
            ingestEventPublisher.publish(event);
        } catch (RuntimeException e) {
            try {
                rawFileRepository.releasePublication(rawFileId, clock.instant());
            } catch (RuntimeException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }

        // A failure here leaves the row pending; the claim lapses and the event goes out again
        rawFileRepository.markPublished(rawFileId, clock.instant());
    }
}

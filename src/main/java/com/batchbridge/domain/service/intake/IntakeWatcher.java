package com.batchbridge.domain.service.intake;

import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.infrastructure.dropzone.DropFile;
import com.batchbridge.infrastructure.dropzone.DropLocation;
import com.batchbridge.infrastructure.persistence.repository.RawFileRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Polls the drop location and turns new files into ingest events.
 *
 * Each cycle first re-announces raw files whose ingest event never reached the
 * broker, then handles the inbox.
 *
 * Per file:
 * 1. Read bytes and compute the SHA-256 checksum
 * 2. Known checksum: archive the source file, publish nothing here
 * 3. New checksum: store, record and publish (RawFileRegistrar)
 * 4. Archive the source file only after step 3 committed
 *
 * A crash anywhere before step 4 leaves the file in the inbox and the next
 * poll repeats the sequence; the checksum lookup and the conditional insert
 * make that repetition harmless. The existence check is only a shortcut; the
 * unique constraint behind the insert is what prevents duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntakeWatcher {

    private final DropLocation dropLocation;
    private final RawFileRepository rawFileRepository;
    private final RawFileRegistrar rawFileRegistrar;
    private final ChecksumCalculator checksumCalculator;
    private final PayloadTypeClassifier payloadTypeClassifier;
    private final MeterRegistry meterRegistry;

    @Value("${app.intake.max-files-per-cycle:100}")
    private int maxFilesPerCycle;

    @Scheduled(fixedDelayString = "${app.intake.poll-interval-ms:30000}",
               initialDelayString = "${app.intake.initial-delay-ms:5000}")
    public PollCycleSummary pollCycle() {
        int republished = republishPending();

        List<DropFile> files;
        try {
            files = dropLocation.list(maxFilesPerCycle);
        } catch (RuntimeException e) {
            log.error("Failed to list drop location: {}", e.getMessage(), e);
            return new PollCycleSummary(0, 0, 0, 0, republished);
        }

        if (files.isEmpty()) {
            return new PollCycleSummary(0, 0, 0, 0, republished);
        }

        log.debug("Intake poll found {} candidate files", files.size());

        int ingested = 0;
        int duplicates = 0;
        int failed = 0;

        for (DropFile file : files) {
            try {
                RegistrationResult result = ingestFile(file);
                if (result == RegistrationResult.REGISTERED) {
                    ingested++;
                } else {
                    duplicates++;
                }
            } catch (RuntimeException e) {
                // Leave the file in place; next poll retries it
                failed++;
                count("failed");
                log.error("Intake of {} failed, will retry on next poll: {}", file.getName(), e.getMessage(), e);
            }
        }

        log.info("Intake cycle complete: listed={}, ingested={}, duplicates={}, failed={}, republished={}",
                files.size(), ingested, duplicates, failed, republished);
        return new PollCycleSummary(files.size(), ingested, duplicates, failed, republished);
    }

    private int republishPending() {
        try {
            int republished = rawFileRegistrar.republishPending(maxFilesPerCycle);
            if (republished > 0) {
                count("republished", republished);
            }
            return republished;
        } catch (RuntimeException e) {
            log.error("Failed to re-publish pending raw files: {}", e.getMessage(), e);
            return 0;
        }
    }

    public RegistrationResult ingestFile(DropFile file) {
        byte[] content = dropLocation.read(file);
        String checksum = checksumCalculator.sha256Hex(content);

        RegistrationResult result;
        if (rawFileRepository.existsByChecksum(checksum)) {
            log.info("Duplicate file {} (checksum={}), archiving without publishing", file.getName(), checksum);
            result = RegistrationResult.DUPLICATE;
        } else {
            PayloadType payloadType = payloadTypeClassifier.classify(file.getName(), content);
            result = rawFileRegistrar.register(checksum, file.getName(), payloadType, content);
        }

        dropLocation.markProcessed(file);
        count(result == RegistrationResult.REGISTERED ? "registered" : "duplicate");
        return result;
    }

    private void count(String result) {
        count(result, 1);
    }

    private void count(String result, int amount) {
        Counter.builder("intake.files")
                .tag("result", result)
                .register(meterRegistry)
                .increment(amount);
    }
}

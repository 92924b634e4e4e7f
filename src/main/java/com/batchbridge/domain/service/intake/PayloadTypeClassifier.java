package com.batchbridge.domain.service.intake;

import com.batchbridge.domain.model.PayloadType;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Infers the payload type of a dropped file.
 *
 * Filename convention wins; content sniffing is the fallback. Files that match
 * neither are classified UNKNOWN and still flow through the pipeline so the
 * failure is recorded on a job and can be replayed once a handler exists.
 */
@Component
public class PayloadTypeClassifier {

    private static final int SNIFF_BYTES = 4096;

    public PayloadType classify(String filename, byte[] content) {
        PayloadType byName = byFilename(filename);
        if (byName != PayloadType.UNKNOWN) {
            return byName;
        }
        return byContent(content);
    }

    PayloadType byFilename(String filename) {
        String name = filename.toLowerCase(Locale.ROOT);
        if (name.startsWith("settlement") || name.startsWith("stl_")) {
            return PayloadType.SETTLEMENT;
        }
        if (name.startsWith("dispute") || name.startsWith("chargeback")) {
            return PayloadType.DISPUTE;
        }
        if (name.startsWith("config") || name.startsWith("cfg_")) {
            return PayloadType.CONFIG_SNAPSHOT;
        }
        return PayloadType.UNKNOWN;
    }

    PayloadType byContent(byte[] content) {
        int length = Math.min(content.length, SNIFF_BYTES);
        String head = new String(content, 0, length, StandardCharsets.UTF_8).stripLeading();
        if (head.isEmpty()) {
            return PayloadType.UNKNOWN;
        }
        String lower = head.toLowerCase(Locale.ROOT);
        if (head.charAt(0) == '{' || head.charAt(0) == '[') {
            if (lower.contains("\"captured_at\"")) {
                return PayloadType.CONFIG_SNAPSHOT;
            }
            if (lower.contains("\"batch_id\"")) {
                return PayloadType.SETTLEMENT;
            }
            if (lower.contains("\"case_reference\"")) {
                return PayloadType.DISPUTE;
            }
            return PayloadType.UNKNOWN;
        }
        int newline = lower.indexOf('\n');
        String header = newline < 0 ? lower : lower.substring(0, newline);
        if (header.contains("batch_id")) {
            return PayloadType.SETTLEMENT;
        }
        if (header.contains("case_reference")) {
            return PayloadType.DISPUTE;
        }
        return PayloadType.UNKNOWN;
    }
}

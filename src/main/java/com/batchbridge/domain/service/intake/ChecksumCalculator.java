package com.batchbridge.domain.service.intake;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashing, used for raw file dedup and record content hashes.
 */
@Component
public class ChecksumCalculator {

    public String sha256Hex(byte[] content) {
        return HexFormat.of().formatHex(digest().digest(content));
    }

    public String sha256Hex(String content) {
        return sha256Hex(content.getBytes(StandardCharsets.UTF_8));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

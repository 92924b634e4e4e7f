package com.batchbridge.domain.service.intake;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumCalculatorTest {

    private final ChecksumCalculator calculator = new ChecksumCalculator();

    @Test
    void sha256Hex_knownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                calculator.sha256Hex("abc"));
    }

    @Test
    void sha256Hex_sameBytesSameChecksum() {
        byte[] content = "merchant_id,batch_id\nm-1,b-1\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(calculator.sha256Hex(content), calculator.sha256Hex(content.clone()));
        assertEquals(64, calculator.sha256Hex(content).length());
    }

    @Test
    void sha256Hex_singleByteChangesChecksum() {
        assertNotEquals(calculator.sha256Hex("batch-1"), calculator.sha256Hex("batch-2"));
    }
}

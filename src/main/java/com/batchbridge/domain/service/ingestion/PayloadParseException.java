package com.batchbridge.domain.service.ingestion;

/**
 * The payload as a whole cannot be read. Fails the job; the file stays replayable.
 */
public class PayloadParseException extends RuntimeException {

    public PayloadParseException(String message) {
        super(message);
    }

    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

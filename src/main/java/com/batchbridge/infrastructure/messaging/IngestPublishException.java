package com.batchbridge.infrastructure.messaging;

public class IngestPublishException extends RuntimeException {

    public IngestPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}

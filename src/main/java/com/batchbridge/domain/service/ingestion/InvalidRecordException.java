package com.batchbridge.domain.service.ingestion;

/**
 * A single candidate failed validation. Recorded as a rejection, never
 * propagated past the handler.
 */
class InvalidRecordException extends Exception {

    InvalidRecordException(String message) {
        super(message);
    }
}

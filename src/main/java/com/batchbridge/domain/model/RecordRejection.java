package com.batchbridge.domain.model;

import lombok.Value;

/**
 * A candidate that failed validation or could not be written.
 */
@Value
public class RecordRejection {
    int lineNumber;
    String businessKey;
    String message;
}

package com.batchbridge.domain.service.ingestion;

import lombok.Value;

import java.util.Map;

/**
 * One row of a tabular payload with lower-cased column names.
 */
@Value
public class SourceRow {
    int lineNumber;
    Map<String, String> fields;

    /** Set when the element could not be read as a row at all. */
    String error;
}

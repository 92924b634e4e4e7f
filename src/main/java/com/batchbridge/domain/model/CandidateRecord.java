package com.batchbridge.domain.model;

/**
 * A record parsed from a payload, not yet written.
 */
public interface CandidateRecord {

    /** 1-based position in the source file (data row or array element). */
    int getLineNumber();

    /** Natural key rendered for logs and error rows. */
    String getBusinessKey();

    /** SHA-256 over the record's business content. */
    String getContentHash();
}

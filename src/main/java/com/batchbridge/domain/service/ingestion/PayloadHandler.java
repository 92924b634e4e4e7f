package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.CandidateRecord;
import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.ParseResult;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.UpsertOutcome;

/**
 * Parse, key and write strategy for one payload type.
 *
 * @param <T> candidate record type
 */
public interface PayloadHandler<T extends CandidateRecord> {

    PayloadType type();

    /**
     * @throws PayloadParseException when the payload as a whole is unreadable
     */
    ParseResult<T> parse(byte[] content);

    /**
     * Idempotent write keyed by the record's business key, together with any
     * webhook deliveries the change triggers, in one transaction.
     */
    UpsertOutcome apply(T candidate, IngestContext context);
}

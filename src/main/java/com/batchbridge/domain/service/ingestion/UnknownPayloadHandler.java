package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.CandidateRecord;
import com.batchbridge.domain.model.IngestContext;
import com.batchbridge.domain.model.ParseResult;
import com.batchbridge.domain.model.PayloadType;
import com.batchbridge.domain.model.UpsertOutcome;
import org.springframework.stereotype.Component;

/**
 * Files the intake could not classify. Their jobs fail and stay replayable.
 */
@Component
public class UnknownPayloadHandler implements PayloadHandler<CandidateRecord> {

    @Override
    public PayloadType type() {
        return PayloadType.UNKNOWN;
    }

    @Override
    public ParseResult<CandidateRecord> parse(byte[] content) {
        throw new PayloadParseException("Unsupported payload type; no parser for this file");
    }

    @Override
    public UpsertOutcome apply(CandidateRecord candidate, IngestContext context) {
        throw new UnsupportedOperationException("Unknown payloads produce no candidates");
    }
}

package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.CandidateRecord;
import com.batchbridge.domain.model.ParseResult;
import com.batchbridge.domain.model.RecordRejection;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Shared parse loop for CSV/JSON payloads: a bad row becomes a rejection and
 * never aborts its siblings; a missing key column fails the whole payload.
 */
@Slf4j
abstract class AbstractTabularPayloadHandler<T extends CandidateRecord> implements PayloadHandler<T> {

    private final TabularPayloadReader reader;

    protected AbstractTabularPayloadHandler(TabularPayloadReader reader) {
        this.reader = reader;
    }

    /** Field holding the record array when the JSON root is an object. */
    protected abstract String collectionField();

    protected abstract Set<String> requiredColumns();

    protected abstract T toCandidate(int lineNumber, RowFields row) throws InvalidRecordException;

    protected abstract String businessKeyOf(RowFields row);

    @Override
    public ParseResult<T> parse(byte[] content) {
        SourceTable table = reader.read(content, collectionField());

        if (!table.getRows().isEmpty()) {
            Set<String> missing = requiredColumns().stream()
                    .filter(column -> !table.getColumns().contains(column))
                    .collect(Collectors.toCollection(TreeSet::new));
            if (!missing.isEmpty()) {
                throw new PayloadParseException(type() + " payload is missing columns " + missing);
            }
        }

        List<T> candidates = new ArrayList<>();
        List<RecordRejection> rejections = new ArrayList<>();

        for (SourceRow row : table.getRows()) {
            RowFields fields = new RowFields(row.getFields());
            if (row.getError() != null) {
                rejections.add(new RecordRejection(row.getLineNumber(), null, row.getError()));
                continue;
            }
            try {
                candidates.add(toCandidate(row.getLineNumber(), fields));
            } catch (InvalidRecordException e) {
                rejections.add(new RecordRejection(row.getLineNumber(), businessKeyOf(fields), e.getMessage()));
            } catch (RuntimeException e) {
                log.warn("Unexpected {} converting {} line {}: {}",
                        e.getClass().getSimpleName(), type(), row.getLineNumber(), e.getMessage());
                rejections.add(new RecordRejection(row.getLineNumber(), businessKeyOf(fields),
                        "Unprocessable record: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }
        return new ParseResult<>(candidates, rejections);
    }
}

package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.RecordRejection;
import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity.JobOutcome;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of one ingest attempt.
 */
@Value
public class JobSummary {
    JobOutcome outcome;
    int recordCount;
    int appliedCount;
    int unchangedCount;
    List<RecordRejection> rejections;
    String errorDetail;

    public static JobSummary failed(String errorDetail) {
        return new JobSummary(JobOutcome.FAILED, 0, 0, 0, List.of(), errorDetail);
    }

    /**
     * SUCCESS when nothing was rejected, PARTIAL when some candidates were
     * written next to rejected ones, FAILED when every candidate was rejected.
     */
    public static JobSummary of(int recordCount, int applied, int unchanged, List<RecordRejection> rejections) {
        if (rejections.isEmpty()) {
            return new JobSummary(JobOutcome.SUCCESS, recordCount, applied, unchanged, List.of(), null);
        }
        String detail = rejections.size() + " of " + recordCount + " records rejected; first at line "
                + rejections.get(0).getLineNumber() + ": " + rejections.get(0).getMessage();
        JobOutcome outcome = applied + unchanged > 0 ? JobOutcome.PARTIAL : JobOutcome.FAILED;
        return new JobSummary(outcome, recordCount, applied, unchanged, List.copyOf(rejections), detail);
    }

    public int getErrorCount() {
        return rejections.size();
    }
}

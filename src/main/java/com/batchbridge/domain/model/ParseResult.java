package com.batchbridge.domain.model;

import lombok.Value;

import java.util.List;

@Value
public class ParseResult<T extends CandidateRecord> {
    List<T> candidates;
    List<RecordRejection> rejections;

    public int size() {
        return candidates.size() + rejections.size();
    }
}

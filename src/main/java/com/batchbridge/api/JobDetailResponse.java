package com.batchbridge.api;

import com.batchbridge.infrastructure.persistence.entity.IngestJobEntity;
import com.batchbridge.infrastructure.persistence.entity.IngestJobErrorEntity;
import lombok.Value;

import java.util.List;

@Value
public class JobDetailResponse {
    IngestJobEntity job;
    List<IngestJobErrorEntity> errors;
}

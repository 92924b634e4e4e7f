package com.batchbridge.domain.service.ingestion;

import lombok.Value;

import java.util.List;
import java.util.Set;

@Value
public class SourceTable {
    Set<String> columns;
    List<SourceRow> rows;
}

package com.batchbridge.domain.service.intake;

import lombok.Value;

@Value
public class PollCycleSummary {
    int listed;
    int ingested;
    int duplicates;
    int failed;
    int republished;
}

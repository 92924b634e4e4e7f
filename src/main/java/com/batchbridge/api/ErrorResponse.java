package com.batchbridge.api;

import lombok.Value;

import java.time.Instant;

@Value
public class ErrorResponse {
    int status;
    String error;
    String message;
    Instant timestamp;
}

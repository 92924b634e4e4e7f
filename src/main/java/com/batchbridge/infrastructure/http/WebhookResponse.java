package com.batchbridge.infrastructure.http;

import lombok.Value;

/**
 * Outcome of one webhook POST. Failures are data here, not exceptions.
 */
@Value
public class WebhookResponse {
    boolean success;
    Integer statusCode;
    String error;

    public static WebhookResponse success(int statusCode) {
        return new WebhookResponse(true, statusCode, null);
    }

    public static WebhookResponse failure(Integer statusCode, String error) {
        return new WebhookResponse(false, statusCode, error);
    }
}

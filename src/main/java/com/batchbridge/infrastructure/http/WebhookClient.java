package com.batchbridge.infrastructure.http;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Posts webhook payloads to subscriber endpoints.
 *
 * The RestTemplate carries connect and read timeouts (see DeliveryConfig),
 * so a hung endpoint surfaces as a failed attempt. Anything but a 2xx response
 * is reported as a failure; the delivery state machine decides what happens next.
 */
@Slf4j
@Component
public class WebhookClient {

    static final String EVENT_HEADER = "X-Webhook-Event";
    static final String DELIVERY_HEADER = "X-Webhook-Delivery";
    static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final RestTemplate restTemplate;

    public WebhookClient(RestTemplate webhookRestTemplate) {
        this.restTemplate = webhookRestTemplate;
    }

    public WebhookResponse post(String url, UUID deliveryId, String eventType, String body, String secret) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(EVENT_HEADER, eventType);
        headers.set(DELIVERY_HEADER, deliveryId.toString());
        if (secret != null && !secret.isBlank()) {
            headers.set(SIGNATURE_HEADER, "sha256=" + sign(body, secret));
        }

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                return WebhookResponse.success(status);
            }
            return WebhookResponse.failure(status, "Non-success response: " + status);

        } catch (HttpStatusCodeException e) {
            log.debug("Webhook {} answered {}", deliveryId, e.getStatusCode());
            return WebhookResponse.failure(e.getStatusCode().value(), "HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.debug("Webhook {} I/O failure: {}", deliveryId, e.getMessage());
            return WebhookResponse.failure(null, "I/O error: " + e.getMessage());
        } catch (RestClientException e) {
            log.debug("Webhook {} client failure: {}", deliveryId, e.getMessage());
            return WebhookResponse.failure(null, "Client error: " + e.getMessage());
        }
    }

    static String sign(String body, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new WebhookDeliveryException("Cannot sign webhook payload", e);
        }
    }
}

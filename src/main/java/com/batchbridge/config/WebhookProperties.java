package com.batchbridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Webhook subscribers. Each subscriber receives the event types it lists.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.webhooks")
public class WebhookProperties {

    @Valid
    private List<Subscriber> subscribers = new ArrayList<>();

    public Optional<Subscriber> findSubscriber(String name) {
        return subscribers.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    @Data
    public static class Subscriber {

        @NotBlank
        private String name;

        @NotBlank
        private String url;

        private String secret;

        private Set<String> eventTypes = new HashSet<>();

        public boolean isSubscribedTo(String eventType) {
            return eventTypes.contains(eventType) || eventTypes.contains("*");
        }
    }
}

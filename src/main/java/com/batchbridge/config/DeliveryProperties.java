package com.batchbridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "app.delivery")
public class DeliveryProperties {

    @Min(1)
    private int maxAttempts = 8;

    @Min(1)
    private int batchSize = 50;

    @Min(1)
    private int maxConcurrency = 8;

    @NotNull
    private Duration staleAfter = Duration.ofMinutes(5);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(10);

    @Valid
    private Backoff backoff = new Backoff();

    @Data
    public static class Backoff {

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(10);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @DecimalMin("0.0")
        private double jitter = 0.25;

        @NotNull
        private Duration maxDelay = Duration.ofHours(1);
    }
}

package com.batchbridge.config;

import com.batchbridge.domain.service.delivery.ExponentialBackoffPolicy;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class DeliveryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, DeliveryProperties properties) {
        return builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .build();
    }

    /**
     * Bounded pool for webhook attempts; the dispatcher never claims more
     * deliveries than there are free threads.
     */
    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor(DeliveryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrency());
        executor.setMaxPoolSize(properties.getMaxConcurrency());
        executor.setQueueCapacity(properties.getMaxConcurrency());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public ExponentialBackoffPolicy webhookBackoffPolicy(DeliveryProperties properties) {
        DeliveryProperties.Backoff backoff = properties.getBackoff();
        return new ExponentialBackoffPolicy(
                backoff.getInitialDelay(), backoff.getMultiplier(), backoff.getJitter(), backoff.getMaxDelay());
    }
}

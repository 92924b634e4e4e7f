package com.batchbridge.domain.service.delivery;

import com.batchbridge.config.DeliveryProperties;
import com.batchbridge.infrastructure.persistence.entity.WebhookDeliveryEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves due deliveries onto the bounded delivery pool.
 *
 * Only as many deliveries are claimed as there are free slots, so nothing
 * sits in DELIVERING waiting for a thread and a slow subscriber holds at most
 * the slots of its own in-flight attempts.
 */
@Slf4j
@Component
public class DeliveryDispatcher {

    private final WebhookDeliveryService deliveryService;
    private final TaskExecutor deliveryExecutor;
    private final DeliveryProperties properties;
    private final AtomicInteger inFlight = new AtomicInteger();

    public DeliveryDispatcher(WebhookDeliveryService deliveryService,
                              @Qualifier("deliveryExecutor") TaskExecutor deliveryExecutor,
                              DeliveryProperties properties) {
        this.deliveryService = deliveryService;
        this.deliveryExecutor = deliveryExecutor;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${app.delivery.poll-interval-ms:1000}",
            initialDelayString = "${app.delivery.initial-delay-ms:5000}")
    public int dispatchDue() {
        int free = properties.getMaxConcurrency() - inFlight.get();
        int limit = Math.min(properties.getBatchSize(), free);
        if (limit <= 0) {
            return 0;
        }

        List<WebhookDeliveryEntity> claimed = deliveryService.claimDue(limit);
        for (WebhookDeliveryEntity delivery : claimed) {
            submit(delivery);
        }
        if (!claimed.isEmpty()) {
            log.debug("Dispatched {} deliveries ({} in flight)", claimed.size(), inFlight.get());
        }
        return claimed.size();
    }

    @Scheduled(fixedDelayString = "${app.delivery.recovery-interval-ms:60000}",
            initialDelayString = "${app.delivery.initial-delay-ms:5000}")
    public int recoverStale() {
        int recovered = deliveryService.recoverStale();
        if (recovered > 0) {
            log.warn("Recovered {} interrupted deliveries", recovered);
        }
        return recovered;
    }

    int inFlight() {
        return inFlight.get();
    }

    private void submit(WebhookDeliveryEntity delivery) {
        inFlight.incrementAndGet();
        try {
            deliveryExecutor.execute(() -> {
                try {
                    deliveryService.attempt(delivery);
                } catch (RuntimeException e) {
                    // Row stays DELIVERING and is picked up by stale recovery.
                    log.error("Attempt for delivery {} failed unexpectedly: {}",
                            delivery.getDeliveryId(), e.getMessage(), e);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (TaskRejectedException e) {
            inFlight.decrementAndGet();
            log.error("Delivery pool rejected {}, left for stale recovery", delivery.getDeliveryId());
        }
    }
}

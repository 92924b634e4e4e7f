package com.batchbridge.domain.service.ingestion;

import com.batchbridge.domain.model.PayloadType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each payload type to its handler. Every type must have exactly one.
 */
@Component
public class PayloadHandlerRegistry {

    private final Map<PayloadType, PayloadHandler<?>> handlers;

    public PayloadHandlerRegistry(List<PayloadHandler<?>> handlerBeans) {
        Map<PayloadType, PayloadHandler<?>> byType = new EnumMap<>(PayloadType.class);
        for (PayloadHandler<?> handler : handlerBeans) {
            PayloadHandler<?> previous = byType.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.type());
            }
        }
        for (PayloadType type : PayloadType.values()) {
            if (!byType.containsKey(type)) {
                throw new IllegalStateException("No handler registered for " + type);
            }
        }
        this.handlers = Collections.unmodifiableMap(byType);
    }

    public PayloadHandler<?> forType(PayloadType type) {
        return handlers.get(type == null ? PayloadType.UNKNOWN : type);
    }
}

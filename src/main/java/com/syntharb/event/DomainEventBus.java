package com.syntharb.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process typed publish/subscribe between the tracker, risk analytics and the broadcast server.
 *
 * <p>Delivery is synchronous on the publishing thread, in subscription order, so every
 * listener has seen an event before the mutating call that raised it returns. A listener
 * that throws is logged and skipped. Neither the publisher nor the remaining listeners
 * see the exception.
 *
 * <p>Subscribe and unsubscribe are safe while a publish is in progress: the listener list
 * is copy-on-write, so an in-flight publish completes against the list it started with.
 */
@Component
public class DomainEventBus {

    private static final Logger log = LoggerFactory.getLogger(DomainEventBus.class);

    private final Map<DomainEventType, List<DomainEventListener>> listeners = new ConcurrentHashMap<>();

    public EventSubscription subscribe(DomainEventType type, DomainEventListener listener) {
        List<DomainEventListener> forType = listeners.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>());
        forType.add(listener);
        log.debug("Listener {} subscribed to {}", listener.getClass().getSimpleName(), type);
        return () -> {
            if (forType.remove(listener)) {
                log.debug("Listener {} unsubscribed from {}", listener.getClass().getSimpleName(), type);
            }
        };
    }

    public void publish(DomainEvent event) {
        List<DomainEventListener> forType = listeners.get(event.getType());
        if (forType == null) {
            return;
        }
        for (DomainEventListener listener : forType) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error(
                        "Listener {} failed on {} event: {}",
                        listener.getClass().getSimpleName(),
                        event.getType().getWireName(),
                        e.getMessage(),
                        e);
            }
        }
    }

    public int getListenerCount(DomainEventType type) {
        List<DomainEventListener> forType = listeners.get(type);
        return forType == null ? 0 : forType.size();
    }
}

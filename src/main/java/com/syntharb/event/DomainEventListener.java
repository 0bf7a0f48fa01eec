package com.syntharb.event;

/**
 * Receives events from the {@link DomainEventBus}. Called on the publishing thread.
 */
@FunctionalInterface
public interface DomainEventListener {

    void onEvent(DomainEvent event);
}

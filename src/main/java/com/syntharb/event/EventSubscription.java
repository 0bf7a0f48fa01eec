package com.syntharb.event;

/**
 * Handle returned by {@link DomainEventBus#subscribe}. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface EventSubscription {

    void unsubscribe();
}

package com.syntharb.event;

import java.time.Instant;

/**
 * Base type of everything published on the {@link DomainEventBus}.
 *
 * <p>Events carry snapshots, never live domain objects, so listeners can read them
 * without holding the publisher's lock.
 */
public abstract class DomainEvent {

    private final Object source;
    private final DomainEventType type;
    private final Instant timestamp;

    protected DomainEvent(Object source, DomainEventType type) {
        this.source = source;
        this.type = type;
        this.timestamp = Instant.now();
    }

    public Object getSource() {
        return source;
    }

    public DomainEventType getType() {
        return type;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}

package com.syntharb.api.websocket;

/**
 * Outcome of offering a message to one client's send queue.
 */
public enum EnqueueResult {
    QUEUED,

    /** Queued after evicting the oldest pending message. */
    QUEUED_DROPPED_OLDEST,

    /** The queue overflowed under {@link OverflowPolicy#DISCONNECT}; the client was released. */
    DISCONNECTED,

    /** The client was already released. */
    CLOSED;

    public boolean isAccepted() {
        return this == QUEUED || this == QUEUED_DROPPED_OLDEST;
    }
}

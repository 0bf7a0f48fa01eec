package com.syntharb.api.websocket;

/**
 * What happens when a client's send queue is full.
 */
public enum OverflowPolicy {

    /** Discard the oldest queued message and keep the client connected. */
    DROP_OLDEST,

    /** Disconnect the client. */
    DISCONNECT
}

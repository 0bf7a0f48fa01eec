package com.syntharb.api.websocket;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Broadcast server tuning, bound from {@code syntharb.broadcast.*}.
 */
@Value
@Builder
public class BroadcastSettings {

    String path;
    String allowedOrigin;

    /** Per-client send queue bound. */
    int maxQueueSize;

    OverflowPolicy overflowPolicy;

    /** How long shutdown waits for client queues to drain before closing sockets. */
    Duration shutdownFlushTimeout;
}

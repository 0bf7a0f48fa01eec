package com.syntharb.api.websocket;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals of broadcast delivery, read by the metrics layer.
 */
public class BroadcastCounters {

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    void delivered() {
        delivered.incrementAndGet();
    }

    void dropped() {
        dropped.incrementAndGet();
    }

    void writeFailed() {
        writeFailures.incrementAndGet();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getWriteFailures() {
        return writeFailures.get();
    }
}

package com.syntharb.api.websocket;

import com.syntharb.exception.ConnectionException;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * One connected broadcast client: its session, channel subscriptions and bounded send queue.
 *
 * <p>Writes happen on the broadcast executor, never on the producer's thread. At most one
 * drain task runs per client, so messages reach the socket in the order they were queued and
 * the session never sees concurrent writes. A failed write releases only this client.
 *
 * <p>{@link #release} is idempotent: whichever path gets there first (client close, transport
 * error, write failure, overflow, shutdown) releases the resources and the rest are no-ops.
 */
public class ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    public static final String ALL_CHANNELS = "all";

    private final String clientId;
    private final WebSocketSession session;
    private final Executor executor;
    private final int maxQueueSize;
    private final OverflowPolicy overflowPolicy;
    private final Consumer<ClientConnection> onRelease;
    private final BroadcastCounters counters;

    // Guarded by queue.
    private final Deque<TextMessage> queue = new ArrayDeque<>();
    private boolean draining;

    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean released = new AtomicBoolean(false);

    ClientConnection(
            String clientId,
            WebSocketSession session,
            Executor executor,
            BroadcastSettings settings,
            BroadcastCounters counters,
            Consumer<ClientConnection> onRelease) {
        this.clientId = clientId;
        this.session = session;
        this.executor = executor;
        this.maxQueueSize = settings.getMaxQueueSize();
        this.overflowPolicy = settings.getOverflowPolicy();
        this.counters = counters;
        this.onRelease = onRelease;
        this.channels.add(ALL_CHANNELS);
    }

    public String getClientId() {
        return clientId;
    }

    public boolean isReleased() {
        return released.get();
    }

    // ---- Subscriptions ----

    public boolean isInterestedIn(String type) {
        return channels.contains(ALL_CHANNELS) || channels.contains(type);
    }

    public Set<String> subscribe(Collection<String> requested) {
        channels.addAll(requested);
        return getChannels();
    }

    public Set<String> unsubscribe(Collection<String> requested) {
        channels.removeAll(requested);
        return getChannels();
    }

    /** Sorted copy of the current subscriptions. */
    public Set<String> getChannels() {
        return new TreeSet<>(channels);
    }

    // ---- Sending ----

    /**
     * Offers a serialized message to this client's queue and makes sure a drain task is
     * running. Never blocks on the socket.
     */
    public EnqueueResult enqueue(TextMessage message) {
        if (released.get()) {
            return EnqueueResult.CLOSED;
        }
        EnqueueResult result = EnqueueResult.QUEUED;
        boolean overflow = false;
        boolean schedule = false;
        synchronized (queue) {
            if (queue.size() >= maxQueueSize) {
                if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                    queue.pollFirst();
                    counters.dropped();
                    result = EnqueueResult.QUEUED_DROPPED_OLDEST;
                } else {
                    overflow = true;
                }
            }
            if (!overflow) {
                queue.addLast(message);
                if (!draining) {
                    draining = true;
                    schedule = true;
                }
            }
        }

        if (overflow) {
            log.warn("Client {} send queue full ({} messages), disconnecting", clientId, maxQueueSize);
            counters.dropped();
            release(CloseStatus.POLICY_VIOLATION.withReason("Send queue overflow"));
            return EnqueueResult.DISCONNECTED;
        }
        if (result == EnqueueResult.QUEUED_DROPPED_OLDEST) {
            log.warn("Client {} send queue full, dropped oldest message", clientId);
        }
        if (schedule) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                log.error("Broadcast executor rejected drain task for client {}: {}", clientId, e.getMessage());
                synchronized (queue) {
                    draining = false;
                }
                release(CloseStatus.SERVICE_OVERLOAD);
                return EnqueueResult.CLOSED;
            }
        }
        return result;
    }

    /** True when nothing is queued or being written. */
    public boolean isIdle() {
        synchronized (queue) {
            return queue.isEmpty() && !draining;
        }
    }

    private void drain() {
        while (true) {
            TextMessage next;
            synchronized (queue) {
                next = released.get() ? null : queue.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                session.sendMessage(next);
                counters.delivered();
            } catch (IOException | RuntimeException e) {
                log.error("Dropping client {}", clientId,
                        new ConnectionException(clientId, "Write to client " + clientId + " failed", e));
                counters.writeFailed();
                synchronized (queue) {
                    draining = false;
                }
                release(CloseStatus.SERVER_ERROR);
                return;
            }
        }
    }

    // ---- Lifecycle ----

    /**
     * Releases this client exactly once: clears the queue, closes the session if still open
     * and deregisters from the server.
     *
     * @return true if this call performed the release
     */
    public boolean release(CloseStatus status) {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        synchronized (queue) {
            queue.clear();
        }
        if (session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.warn("Error closing session for client {}: {}", clientId, e.getMessage());
            }
        }
        onRelease.accept(this);
        log.info("Client {} released ({})", clientId, status);
        return true;
    }
}

package com.syntharb.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Fans domain and feed updates out to every connected, interested WebSocket client.
 *
 * <p>Each message is serialized once and the same frame is queued on every interested
 * client. Queues are drained on the broadcast executor, so one slow or broken socket never
 * holds up the producer or the other clients. Sequence assignment and enqueueing happen under
 * one lock, so every client sees messages in sequence order.
 *
 * <p>Inbound protocol (JSON):
 * <ul>
 *   <li>{@code {"type":"subscribe","channels":[...]}}: answered with {@code subscription-confirmed}</li>
 *   <li>{@code {"type":"unsubscribe","channels":[...]}}: answered with {@code unsubscription-confirmed}</li>
 *   <li>{@code {"type":"ping"}}: answered with {@code pong}</li>
 * </ul>
 * New clients start subscribed to {@code all}. Malformed or unknown messages are answered
 * with an {@code error} envelope and the connection stays open.
 *
 * <p>Shutdown stops accepting connections, waits (bounded) for queues to drain, then closes
 * every socket.
 */
@Component
public class BroadcastServer extends TextWebSocketHandler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BroadcastServer.class);

    public static final String TYPE_CONNECTED = "connected";
    public static final String TYPE_SUBSCRIBE = "subscribe";
    public static final String TYPE_UNSUBSCRIBE = "unsubscribe";
    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_SUBSCRIPTION_CONFIRMED = "subscription-confirmed";
    public static final String TYPE_UNSUBSCRIPTION_CONFIRMED = "unsubscription-confirmed";

    private static final long DRAIN_POLL_MS = 10;

    private final ObjectMapper objectMapper;
    private final Executor broadcastExecutor;
    private final BroadcastSettings settings;
    private final BroadcastCounters counters = new BroadcastCounters();

    private final Map<String, ClientConnection> clients = new ConcurrentHashMap<>();

    private final Object broadcastLock = new Object();

    // Guarded by broadcastLock.
    private long sequence;

    private volatile boolean running;

    public BroadcastServer(
            ObjectMapper objectMapper,
            @Qualifier("broadcastExecutor") Executor broadcastExecutor,
            BroadcastSettings settings) {
        this.objectMapper = objectMapper;
        this.broadcastExecutor = broadcastExecutor;
        this.settings = settings;
    }

    // ========================
    // CONNECTION LIFECYCLE
    // ========================

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        if (!running) {
            log.info("Rejecting connection {}: broadcast server is not accepting clients", session.getId());
            session.close(CloseStatus.SERVICE_RESTARTED);
            return;
        }
        ClientConnection client = new ClientConnection(
                session.getId(),
                session,
                broadcastExecutor,
                settings,
                counters,
                released -> clients.remove(released.getClientId(), released));
        clients.put(client.getClientId(), client);
        log.info("Client {} connected ({} connected)", client.getClientId(), clients.size());

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("clientId", client.getClientId());
        welcome.put("channels", client.getChannels());
        reply(client, TYPE_CONNECTED, welcome);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ClientConnection client = clients.get(session.getId());
        if (client != null) {
            client.release(status);
        }
        log.info("Client {} disconnected ({} connected)", session.getId(), clients.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on client {}: {}", session.getId(), exception.getMessage());
        ClientConnection client = clients.get(session.getId());
        if (client != null) {
            client.release(CloseStatus.SERVER_ERROR);
        }
    }

    /** Binary frames are not part of the protocol; they are rejected without closing the session. */
    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ClientConnection client = clients.get(session.getId());
        if (client == null) {
            return;
        }
        log.warn("Ignoring {}-byte binary frame from client {}", message.getPayloadLength(), client.getClientId());
        replyError(client, "Malformed message: binary frames are not supported");
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ClientConnection client = clients.get(session.getId());
        if (client == null) {
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("Malformed message from client {}: {}", client.getClientId(), e.getOriginalMessage());
            replyError(client, "Malformed message: " + e.getOriginalMessage());
            return;
        }
        if (node == null || !node.isObject()) {
            log.warn("Malformed message from client {}: not a JSON object", client.getClientId());
            replyError(client, "Malformed message: expected a JSON object");
            return;
        }

        String type = node.path("type").asText("");
        switch (type) {
            case TYPE_SUBSCRIBE -> {
                List<String> channels = readChannels(node);
                if (channels.isEmpty()) {
                    replyError(client, "subscribe requires a non-empty channels array");
                    return;
                }
                Set<String> current = client.subscribe(channels);
                log.debug("Client {} subscribed to {}", client.getClientId(), channels);
                reply(client, TYPE_SUBSCRIPTION_CONFIRMED, Map.of("channels", current));
            }
            case TYPE_UNSUBSCRIBE -> {
                List<String> channels = readChannels(node);
                if (channels.isEmpty()) {
                    replyError(client, "unsubscribe requires a non-empty channels array");
                    return;
                }
                Set<String> current = client.unsubscribe(channels);
                log.debug("Client {} unsubscribed from {}", client.getClientId(), channels);
                reply(client, TYPE_UNSUBSCRIPTION_CONFIRMED, Map.of("channels", current));
            }
            case TYPE_PING -> reply(client, TYPE_PONG, Map.of());
            default -> {
                log.warn("Unknown message type '{}' from client {}", type, client.getClientId());
                replyError(client, "Unknown message type: " + type);
            }
        }
    }

    // ========================
    // DELIVERY
    // ========================

    /**
     * Sends one message to every connected client subscribed to {@code type} (or to {@code all}).
     *
     * @return number of clients the message was queued for
     */
    public int broadcast(String type, Object data) {
        synchronized (broadcastLock) {
            long next = sequence + 1;
            String json;
            try {
                json = objectMapper.writeValueAsString(WebSocketMessage.of(type, data, next));
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize {} broadcast: {}", type, e.getMessage(), e);
                return 0;
            }
            sequence = next;

            TextMessage frame = new TextMessage(json);
            int queued = 0;
            for (ClientConnection client : clients.values()) {
                if (client.isInterestedIn(type) && client.enqueue(frame).isAccepted()) {
                    queued++;
                }
            }
            log.debug("Broadcast {} #{} queued for {} clients", type, next, queued);
            return queued;
        }
    }

    /**
     * Targeted delivery. A client that disconnected in the meantime is logged and skipped.
     *
     * @return true if the message was queued
     */
    public boolean sendToClient(String clientId, String type, Object data) {
        ClientConnection client = clients.get(clientId);
        if (client == null || client.isReleased()) {
            log.info("Client {} is no longer connected, dropping {} message", clientId, type);
            return false;
        }
        return reply(client, type, data);
    }

    private boolean reply(ClientConnection client, String type, Object data) {
        String json;
        try {
            json = objectMapper.writeValueAsString(WebSocketMessage.of(type, data, currentSequence()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message for client {}: {}", type, client.getClientId(), e.getMessage());
            return false;
        }
        return client.enqueue(new TextMessage(json)).isAccepted();
    }

    private void replyError(ClientConnection client, String message) {
        reply(client, TYPE_ERROR, Map.of("message", message));
    }

    private List<String> readChannels(JsonNode node) {
        List<String> channels = new ArrayList<>();
        JsonNode array = node.get("channels");
        if (array != null && array.isArray()) {
            for (JsonNode channel : array) {
                if (channel.isTextual() && !channel.textValue().isBlank()) {
                    channels.add(channel.textValue());
                }
            }
        }
        return channels;
    }

    private long currentSequence() {
        synchronized (broadcastLock) {
            return sequence;
        }
    }

    // ========================
    // QUERIES
    // ========================

    public int getConnectionCount() {
        return clients.size();
    }

    public Set<String> getClientIds() {
        return new TreeSet<>(clients.keySet());
    }

    public BroadcastCounters getCounters() {
        return counters;
    }

    // ========================
    // SHUTDOWN
    // ========================

    /**
     * Stops accepting clients, waits up to {@code flushTimeout} for every queue to drain,
     * then closes all sockets.
     */
    public void shutdown(Duration flushTimeout) {
        running = false;
        log.info("Broadcast server shutting down, flushing {} clients", clients.size());

        long deadline = System.nanoTime() + flushTimeout.toNanos();
        while (System.nanoTime() < deadline && !allIdle()) {
            try {
                Thread.sleep(DRAIN_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!allIdle()) {
            log.warn("Broadcast queues not drained within {}, closing anyway", flushTimeout);
        }

        for (ClientConnection client : new ArrayList<>(clients.values())) {
            client.release(CloseStatus.GOING_AWAY);
        }
        log.info("Broadcast server stopped");
    }

    private boolean allIdle() {
        return clients.values().stream().allMatch(ClientConnection::isIdle);
    }

    @Override
    public void start() {
        running = true;
        log.info("Broadcast server accepting clients on {}", settings.getPath());
    }

    @Override
    public void stop() {
        shutdown(settings.getShutdownFlushTimeout());
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}

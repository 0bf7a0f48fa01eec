package com.syntharb.api.websocket;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope of every message pushed to broadcast clients:
 * {@code { "type", "data", "timestamp", "sequence" }}.
 *
 * <ul>
 *   <li>{@code type}: kind of update ({@code odds-update}, {@code arbitrage-alert},
 *       {@code positionAdded}, {@code riskAlert}, ...) or a protocol reply
 *       ({@code pong}, {@code error}, ...)</li>
 *   <li>{@code timestamp}: epoch milliseconds when the message was built</li>
 *   <li>{@code sequence}: server-wide broadcast counter, strictly increasing in emission
 *       order. Direct replies to one client reuse the last broadcast sequence.</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebSocketMessage {

    private String type;
    private Object data;
    private long timestamp;
    private long sequence;

    public static WebSocketMessage of(String type, Object data, long sequence) {
        return new WebSocketMessage(type, data, System.currentTimeMillis(), sequence);
    }
}

package com.syntharb.exception;

import java.util.Map;

/**
 * A write to a broadcast client failed. Raised and handled inside the broadcast
 * layer; it never reaches the domain mutation that produced the message.
 */
public class ConnectionException extends BaseException {

    private final String clientId;

    public ConnectionException(String clientId, String message, Throwable cause) {
        super(ErrorCode.CONNECTION_ERROR, message, Map.of("clientId", clientId), cause);
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }
}

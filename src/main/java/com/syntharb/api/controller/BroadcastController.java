package com.syntharb.api.controller;

import com.syntharb.api.dto.request.BroadcastRequest;
import com.syntharb.api.websocket.BroadcastServer;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Broadcast server status and diagnostics.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/broadcast/clients -- connected client count and ids</li>
 *   <li>POST /api/broadcast -- push a free-form message to interested clients</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/broadcast")
public class BroadcastController {

    private final BroadcastServer broadcastServer;

    public BroadcastController(BroadcastServer broadcastServer) {
        this.broadcastServer = broadcastServer;
    }

    @GetMapping("/clients")
    public ResponseEntity<Map<String, Object>> getClients() {
        Map<String, Object> clients = new LinkedHashMap<>();
        clients.put("count", broadcastServer.getConnectionCount());
        clients.put("clientIds", broadcastServer.getClientIds());
        return ResponseEntity.ok(clients);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> broadcast(@Valid @RequestBody BroadcastRequest request) {
        int queued = broadcastServer.broadcast(request.getType(), request.getData());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("type", request.getType());
        result.put("clients", queued);
        return ResponseEntity.ok(result);
    }
}

package com.syntharb.api.websocket;

import com.syntharb.domain.model.MarketLeg;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.DomainEvent;
import com.syntharb.event.PositionEvent;
import com.syntharb.event.RiskAlertEvent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pushes domain events to WebSocket clients. The envelope type is the event's wire name
 * ({@code positionAdded}, {@code positionUpdated}, {@code positionClosed}, {@code riskAlert},
 * {@code alertAcknowledged}), and the payload is a flat map built from the event snapshot.
 */
@Component
public class BroadcastEventRelay {

    private static final Logger log = LoggerFactory.getLogger(BroadcastEventRelay.class);

    private final BroadcastServer broadcastServer;

    public BroadcastEventRelay(BroadcastServer broadcastServer) {
        this.broadcastServer = broadcastServer;
    }

    public void onDomainEvent(DomainEvent event) {
        Object payload;
        if (event instanceof PositionEvent positionEvent) {
            payload = positionPayload(positionEvent);
        } else if (event instanceof RiskAlertEvent alertEvent) {
            payload = alertPayload(alertEvent.getAlert());
        } else {
            log.debug("No broadcast mapping for {} event", event.getType());
            return;
        }
        broadcastServer.broadcast(event.getType().getWireName(), payload);
    }

    private Map<String, Object> positionPayload(PositionEvent event) {
        SyntheticPosition position = event.getPosition();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("positionId", position.getId());
        payload.put("symbol", position.getSymbol());
        payload.put("sport", position.getSport());
        payload.put("status", position.getStatus().name().toLowerCase(Locale.ROOT));
        payload.put("currentExposure", position.getCurrentExposure());
        payload.put("peakExposure", position.getRisk().getPeakExposure());
        payload.put("totalCost", position.getTotalCost());
        payload.put("totalCommission", position.getTotalCommission());
        payload.put("expectedPnl", position.getExpectedPnl());
        payload.put("realizedPnl", position.getRealizedPnl());
        payload.put("legIndex", event.getLegIndex());
        payload.put("closeReason", event.getCloseReason() != null ? event.getCloseReason().name() : null);
        payload.put("legs", legPayloads(position.getLegs()));
        payload.put("updatedAt", position.getUpdatedAt() != null ? position.getUpdatedAt().toEpochMilli() : null);
        return payload;
    }

    private List<Map<String, Object>> legPayloads(List<MarketLeg> legs) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (MarketLeg leg : legs) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", leg.getIndex());
            entry.put("exchange", leg.getExchange());
            entry.put("side", leg.getSide() != null ? leg.getSide().wireName() : null);
            entry.put("status", leg.getStatus() != null ? leg.getStatus().name() : null);
            entry.put("fillPrice", leg.getFillPrice());
            entry.put("fillQuantity", leg.getFillQuantity());
            entry.put("commission", leg.getCommission());
            result.add(entry);
        }
        return result;
    }

    private Map<String, Object> alertPayload(RiskAlert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alert.getId());
        payload.put("type", alert.getType().name());
        payload.put("severity", alert.getSeverity().name());
        payload.put("message", alert.getMessage());
        payload.put("positionId", alert.getPositionId());
        payload.put("threshold", alert.getThreshold());
        payload.put("currentValue", alert.getCurrentValue());
        payload.put("acknowledged", alert.isAcknowledged());
        payload.put("timestamp", alert.getTimestamp() != null ? alert.getTimestamp().toEpochMilli() : null);
        return payload;
    }
}

package com.syntharb.unit.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.syntharb.api.websocket.BroadcastEventRelay;
import com.syntharb.api.websocket.BroadcastServer;
import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.enums.RiskAlertType;
import com.syntharb.domain.enums.TradeSide;
import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.MarketLeg;
import com.syntharb.domain.model.PositionRisk;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.DomainEvent;
import com.syntharb.event.DomainEventType;
import com.syntharb.event.PositionEvent;
import com.syntharb.event.RiskAlertEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BroadcastEventRelayTest {

    @Mock
    private BroadcastServer broadcastServer;

    private BroadcastEventRelay relay;

    @BeforeEach
    void setUp() {
        relay = new BroadcastEventRelay(broadcastServer);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> broadcastPayload(String type) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(broadcastServer).broadcast(eq(type), captor.capture());
        return (Map<String, Object>) captor.getValue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void positionClosed_broadcastsFlatPayloadUnderWireName() {
        SyntheticPosition position = SyntheticPosition.builder()
                .id("pos_1")
                .opportunity(ArbitrageOpportunity.builder().symbol("NBA-LAL").sport("basketball").build())
                .status(PositionStatus.COMPLETED)
                .risk(PositionRisk.builder()
                        .currentExposure(new BigDecimal("110000"))
                        .peakExposure(new BigDecimal("110000"))
                        .build())
                .realizedPnl(new BigDecimal("150"))
                .legs(List.of(MarketLeg.builder()
                        .index(0)
                        .exchange("pinnacle")
                        .side(TradeSide.BUY)
                        .status(LegStatus.FILLED)
                        .fillPrice(new BigDecimal("-110"))
                        .fillQuantity(new BigDecimal("1000"))
                        .build()))
                .updatedAt(Instant.ofEpochMilli(1_700_000_000_000L))
                .build();

        relay.onDomainEvent(
                new PositionEvent(this, DomainEventType.POSITION_CLOSED, position, null, CloseReason.COMPLETED));

        Map<String, Object> payload = broadcastPayload("positionClosed");
        assertThat(payload)
                .containsEntry("positionId", "pos_1")
                .containsEntry("symbol", "NBA-LAL")
                .containsEntry("status", "completed")
                .containsEntry("closeReason", "COMPLETED")
                .containsEntry("updatedAt", 1_700_000_000_000L);
        assertThat((BigDecimal) payload.get("currentExposure")).isEqualByComparingTo("110000");
        List<Map<String, Object>> legs = (List<Map<String, Object>>) payload.get("legs");
        assertThat(legs.get(0)).containsEntry("side", "buy").containsEntry("status", "FILLED");
    }

    @Test
    void riskAlert_broadcastsAlertPayload() {
        RiskAlert alert = RiskAlert.builder()
                .id("alert_1")
                .type(RiskAlertType.EXPOSURE_LIMIT)
                .severity(AlertSeverity.CRITICAL)
                .message("Total exposure over limit")
                .threshold(new BigDecimal("100"))
                .currentValue(new BigDecimal("150"))
                .timestamp(Instant.ofEpochMilli(5L))
                .build();

        relay.onDomainEvent(new RiskAlertEvent(this, DomainEventType.RISK_ALERT, alert));

        assertThat(broadcastPayload("riskAlert"))
                .containsEntry("alertId", "alert_1")
                .containsEntry("severity", "CRITICAL")
                .containsEntry("acknowledged", false)
                .containsEntry("timestamp", 5L);
    }

    @Test
    void unknownEventKind_isNotBroadcast() {
        relay.onDomainEvent(new DomainEvent(this, DomainEventType.POSITION_ADDED) {});

        verify(broadcastServer, never()).broadcast(anyString(), any());
    }
}

package com.syntharb.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.syntharb.api.websocket.BroadcastCounters;
import com.syntharb.api.websocket.BroadcastServer;
import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.enums.RiskAlertType;
import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.DomainEventType;
import com.syntharb.event.PositionEvent;
import com.syntharb.event.RiskAlertEvent;
import com.syntharb.ingestion.TickIngestionService;
import com.syntharb.observability.CustomMetricsService;
import com.syntharb.risk.PortfolioAnalyticsService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for CustomMetricsService: event-driven counters plus the gauges and function
 * counters read from the analytics, broadcast and ingestion services.
 *
 * <p>Lenient strictness because gauges are only evaluated by tests that read them.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CustomMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private CustomMetricsService customMetricsService;

    @Mock
    private PortfolioAnalyticsService portfolioAnalyticsService;

    @Mock
    private BroadcastServer broadcastServer;

    @Mock
    private TickIngestionService tickIngestionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(portfolioAnalyticsService.getPortfolioMetrics()).thenReturn(PortfolioMetrics.builder()
                .pendingPositions(1)
                .activePositions(2)
                .completedPositions(4)
                .totalExposure(new BigDecimal("110000.00"))
                .build());
        when(broadcastServer.getCounters()).thenReturn(new BroadcastCounters());
        when(broadcastServer.getConnectionCount()).thenReturn(3);
        when(tickIngestionService.getTicksAccepted()).thenReturn(10L);
        when(tickIngestionService.getTicksRejected()).thenReturn(2L);
        customMetricsService = new CustomMetricsService(
                meterRegistry, portfolioAnalyticsService, broadcastServer, tickIngestionService);
    }

    private static SyntheticPosition position(PositionStatus status) {
        return SyntheticPosition.builder().id("pos-1").status(status).build();
    }

    @Nested
    @DisplayName("Counter metrics")
    class CounterMetrics {

        @Test
        @DisplayName("positions.opened increments on POSITION_ADDED")
        void positionsOpenedIncrements() {
            customMetricsService.onDomainEvent(new PositionEvent(
                    this, DomainEventType.POSITION_ADDED, position(PositionStatus.PENDING), null, null));
            customMetricsService.onDomainEvent(new PositionEvent(
                    this, DomainEventType.POSITION_ADDED, position(PositionStatus.PENDING), null, null));

            assertThat(meterRegistry.get("positions.opened").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("positions.closed is tagged with the terminal status")
        void positionsClosedTaggedByStatus() {
            customMetricsService.onDomainEvent(new PositionEvent(
                    this, DomainEventType.POSITION_CLOSED, position(PositionStatus.COMPLETED), null,
                    CloseReason.MANUAL));
            customMetricsService.onDomainEvent(new PositionEvent(
                    this, DomainEventType.POSITION_CLOSED, position(PositionStatus.CANCELLED), null,
                    CloseReason.FAILED));

            assertThat(meterRegistry.get("positions.closed").tag("status", "COMPLETED").counter().count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.get("positions.closed").tag("status", "CANCELLED").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("risk.alerts.raised is tagged with severity; acknowledgements are not counted")
        void riskAlertsTaggedBySeverity() {
            RiskAlert alert = RiskAlert.builder()
                    .id("alert-1")
                    .type(RiskAlertType.EXPOSURE_LIMIT)
                    .severity(AlertSeverity.CRITICAL)
                    .build();

            customMetricsService.onDomainEvent(new RiskAlertEvent(this, DomainEventType.RISK_ALERT, alert));
            customMetricsService.onDomainEvent(
                    new RiskAlertEvent(this, DomainEventType.ALERT_ACKNOWLEDGED, alert));

            assertThat(meterRegistry.get("risk.alerts.raised").tag("severity", "CRITICAL").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Position updates do not touch the counters")
        void positionUpdateIgnored() {
            customMetricsService.onDomainEvent(new PositionEvent(
                    this, DomainEventType.POSITION_UPDATED, position(PositionStatus.ACTIVE), 0, null));

            assertThat(meterRegistry.get("positions.opened").counter().count()).isZero();
            assertThat(meterRegistry.find("positions.closed").counter()).isNull();
        }
    }

    @Nested
    @DisplayName("Gauge and function counter metrics")
    class GaugeMetrics {

        @Test
        @DisplayName("positions.open counts pending plus active positions")
        void positionsOpenGauge() {
            assertThat(meterRegistry.get("positions.open").gauge().value()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("portfolio.exposure reflects total active exposure")
        void exposureGauge() {
            assertThat(meterRegistry.get("portfolio.exposure").gauge().value()).isEqualTo(110000.0);
        }

        @Test
        @DisplayName("broadcast.clients reflects connected clients")
        void clientsGauge() {
            assertThat(meterRegistry.get("broadcast.clients").gauge().value()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("ticks counters read through to the ingestion service")
        void tickCounters() {
            assertThat(meterRegistry.get("ticks.accepted").functionCounter().count()).isEqualTo(10.0);
            assertThat(meterRegistry.get("ticks.rejected").functionCounter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("broadcast.messages.dropped").functionCounter().count()).isZero();
        }
    }
}

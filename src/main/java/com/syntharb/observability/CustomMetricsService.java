package com.syntharb.observability;

import com.syntharb.api.websocket.BroadcastServer;
import com.syntharb.event.DomainEvent;
import com.syntharb.event.DomainEventType;
import com.syntharb.event.PositionEvent;
import com.syntharb.event.RiskAlertEvent;
import com.syntharb.ingestion.TickIngestionService;
import com.syntharb.risk.PortfolioAnalyticsService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the custom Micrometer meters.
 *
 * <ul>
 *   <li><b>positions.opened</b> / <b>positions.closed</b> (counters, closed tagged by status)</li>
 *   <li><b>risk.alerts.raised</b> (counter, tagged by severity)</li>
 *   <li><b>ticks.accepted</b> / <b>ticks.rejected</b> (function counters over the ingestion service)</li>
 *   <li><b>broadcast.messages.delivered</b>, <b>broadcast.messages.dropped</b>,
 *       <b>broadcast.write.failures</b> (function counters over the broadcast server)</li>
 *   <li><b>positions.open</b>, <b>portfolio.exposure</b>, <b>broadcast.clients</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges and function counters are evaluated lazily when the registry is scraped.
 * Event-driven counters are updated from the domain event bus.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter positionsOpenedCounter;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            PortfolioAnalyticsService portfolioAnalyticsService,
            BroadcastServer broadcastServer,
            TickIngestionService tickIngestionService) {
        this.meterRegistry = meterRegistry;

        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Positions created from arbitrage opportunities")
                .register(meterRegistry);

        FunctionCounter.builder("ticks.accepted", tickIngestionService, TickIngestionService::getTicksAccepted)
                .description("Feed ticks that parsed and validated")
                .register(meterRegistry);
        FunctionCounter.builder("ticks.rejected", tickIngestionService, TickIngestionService::getTicksRejected)
                .description("Feed ticks rejected by parsing or validation")
                .register(meterRegistry);

        FunctionCounter.builder(
                        "broadcast.messages.delivered",
                        broadcastServer,
                        server -> server.getCounters().getDelivered())
                .description("Frames written to client sockets")
                .register(meterRegistry);
        FunctionCounter.builder(
                        "broadcast.messages.dropped",
                        broadcastServer,
                        server -> server.getCounters().getDropped())
                .description("Frames dropped by the per-client overflow policy")
                .register(meterRegistry);
        FunctionCounter.builder(
                        "broadcast.write.failures",
                        broadcastServer,
                        server -> server.getCounters().getWriteFailures())
                .description("Client socket writes that failed")
                .register(meterRegistry);

        meterRegistry.gauge(
                "positions.open",
                portfolioAnalyticsService,
                service -> service.getPortfolioMetrics().getOpenPositions());
        meterRegistry.gauge(
                "portfolio.exposure",
                portfolioAnalyticsService,
                service -> service.getPortfolioMetrics().getTotalExposure().doubleValue());
        meterRegistry.gauge("broadcast.clients", broadcastServer, BroadcastServer::getConnectionCount);

        log.info("Custom metrics registered");
    }

    public void onDomainEvent(DomainEvent event) {
        if (event.getType() == DomainEventType.POSITION_ADDED) {
            positionsOpenedCounter.increment();
        } else if (event.getType() == DomainEventType.POSITION_CLOSED && event instanceof PositionEvent positionEvent) {
            meterRegistry
                    .counter("positions.closed", "status", positionEvent.getPosition().getStatus().name())
                    .increment();
        } else if (event.getType() == DomainEventType.RISK_ALERT && event instanceof RiskAlertEvent alertEvent) {
            meterRegistry
                    .counter("risk.alerts.raised", "severity", alertEvent.getAlert().getSeverity().name())
                    .increment();
        }
    }
}

package com.syntharb.config;

import com.syntharb.api.websocket.BroadcastEventRelay;
import com.syntharb.event.DomainEventBus;
import com.syntharb.event.DomainEventType;
import com.syntharb.observability.CustomMetricsService;
import com.syntharb.risk.RiskAlertService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.annotation.Configuration;

/**
 * Subscribes the event consumers to the {@link DomainEventBus} in a fixed order.
 *
 * <p>For position events the broadcast relay runs first, so clients see the position change
 * before any {@code riskAlert} it triggers. The risk alert service runs next and the metrics
 * service last.
 */
@Configuration
public class DomainEventWiring implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(DomainEventWiring.class);

    private static final List<DomainEventType> POSITION_EVENTS = List.of(
            DomainEventType.POSITION_ADDED, DomainEventType.POSITION_UPDATED, DomainEventType.POSITION_CLOSED);

    private static final List<DomainEventType> ALERT_EVENTS =
            List.of(DomainEventType.RISK_ALERT, DomainEventType.ALERT_ACKNOWLEDGED);

    private final DomainEventBus domainEventBus;
    private final BroadcastEventRelay broadcastEventRelay;
    private final RiskAlertService riskAlertService;
    private final CustomMetricsService customMetricsService;

    public DomainEventWiring(
            DomainEventBus domainEventBus,
            BroadcastEventRelay broadcastEventRelay,
            RiskAlertService riskAlertService,
            CustomMetricsService customMetricsService) {
        this.domainEventBus = domainEventBus;
        this.broadcastEventRelay = broadcastEventRelay;
        this.riskAlertService = riskAlertService;
        this.customMetricsService = customMetricsService;
    }

    @Override
    public void afterSingletonsInstantiated() {
        for (DomainEventType type : POSITION_EVENTS) {
            domainEventBus.subscribe(type, broadcastEventRelay::onDomainEvent);
            domainEventBus.subscribe(type, riskAlertService::onDomainEvent);
            domainEventBus.subscribe(type, customMetricsService::onDomainEvent);
        }
        for (DomainEventType type : ALERT_EVENTS) {
            domainEventBus.subscribe(type, broadcastEventRelay::onDomainEvent);
            domainEventBus.subscribe(type, customMetricsService::onDomainEvent);
        }
        log.info("Domain event listeners registered");
    }
}

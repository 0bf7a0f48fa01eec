package com.syntharb.event;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.SyntheticPosition;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over the {@link DomainEventBus}, so call sites read as
 * {@code eventPublisherHelper.publishPositionClosed(this, position, reason)}.
 */
@Component
public class EventPublisherHelper {

    private final DomainEventBus domainEventBus;

    public EventPublisherHelper(DomainEventBus domainEventBus) {
        this.domainEventBus = domainEventBus;
    }

    // ---- Position ----

    public void publishPositionAdded(Object source, SyntheticPosition position) {
        domainEventBus.publish(new PositionEvent(source, DomainEventType.POSITION_ADDED, position, null, null));
    }

    public void publishPositionUpdated(Object source, SyntheticPosition position, int legIndex) {
        domainEventBus.publish(new PositionEvent(source, DomainEventType.POSITION_UPDATED, position, legIndex, null));
    }

    public void publishPositionClosed(Object source, SyntheticPosition position, CloseReason reason) {
        domainEventBus.publish(new PositionEvent(source, DomainEventType.POSITION_CLOSED, position, null, reason));
    }

    // ---- Risk ----

    public void publishRiskAlert(Object source, RiskAlert alert) {
        domainEventBus.publish(new RiskAlertEvent(source, DomainEventType.RISK_ALERT, alert));
    }

    public void publishAlertAcknowledged(Object source, RiskAlert alert) {
        domainEventBus.publish(new RiskAlertEvent(source, DomainEventType.ALERT_ACKNOWLEDGED, alert));
    }
}

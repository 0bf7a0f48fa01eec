package com.syntharb.event;

import com.syntharb.domain.model.RiskAlert;

/**
 * Published when a risk alert is raised or acknowledged.
 */
public class RiskAlertEvent extends DomainEvent {

    private final RiskAlert alert;

    public RiskAlertEvent(Object source, DomainEventType type, RiskAlert alert) {
        super(source, type);
        this.alert = alert;
    }

    public RiskAlert getAlert() {
        return alert;
    }
}

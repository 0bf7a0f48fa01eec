package com.syntharb.event;

/**
 * Kinds of domain events. The wire name is what broadcast clients see as the message type
 * and what they subscribe to.
 */
public enum DomainEventType {

    /** A position was created from an opportunity. */
    POSITION_ADDED("positionAdded"),

    /** A leg of a position received a fill. */
    POSITION_UPDATED("positionUpdated"),

    /** A position reached a terminal status. */
    POSITION_CLOSED("positionClosed"),

    /** A risk limit was breached and a new alert raised. */
    RISK_ALERT("riskAlert"),

    /** An operator acknowledged an alert for the first time. */
    ALERT_ACKNOWLEDGED("alertAcknowledged");

    private final String wireName;

    DomainEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}

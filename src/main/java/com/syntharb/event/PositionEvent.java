package com.syntharb.event;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.model.SyntheticPosition;

/**
 * Published by the position tracker after a position is added, filled or closed.
 *
 * <p>Listeners:
 * <ul>
 *   <li>RiskAlertService: re-evaluates limits against the new portfolio snapshot</li>
 *   <li>BroadcastEventRelay: pushes the change to subscribed WebSocket clients</li>
 *   <li>CustomMetricsService: counts opened and closed positions</li>
 * </ul>
 */
public class PositionEvent extends DomainEvent {

    private final SyntheticPosition position;
    private final Integer legIndex;
    private final CloseReason closeReason;

    /**
     * @param position    snapshot of the position after the change
     * @param legIndex    the filled leg for {@code POSITION_UPDATED}, null otherwise
     * @param closeReason the reason for {@code POSITION_CLOSED}, null otherwise
     */
    public PositionEvent(
            Object source,
            DomainEventType type,
            SyntheticPosition position,
            Integer legIndex,
            CloseReason closeReason) {
        super(source, type);
        this.position = position;
        this.legIndex = legIndex;
        this.closeReason = closeReason;
    }

    public SyntheticPosition getPosition() {
        return position;
    }

    public Integer getLegIndex() {
        return legIndex;
    }

    public CloseReason getCloseReason() {
        return closeReason;
    }
}

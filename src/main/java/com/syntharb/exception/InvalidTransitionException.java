package com.syntharb.exception;

import com.syntharb.domain.enums.PositionStatus;
import java.util.Map;

/**
 * Thrown when a position is asked to leave a state it cannot leave, most commonly
 * any mutation of a COMPLETED or CANCELLED position.
 */
public class InvalidTransitionException extends BaseException {

    private final PositionStatus from;
    private final PositionStatus to;

    public InvalidTransitionException(String positionId, PositionStatus from, PositionStatus to) {
        super(
                ErrorCode.INVALID_TRANSITION,
                String.format("Position %s cannot transition from %s to %s", positionId, from, to),
                Map.of("positionId", positionId, "from", String.valueOf(from), "to", String.valueOf(to)));
        this.from = from;
        this.to = to;
    }

    public PositionStatus getFrom() {
        return from;
    }

    public PositionStatus getTo() {
        return to;
    }
}

package com.syntharb.domain.enums;

/**
 * Why a position was closed. Each reason maps onto one terminal {@link PositionStatus}.
 */
public enum CloseReason {
    COMPLETED(PositionStatus.COMPLETED),
    MANUAL(PositionStatus.COMPLETED),
    AUTO_CLOSE(PositionStatus.COMPLETED),
    CANCELLED(PositionStatus.CANCELLED),
    FAILED(PositionStatus.CANCELLED);

    private final PositionStatus terminalStatus;

    CloseReason(PositionStatus terminalStatus) {
        this.terminalStatus = terminalStatus;
    }

    public PositionStatus getTerminalStatus() {
        return terminalStatus;
    }
}

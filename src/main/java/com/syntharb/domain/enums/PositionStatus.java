package com.syntharb.domain.enums;

/**
 * Lifecycle status of a synthetic position.
 * Transitions: PENDING → ACTIVE → COMPLETED/CANCELLED. PENDING may also be closed
 * directly. COMPLETED and CANCELLED are terminal.
 */
public enum PositionStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(PositionStatus target) {
        if (isTerminal() || target == null || target == this) {
            return false;
        }
        if (this == ACTIVE) {
            return target.isTerminal();
        }
        return target != PENDING;
    }
}

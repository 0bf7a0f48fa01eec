package com.syntharb.domain.enums;

/**
 * Fill status of a single position leg.
 * PARTIAL legs carry a fill and count towards exposure just like FILLED legs.
 */
public enum LegStatus {
    PENDING,
    FILLED,
    PARTIAL,
    CANCELLED;

    public boolean hasFill() {
        return this == FILLED || this == PARTIAL;
    }
}

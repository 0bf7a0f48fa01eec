package com.syntharb.domain.enums;

/**
 * Severity level of a risk alert.
 */
public enum AlertSeverity {

    /** Informational, no action required. */
    INFO,

    /** Limit breached, trader should take action. */
    WARNING,

    /** Portfolio-wide limit breached, requires immediate attention. */
    CRITICAL
}

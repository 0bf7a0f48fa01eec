package com.syntharb.domain.enums;

/**
 * Classifies the limit whose breach raised a risk alert.
 */
public enum RiskAlertType {

    /** Total exposure across active positions exceeds the portfolio limit. */
    EXPOSURE_LIMIT(AlertSeverity.CRITICAL),

    /** A single active position's exposure exceeds the per-position limit. */
    POSITION_EXPOSURE_LIMIT(AlertSeverity.WARNING),

    /** Parametric VaR at 95% exceeds its limit. */
    VAR95_LIMIT(AlertSeverity.WARNING),

    /** Parametric VaR at 99% exceeds its limit. */
    VAR99_LIMIT(AlertSeverity.CRITICAL),

    /** Number of open (pending + active) positions exceeds the limit. */
    POSITION_COUNT_LIMIT(AlertSeverity.WARNING),

    /** One symbol holds more than the allowed share of total exposure. */
    CONCENTRATION_LIMIT(AlertSeverity.WARNING);

    private final AlertSeverity defaultSeverity;

    RiskAlertType(AlertSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public AlertSeverity getDefaultSeverity() {
        return defaultSeverity;
    }
}

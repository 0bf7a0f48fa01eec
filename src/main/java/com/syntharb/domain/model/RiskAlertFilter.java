package com.syntharb.domain.model;

import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.RiskAlertType;
import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for listing risk alerts. Null fields match everything.
 */
@Value
@Builder
public class RiskAlertFilter {

    public static final RiskAlertFilter ALL = RiskAlertFilter.builder().build();

    AlertSeverity severity;
    RiskAlertType type;
    Boolean acknowledged;

    public boolean matches(RiskAlert alert) {
        return (severity == null || severity == alert.getSeverity())
                && (type == null || type == alert.getType())
                && (acknowledged == null || acknowledged == alert.isAcknowledged());
    }
}

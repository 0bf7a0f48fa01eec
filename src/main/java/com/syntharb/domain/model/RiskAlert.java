package com.syntharb.domain.model;

import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.RiskAlertType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raised when a risk limit is breached.
 *
 * <p>Acknowledgement is the only change a client can make. While its breach stays latched
 * the alert service also publishes updated values with a refreshed {@code currentValue}, and
 * one stamped with {@code resolvedAt} once the metric is back within its limit. Each of these
 * replaces the stored alert with a new value rather than modifying the old one.
 * Alerts are kept for the audit trail until the retention policy prunes them.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskAlert {

    private String id;
    private RiskAlertType type;
    private AlertSeverity severity;
    private String message;

    /** Set for per-position alerts, null for portfolio-wide ones. */
    private String positionId;

    /** Debounce scope: the limit type plus the position or symbol it applies to. */
    private String scope;

    private BigDecimal threshold;
    private BigDecimal currentValue;
    private Instant timestamp;

    private boolean acknowledged;
    private Instant acknowledgedAt;

    /** Set when the breached metric returned within its limit. */
    private Instant resolvedAt;

    public RiskAlert copy() {
        return toBuilder().build();
    }
}

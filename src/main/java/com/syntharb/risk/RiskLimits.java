package com.syntharb.risk;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Portfolio risk limits evaluated after every tracker event.
 *
 * <p>Null values mean the check is disabled. Limits are loaded from application.properties
 * ({@code syntharb.risk.*}) on startup and can be replaced at runtime via the Risk API.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RiskLimits {

    // ==================== Exposure ====================

    /** Maximum Σ exposure over active positions. */
    private BigDecimal maxTotalExposure;

    /** Maximum exposure of any single active position. */
    private BigDecimal maxPositionExposure;

    /** Maximum share (0..1) of total exposure concentrated in one sport or symbol. */
    private BigDecimal maxConcentration;

    // ==================== Value at Risk ====================

    private BigDecimal maxVar95;
    private BigDecimal maxVar99;

    // ==================== Counts ====================

    /** Maximum number of open (pending + active) positions. */
    private Integer maxPositionCount;

    // ==================== Alerting ====================

    @Builder.Default
    private boolean alertsEnabled = true;

    /** How long acknowledged or resolved alerts are kept. Null keeps them forever. */
    private Duration alertRetention;
}

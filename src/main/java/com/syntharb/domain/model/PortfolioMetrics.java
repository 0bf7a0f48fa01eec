package com.syntharb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Portfolio-wide risk and performance snapshot.
 *
 * <p>Always derived from the full current position set (never accumulated), so two
 * reads of the same snapshot version are identical. {@code snapshotVersion} is the
 * tracker's mutation counter at the time of computation.
 */
@Value
@Builder
public class PortfolioMetrics {

    long snapshotVersion;

    int totalPositions;
    int pendingPositions;
    int activePositions;
    int completedPositions;
    int cancelledPositions;

    /** Σ current exposure over ACTIVE positions. */
    BigDecimal totalExposure;

    /** Σ profit × confidence over ACTIVE positions. */
    BigDecimal totalExpectedPnl;

    /** Σ realized PnL over closed positions. */
    BigDecimal totalRealizedPnl;

    /** Parametric VaR at 95% over the closed-position PnL distribution. Zero below two samples. */
    BigDecimal var95;

    /** Parametric VaR at 99% over the closed-position PnL distribution. Zero below two samples. */
    BigDecimal var99;

    /** Mean realized PnL over its standard deviation. Zero when there is no volatility. */
    BigDecimal sharpeRatio;

    /** Largest peak-to-trough drop of the cumulative realized PnL curve. */
    BigDecimal maxDrawdown;

    /** Fraction of COMPLETED positions with positive realized PnL. */
    BigDecimal winRate;

    long averageHoldingPeriodMs;

    /** Total realized PnL divided by max(1, total exposure). */
    BigDecimal riskAdjustedReturn;

    public int getOpenPositions() {
        return pendingPositions + activePositions;
    }
}

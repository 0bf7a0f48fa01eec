package com.syntharb.tracker;

import com.syntharb.domain.model.MarketLeg;
import java.math.BigDecimal;
import java.util.List;

/**
 * Pure functions over a position's legs. Always recomputed from the full leg list so
 * repeated fills never accumulate rounding drift.
 */
public final class ExposureCalculator {

    private ExposureCalculator() {}

    /** Signed Σ fillPrice × fillQuantity over legs with a fill. */
    public static BigDecimal netNotional(List<MarketLeg> legs) {
        BigDecimal total = BigDecimal.ZERO;
        for (MarketLeg leg : legs) {
            total = total.add(leg.fillNotional());
        }
        return total;
    }

    /**
     * Current exposure: magnitude of the net notional. Odds-style prices are negative, so
     * a -110 × 1000 fill is 110000 of exposure.
     */
    public static BigDecimal exposure(List<MarketLeg> legs) {
        return netNotional(legs).abs();
    }

    /** Σ commission over legs with a fill. */
    public static BigDecimal totalCommission(List<MarketLeg> legs) {
        BigDecimal total = BigDecimal.ZERO;
        for (MarketLeg leg : legs) {
            if (leg.getStatus() != null && leg.getStatus().hasFill() && leg.getCommission() != null) {
                total = total.add(leg.getCommission());
            }
        }
        return total;
    }
}

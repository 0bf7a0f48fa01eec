package com.syntharb.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Risk snapshot of a single position, replaced wholesale on every leg update.
 */
@Value
@Builder
public class PositionRisk {

    public static final PositionRisk NONE = PositionRisk.builder()
            .currentExposure(BigDecimal.ZERO)
            .peakExposure(BigDecimal.ZERO)
            .build();

    /** Net notional across legs with fills. Recomputed from the legs, never accumulated. */
    BigDecimal currentExposure;

    /** Highest exposure observed over the position's lifetime. */
    BigDecimal peakExposure;
}

package com.syntharb.domain.model;

import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One leg of a synthetic position.
 *
 * <p>Owned by its parent {@link SyntheticPosition}. Fill fields are only written by
 * the PositionTracker's leg-execution path; everything handed out to callers is a copy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketLeg {

    private int index;
    private String market;
    private String exchange;
    private TradeSide side;
    private BigDecimal requestedQuantity;
    private BigDecimal targetPrice;

    private LegStatus status;
    private BigDecimal fillPrice;
    private BigDecimal fillQuantity;
    private BigDecimal commission;
    private Instant filledAt;

    public static MarketLeg pending(int index, LegDefinition definition) {
        return MarketLeg.builder()
                .index(index)
                .market(definition.getMarket())
                .exchange(definition.getExchange())
                .side(definition.getSide())
                .requestedQuantity(definition.getQuantity())
                .targetPrice(definition.getTargetPrice())
                .status(LegStatus.PENDING)
                .build();
    }

    /** Notional of this leg's fill, or zero if the leg carries no fill. */
    public BigDecimal fillNotional() {
        if (status == null || !status.hasFill() || fillPrice == null || fillQuantity == null) {
            return BigDecimal.ZERO;
        }
        return fillPrice.multiply(fillQuantity);
    }

    public MarketLeg copy() {
        return toBuilder().build();
    }
}

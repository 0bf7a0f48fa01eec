package com.syntharb.domain.model;

import com.syntharb.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A detected price discrepancy for one symbol between two exchanges.
 *
 * <p>When {@code legs} is empty the opportunity describes the classic two-leg trade:
 * buy on exchange1 at price1 and sell on exchange2 at price2. Multi-leg synthetic
 * markets supply their legs explicitly.
 *
 * <p>Invariants (checked by the validator): exchange1 ≠ exchange2, price1 ≠ price2,
 * profit &gt; 0 and confidence in [0, 1].
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArbitrageOpportunity {

    private String id;
    private String symbol;

    /** Sport or market family, used for concentration and risk breakdowns. Optional. */
    private String sport;

    private String exchange1;
    private String exchange2;
    private BigDecimal price1;
    private BigDecimal price2;
    private BigDecimal profit;

    /** Confidence in the opportunity, 0..1. Expected PnL is profit weighted by confidence. */
    private BigDecimal confidence;

    private Long timestamp;

    /** Requested size for the default two legs. Defaults to 1 when absent. */
    private BigDecimal quantity;

    @Builder.Default
    private List<LegDefinition> legs = new ArrayList<>();

    /**
     * Resolves the legs a new position starts with: the explicit multi-leg
     * definition if present, otherwise buy on exchange1 and sell on exchange2.
     */
    public List<LegDefinition> resolveLegs() {
        if (legs != null && !legs.isEmpty()) {
            return legs.stream().map(leg -> leg.toBuilder().build()).toList();
        }
        BigDecimal requested = quantity != null ? quantity : BigDecimal.ONE;
        return List.of(
                LegDefinition.builder()
                        .market(symbol)
                        .exchange(exchange1)
                        .side(TradeSide.BUY)
                        .quantity(requested)
                        .targetPrice(price1)
                        .build(),
                LegDefinition.builder()
                        .market(symbol)
                        .exchange(exchange2)
                        .side(TradeSide.SELL)
                        .quantity(requested)
                        .targetPrice(price2)
                        .build());
    }

    /** Deep copy so that callers cannot mutate an opportunity held by a position. */
    public ArbitrageOpportunity copy() {
        List<LegDefinition> copiedLegs = legs == null
                ? new ArrayList<>()
                : new ArrayList<>(legs.stream().map(leg -> leg.toBuilder().build()).toList());
        return toBuilder().legs(copiedLegs).build();
    }
}

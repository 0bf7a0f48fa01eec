package com.syntharb.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Order book snapshot for one symbol.
 *
 * <p>Bids are expected in strictly descending price order, asks in strictly ascending
 * order, and the best bid must be below the best ask. These rules are enforced by
 * the validator, not by construction, so that malformed books can still be reported.
 */
@Value
@Builder
public class MarketData {

    String symbol;

    @Singular
    List<PriceLevel> bids;

    @Singular
    List<PriceLevel> asks;

    Long timestamp;
    Long sequence;
}

package com.syntharb.validation;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Structural problem with an order book snapshot: crossed book or a non-monotonic ladder.
 */
@Value
@Builder
public class MarketDataIssue {

    public enum Type {
        INVALID_SPREAD("invalid_spread"),
        INVALID_BID_ORDERING("invalid_bid_ordering"),
        INVALID_ASK_ORDERING("invalid_ask_ordering");

        private final String code;

        Type(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    Type type;
    String symbol;
    BigDecimal bestBid;
    BigDecimal bestAsk;

    /** Ladder level of the offending entry, null for spread issues. */
    Integer level;

    String message;
}

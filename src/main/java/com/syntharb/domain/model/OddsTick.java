package com.syntharb.domain.model;

import com.syntharb.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One market observation delivered by the upstream odds feed.
 *
 * <p>Ticks are immutable once parsed. Fields the feed omitted (or sent with the wrong
 * type) are left null so that the validator can report every violated field at once.
 */
@Value
@Builder
public class OddsTick {

    String id;

    /** Feed timestamp (epoch ms or ns, depending on the feed). Must be non-decreasing per stream. */
    Long timestamp;

    String symbol;
    BigDecimal price;
    BigDecimal size;
    String exchange;
    TradeSide side;

    /** Optional feed sequence number. Strictly increasing when present. */
    Long sequence;
}

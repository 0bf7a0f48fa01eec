package com.syntharb.domain.model;

import com.syntharb.domain.enums.TradeSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target market for one leg of a multi-leg synthetic position.
 *
 * <p>Quantity is the requested (not yet filled) size. Target price is the price
 * quoted when the opportunity was detected; the actual fill price may differ.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LegDefinition {

    private String market;
    private String exchange;
    private TradeSide side;
    private BigDecimal quantity;
    private BigDecimal targetPrice;
}

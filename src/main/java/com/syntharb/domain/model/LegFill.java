package com.syntharb.domain.model;

import com.syntharb.domain.enums.LegStatus;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution report for one leg, as delivered by the execution venue.
 *
 * <p>Fill price is signed: odds-style markets quote negative prices (e.g. -110).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LegFill {

    private LegStatus status;
    private BigDecimal fillPrice;
    private BigDecimal fillQuantity;
    private BigDecimal commission;
}

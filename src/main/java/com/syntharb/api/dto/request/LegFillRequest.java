package com.syntharb.api.dto.request;

import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.model.LegFill;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class LegFillRequest {

    /** FILLED, PARTIAL or CANCELLED. */
    @NotNull
    private LegStatus status;

    /** Signed fill price. Odds-style markets quote negative prices. */
    private BigDecimal fillPrice;

    private BigDecimal fillQuantity;

    @PositiveOrZero
    private BigDecimal commission;

    public LegFill toLegFill() {
        return LegFill.builder()
                .status(status)
                .fillPrice(fillPrice)
                .fillQuantity(fillQuantity)
                .commission(commission)
                .build();
    }
}

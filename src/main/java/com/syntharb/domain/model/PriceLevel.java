package com.syntharb.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/**
 * A single price/size level of an order book ladder.
 */
@Value(staticConstructor = "of")
public class PriceLevel {

    BigDecimal price;
    BigDecimal size;

    public static PriceLevel of(double price, double size) {
        return of(BigDecimal.valueOf(price), BigDecimal.valueOf(size));
    }
}

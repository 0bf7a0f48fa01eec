package com.syntharb.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Side of a tick or a position leg. Wire form is lower case ("buy"/"sell").
 */
public enum TradeSide {
    BUY,
    SELL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient lookup used by the feed parsers.
     *
     * @return the side, or null if the value is not a recognised side
     */
    @JsonCreator
    public static TradeSide fromWire(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TradeSide side : values()) {
            if (side.name().equals(normalized)) {
                return side;
            }
        }
        return null;
    }
}

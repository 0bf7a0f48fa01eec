package com.syntharb.validation;

import com.syntharb.domain.enums.TradeSide;
import com.syntharb.domain.model.MarketData;
import com.syntharb.domain.model.OddsTick;
import com.syntharb.domain.model.PriceLevel;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Fixed little-endian record layouts of the legacy binary feed. Strings are NUL-padded UTF-8.
 *
 * <pre>
 * tick:        id[16] @0 | u64 timestamp @16 | symbol[8] @24 | f64 price @32 | f64 size @40
 *              | exchange[8] @48 | u8 side @56 (0 = buy)
 * market data: symbol[8] @0 | u64 timestamp @8 | u32 sequence @16 | u16 bidCount @20
 *              | u16 askCount @22 | (f64 price, f64 size) pairs from @24, bids first
 * </pre>
 */
public final class LegacyBinaryLayout {

    public static final int TICK_ID_OFFSET = 0;
    public static final int TICK_ID_LENGTH = 16;
    public static final int TICK_TIMESTAMP_OFFSET = 16;
    public static final int TICK_SYMBOL_OFFSET = 24;
    public static final int TICK_SYMBOL_LENGTH = 8;
    public static final int TICK_PRICE_OFFSET = 32;
    public static final int TICK_SIZE_OFFSET = 40;
    public static final int TICK_EXCHANGE_OFFSET = 48;
    public static final int TICK_EXCHANGE_LENGTH = 8;
    public static final int TICK_SIDE_OFFSET = 56;
    public static final int TICK_RECORD_LENGTH = 57;

    public static final int BOOK_SYMBOL_OFFSET = 0;
    public static final int BOOK_SYMBOL_LENGTH = 8;
    public static final int BOOK_TIMESTAMP_OFFSET = 8;
    public static final int BOOK_SEQUENCE_OFFSET = 16;
    public static final int BOOK_BID_COUNT_OFFSET = 20;
    public static final int BOOK_ASK_COUNT_OFFSET = 22;
    public static final int BOOK_LEVELS_OFFSET = 24;
    public static final int BOOK_LEVEL_LENGTH = 16;

    private LegacyBinaryLayout() {}

    static OddsTick decodeTick(byte[] bytes) {
        if (bytes.length < TICK_RECORD_LENGTH) {
            throw new IllegalArgumentException(
                    "Binary tick needs " + TICK_RECORD_LENGTH + " bytes, got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        return OddsTick.builder()
                .id(readString(bytes, TICK_ID_OFFSET, TICK_ID_LENGTH))
                .timestamp(buffer.getLong(TICK_TIMESTAMP_OFFSET))
                .symbol(readString(bytes, TICK_SYMBOL_OFFSET, TICK_SYMBOL_LENGTH))
                .price(toDecimal(buffer.getDouble(TICK_PRICE_OFFSET)))
                .size(toDecimal(buffer.getDouble(TICK_SIZE_OFFSET)))
                .exchange(readString(bytes, TICK_EXCHANGE_OFFSET, TICK_EXCHANGE_LENGTH))
                .side(bytes[TICK_SIDE_OFFSET] == 0 ? TradeSide.BUY : TradeSide.SELL)
                .build();
    }

    static MarketData decodeMarketData(byte[] bytes) {
        if (bytes.length < BOOK_LEVELS_OFFSET) {
            throw new IllegalArgumentException(
                    "Binary market data needs at least " + BOOK_LEVELS_OFFSET + " bytes, got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int bidCount = Short.toUnsignedInt(buffer.getShort(BOOK_BID_COUNT_OFFSET));
        int askCount = Short.toUnsignedInt(buffer.getShort(BOOK_ASK_COUNT_OFFSET));
        int required = BOOK_LEVELS_OFFSET + (bidCount + askCount) * BOOK_LEVEL_LENGTH;
        if (bytes.length < required) {
            throw new IllegalArgumentException("Binary market data declares " + bidCount + " bids and " + askCount
                    + " asks, needs " + required + " bytes, got " + bytes.length);
        }

        MarketData.MarketDataBuilder builder = MarketData.builder()
                .symbol(readString(bytes, BOOK_SYMBOL_OFFSET, BOOK_SYMBOL_LENGTH))
                .timestamp(buffer.getLong(BOOK_TIMESTAMP_OFFSET))
                .sequence(Integer.toUnsignedLong(buffer.getInt(BOOK_SEQUENCE_OFFSET)));
        int offset = BOOK_LEVELS_OFFSET;
        for (int i = 0; i < bidCount; i++, offset += BOOK_LEVEL_LENGTH) {
            builder.bid(readLevel(buffer, offset));
        }
        for (int i = 0; i < askCount; i++, offset += BOOK_LEVEL_LENGTH) {
            builder.ask(readLevel(buffer, offset));
        }
        return builder.build();
    }

    private static PriceLevel readLevel(ByteBuffer buffer, int offset) {
        return PriceLevel.of(toDecimal(buffer.getDouble(offset)), toDecimal(buffer.getDouble(offset + 8)));
    }

    private static String readString(byte[] bytes, int offset, int length) {
        int end = offset;
        while (end < offset + length && bytes[end] != 0) {
            end++;
        }
        return new String(bytes, offset, end - offset, StandardCharsets.UTF_8);
    }

    private static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        return BigDecimal.valueOf(value);
    }
}

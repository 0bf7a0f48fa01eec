package com.syntharb.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syntharb.domain.enums.FeedFormat;
import com.syntharb.domain.enums.TradeSide;
import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.MarketData;
import com.syntharb.domain.model.OddsTick;
import com.syntharb.domain.model.PriceLevel;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw feed records into validated domain values.
 *
 * <p>Supported formats:
 * <ul>
 *   <li>JSON: direct decode. Fields with the wrong type are left unset and reported by validation.</li>
 *   <li>CSV: positional columns {@code id,timestamp,symbol,price,size,exchange,side[,sequence]}.
 *       Malformed numbers coerce to 0 and an empty side means buy.</li>
 *   <li>BINARY: the fixed legacy layout in {@link LegacyBinaryLayout}.</li>
 * </ul>
 *
 * <p>No method here throws for bad input. Decoding failures come back as a
 * {@link ParseError.Kind#MALFORMED} error, and schema or rule violations as a
 * {@link ParseError.Kind#VALIDATION} error listing every violated field.
 */
@Slf4j
@Component
public class DataParser {

    static final String[] CSV_COLUMNS = {"id", "timestamp", "symbol", "price", "size", "exchange", "side"};
    static final String CSV_SEQUENCE_COLUMN = "sequence";

    private final ObjectMapper objectMapper;
    private final DataValidator dataValidator;

    public DataParser(ObjectMapper objectMapper, DataValidator dataValidator) {
        this.objectMapper = objectMapper;
        this.dataValidator = dataValidator;
    }

    // ---- Ticks ----

    public ParseResult<OddsTick> parseTick(String raw, FeedFormat format) {
        if (raw == null) {
            return ParseResult.failure(ParseError.malformed("Tick payload is empty"));
        }
        return switch (format) {
            case JSON -> validated(decodeJsonTick(raw));
            case CSV -> validated(decodeCsvTick(raw));
            case BINARY -> ParseResult.failure(
                    ParseError.unsupported("Binary ticks must be supplied as raw bytes"));
        };
    }

    /** Byte-oriented entry point. JSON and CSV payloads are decoded as UTF-8 text. */
    public ParseResult<OddsTick> parseTick(byte[] raw, FeedFormat format) {
        if (raw == null) {
            return ParseResult.failure(ParseError.malformed("Tick payload is empty"));
        }
        if (format == FeedFormat.BINARY) {
            try {
                return validated(ParseResult.success(LegacyBinaryLayout.decodeTick(raw)));
            } catch (IllegalArgumentException e) {
                return ParseResult.failure(ParseError.malformed(e.getMessage()));
            }
        }
        return parseTick(new String(raw, StandardCharsets.UTF_8), format);
    }

    public BatchParseResult<OddsTick> parseTicksBatch(List<String> raws, FeedFormat format) {
        return parseBatch(raws, raw -> parseTick(raw, format));
    }

    public BatchParseResult<OddsTick> parseBinaryTicksBatch(List<byte[]> raws) {
        return parseBatch(raws, raw -> parseTick(raw, FeedFormat.BINARY));
    }

    /** Binary records carried as Base64 text. A record that does not decode is MALFORMED at its index. */
    public BatchParseResult<OddsTick> parseBase64TicksBatch(List<String> raws) {
        return parseBatch(raws, this::parseBase64Tick);
    }

    private ParseResult<OddsTick> parseBase64Tick(String raw) {
        if (raw == null) {
            return ParseResult.failure(ParseError.malformed("Tick payload is empty"));
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(raw);
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(ParseError.malformed("Record is not valid Base64: " + e.getMessage()));
        }
        return parseTick(decoded, FeedFormat.BINARY);
    }

    // ---- Market data ----

    public ParseResult<MarketData> parseMarketData(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(ParseError.malformed("Invalid market data JSON: " + e.getOriginalMessage()));
        }
        if (node == null || !node.isObject()) {
            return ParseResult.failure(ParseError.malformed("Market data JSON must be an object"));
        }

        MarketData.MarketDataBuilder builder = MarketData.builder()
                .symbol(text(node, "symbol"))
                .timestamp(longValue(node, "timestamp"))
                .sequence(longValue(node, "sequence"));
        try {
            readLevels(node.get("bids"), "bids").forEach(builder::bid);
            readLevels(node.get("asks"), "asks").forEach(builder::ask);
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(ParseError.malformed(e.getMessage()));
        }
        return validatedMarketData(builder.build());
    }

    public ParseResult<MarketData> parseMarketData(byte[] binary) {
        if (binary == null) {
            return ParseResult.failure(ParseError.malformed("Market data payload is empty"));
        }
        try {
            return validatedMarketData(LegacyBinaryLayout.decodeMarketData(binary));
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(ParseError.malformed(e.getMessage()));
        }
    }

    // ---- Opportunities ----

    public ParseResult<ArbitrageOpportunity> parseArbitrageOpportunity(String json) {
        ArbitrageOpportunity opportunity;
        try {
            opportunity = objectMapper
                    .readerFor(ArbitrageOpportunity.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(ParseError.malformed("Invalid opportunity JSON: " + e.getOriginalMessage()));
        }
        if (opportunity == null) {
            return ParseResult.failure(ParseError.malformed("Opportunity JSON must be an object"));
        }
        ValidationResult<ArbitrageOpportunity> result = dataValidator.validateArbitrageOpportunity(opportunity);
        return result.isValid()
                ? ParseResult.success(opportunity)
                : ParseResult.failure(ParseError.validation(result.getErrors()));
    }

    // ---- CSV documents ----

    /** Renders ticks as a CSV document with a header line. */
    public String toCsv(List<OddsTick> ticks) {
        boolean withSequence = ticks.stream().anyMatch(tick -> tick.getSequence() != null);
        StringBuilder csv = new StringBuilder(String.join(",", CSV_COLUMNS));
        if (withSequence) {
            csv.append(',').append(CSV_SEQUENCE_COLUMN);
        }
        csv.append('\n');
        for (OddsTick tick : ticks) {
            csv.append(nullToEmpty(tick.getId())).append(',')
                    .append(tick.getTimestamp() != null ? tick.getTimestamp() : "").append(',')
                    .append(nullToEmpty(tick.getSymbol())).append(',')
                    .append(tick.getPrice() != null ? tick.getPrice().toPlainString() : "").append(',')
                    .append(tick.getSize() != null ? tick.getSize().toPlainString() : "").append(',')
                    .append(nullToEmpty(tick.getExchange())).append(',')
                    .append(tick.getSide() != null ? tick.getSide().wireName() : "");
            if (withSequence) {
                csv.append(',').append(tick.getSequence() != null ? tick.getSequence() : "");
            }
            csv.append('\n');
        }
        return csv.toString();
    }

    /**
     * Reads a CSV document whose first line names the columns. Rows that fail to parse
     * or validate are dropped.
     */
    public List<OddsTick> fromCsv(String text) {
        List<OddsTick> ticks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return ticks;
        }
        String[] lines = text.split("\\r?\\n");
        String[] header = lines[0].split(",", -1);
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isBlank()) {
                continue;
            }
            String[] values = lines[i].split(",", -1);
            Map<String, String> row = new HashMap<>();
            for (int c = 0; c < header.length && c < values.length; c++) {
                row.put(header[c].trim().toLowerCase(Locale.ROOT), values[c].trim());
            }
            OddsTick tick = csvTick(
                    row.get("id"),
                    row.get("timestamp"),
                    row.get("symbol"),
                    row.get("price"),
                    row.get("size"),
                    row.get("exchange"),
                    row.get("side"),
                    row.get(CSV_SEQUENCE_COLUMN));
            ValidationResult<OddsTick> result = dataValidator.validateOddsTick(tick);
            if (result.isValid()) {
                ticks.add(tick);
            } else {
                log.debug("Dropping CSV row {}: {}", i, result.getErrors());
            }
        }
        return ticks;
    }

    // ---- Internals ----

    private <R> BatchParseResult<OddsTick> parseBatch(List<R> raws, Function<R, ParseResult<OddsTick>> parser) {
        List<OddsTick> parsed = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        for (int i = 0; i < raws.size(); i++) {
            ParseResult<OddsTick> result = parser.apply(raws.get(i));
            if (result.isSuccess()) {
                parsed.add(result.getData());
            } else {
                errors.add(result.getError().atIndex(i));
            }
        }
        if (!errors.isEmpty()) {
            log.debug("Batch parse: {} of {} records rejected", errors.size(), raws.size());
        }
        return new BatchParseResult<>(parsed, errors, raws.size());
    }

    private ParseResult<OddsTick> validated(ParseResult<OddsTick> decoded) {
        if (!decoded.isSuccess()) {
            return decoded;
        }
        ValidationResult<OddsTick> result = dataValidator.validateOddsTick(decoded.getData());
        return result.isValid()
                ? ParseResult.success(decoded.getData())
                : ParseResult.failure(ParseError.validation(result.getErrors()));
    }

    private ParseResult<MarketData> validatedMarketData(MarketData marketData) {
        ValidationResult<MarketData> result = dataValidator.validateMarketData(marketData);
        return result.isValid()
                ? ParseResult.success(marketData)
                : ParseResult.failure(ParseError.validation(result.getErrors()));
    }

    private ParseResult<OddsTick> decodeJsonTick(String raw) {
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return ParseResult.failure(ParseError.malformed("Invalid tick JSON: " + e.getOriginalMessage()));
        }
        if (node == null || !node.isObject()) {
            return ParseResult.failure(ParseError.malformed("Tick JSON must be an object"));
        }
        String side = text(node, "side");
        return ParseResult.success(OddsTick.builder()
                .id(text(node, "id"))
                .timestamp(longValue(node, "timestamp"))
                .symbol(text(node, "symbol"))
                .price(decimal(node, "price"))
                .size(decimal(node, "size"))
                .exchange(text(node, "exchange"))
                .side(TradeSide.fromWire(side))
                .sequence(longValue(node, "sequence"))
                .build());
    }

    private ParseResult<OddsTick> decodeCsvTick(String raw) {
        String[] values = raw.trim().split(",", -1);
        if (values.length < CSV_COLUMNS.length) {
            return ParseResult.failure(ParseError.malformed(
                    "CSV tick needs " + CSV_COLUMNS.length + " columns, got " + values.length));
        }
        return ParseResult.success(csvTick(
                values[0].trim(),
                values[1].trim(),
                values[2].trim(),
                values[3].trim(),
                values[4].trim(),
                values[5].trim(),
                values[6].trim(),
                values.length > CSV_COLUMNS.length ? values[7].trim() : null));
    }

    private OddsTick csvTick(
            String id,
            String timestamp,
            String symbol,
            String price,
            String size,
            String exchange,
            String side,
            String sequence) {
        return OddsTick.builder()
                .id(id)
                .timestamp(coerceLong(timestamp))
                .symbol(symbol)
                .price(coerceDecimal(price))
                .size(coerceDecimal(size))
                .exchange(exchange)
                .side(side == null || side.isEmpty() ? TradeSide.BUY : TradeSide.fromWire(side))
                .sequence(sequence == null || sequence.isEmpty() ? null : coerceLong(sequence))
                .build();
    }

    private List<PriceLevel> readLevels(JsonNode levels, String side) {
        List<PriceLevel> result = new ArrayList<>();
        if (levels == null || levels.isNull()) {
            return result;
        }
        if (!levels.isArray()) {
            throw new IllegalArgumentException(side + " must be an array");
        }
        for (int i = 0; i < levels.size(); i++) {
            JsonNode level = levels.get(i);
            JsonNode price;
            JsonNode size;
            if (level.isArray() && level.size() >= 2) {
                price = level.get(0);
                size = level.get(1);
            } else if (level.isObject()) {
                price = level.get("price");
                size = level.get("size");
            } else {
                throw new IllegalArgumentException(side + "[" + i + "] must be [price, size] or {price, size}");
            }
            if (price == null || !price.isNumber() || size == null || !size.isNumber()) {
                throw new IllegalArgumentException(side + "[" + i + "] price and size must be numbers");
            }
            result.add(PriceLevel.of(price.decimalValue(), size.decimalValue()));
        }
        return result;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.isTextual() ? value.textValue() : null;
    }

    private static Long longValue(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.canConvertToLong() ? value.longValue() : null;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return null;
        }
        return value.decimalValue();
    }

    static long coerceLong(String value) {
        if (value == null || value.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            BigDecimal decimal = coerceDecimal(value);
            return decimal.longValue();
        }
    }

    static BigDecimal coerceDecimal(String value) {
        if (value == null || value.isEmpty()) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

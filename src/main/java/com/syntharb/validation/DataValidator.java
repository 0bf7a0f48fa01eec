package com.syntharb.validation;

import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.LegDefinition;
import com.syntharb.domain.model.MarketData;
import com.syntharb.domain.model.OddsTick;
import com.syntharb.domain.model.PriceLevel;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Schema and business-rule validation for feed records.
 *
 * <p>Every check runs and every violation is reported; validation never stops at the
 * first bad field. The validator is stateless and never throws for bad input, so it can
 * be shared across ingestion threads.
 *
 * <p>Rules:
 * <ul>
 *   <li>Ticks: non-empty id (max 64), positive timestamp, non-empty symbol and exchange
 *       (max 32), positive price and size, a known side, non-negative sequence</li>
 *   <li>Order books: positive level prices and sizes, best bid below best ask, bids strictly
 *       descending and asks strictly ascending</li>
 *   <li>Opportunities: two distinct exchanges, two distinct prices, positive profit,
 *       confidence within [0, 1]</li>
 * </ul>
 */
@Slf4j
@Component
public class DataValidator {

    public static final int MAX_ID_LENGTH = 64;
    public static final int MAX_SYMBOL_LENGTH = 32;
    public static final int MAX_EXCHANGE_LENGTH = 32;

    /** Ticks closer together than this are treated as sharing a timestamp. */
    static final long DUPLICATE_TIMESTAMP_TOLERANCE = 1L;

    public ValidationResult<OddsTick> validateOddsTick(OddsTick tick) {
        if (tick == null) {
            return ValidationResult.invalid(List.of(ValidationError.of("tick", "required", "tick is required", null)));
        }
        List<ValidationError> errors = new ArrayList<>();
        requireText(errors, "id", tick.getId(), MAX_ID_LENGTH);
        if (tick.getTimestamp() == null) {
            errors.add(ValidationError.of("timestamp", "required", "timestamp is required", null));
        } else if (tick.getTimestamp() <= 0) {
            errors.add(ValidationError.of(
                    "timestamp", "not_positive", "timestamp must be positive", tick.getTimestamp()));
        }
        requireText(errors, "symbol", tick.getSymbol(), MAX_SYMBOL_LENGTH);
        requirePositive(errors, "price", tick.getPrice());
        requirePositive(errors, "size", tick.getSize());
        requireText(errors, "exchange", tick.getExchange(), MAX_EXCHANGE_LENGTH);
        if (tick.getSide() == null) {
            errors.add(ValidationError.of("side", "invalid_enum", "side must be one of buy, sell", null));
        }
        if (tick.getSequence() != null && tick.getSequence() < 0) {
            errors.add(ValidationError.of(
                    "sequence", "negative", "sequence must not be negative", tick.getSequence()));
        }
        return errors.isEmpty() ? ValidationResult.valid(tick) : ValidationResult.invalid(errors);
    }

    /**
     * Validates a batch. Valid ticks are returned even when others fail; every error
     * carries the index of the tick it belongs to.
     */
    public ValidationResult<List<OddsTick>> validateOddsTicks(List<OddsTick> ticks) {
        List<OddsTick> accepted = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        for (int i = 0; i < ticks.size(); i++) {
            ValidationResult<OddsTick> result = validateOddsTick(ticks.get(i));
            if (result.isValid()) {
                accepted.add(result.getData());
            } else {
                int index = i;
                result.getErrors().forEach(error -> errors.add(error.atIndex(index)));
            }
        }
        return ValidationResult.of(accepted, errors);
    }

    /**
     * Checks ordering across a stream of ticks. Compares each tick with its predecessor
     * and accumulates all issues rather than stopping at the first one.
     */
    public SequenceValidationResult validateTickSequence(List<OddsTick> ticks) {
        List<SequenceIssue> issues = new ArrayList<>();
        for (int i = 1; i < ticks.size(); i++) {
            OddsTick previous = ticks.get(i - 1);
            OddsTick current = ticks.get(i);

            if (previous.getTimestamp() != null && current.getTimestamp() != null) {
                long prevTs = previous.getTimestamp();
                long currTs = current.getTimestamp();
                if (currTs < prevTs) {
                    issues.add(SequenceIssue.builder()
                            .type(SequenceIssue.Type.TIMESTAMP_OUT_OF_ORDER)
                            .index(i)
                            .current(currTs)
                            .expected(prevTs)
                            .message("Tick " + current.getId() + " timestamp " + currTs + " is before " + prevTs)
                            .build());
                }
                if (Math.abs(currTs - prevTs) < DUPLICATE_TIMESTAMP_TOLERANCE) {
                    issues.add(SequenceIssue.builder()
                            .type(SequenceIssue.Type.DUPLICATE_TIMESTAMP)
                            .index(i)
                            .current(currTs)
                            .expected(prevTs)
                            .message("Tick " + current.getId() + " shares timestamp " + currTs + " with its predecessor")
                            .build());
                }
            }

            if (previous.getSequence() != null && current.getSequence() != null
                    && current.getSequence() <= previous.getSequence()) {
                issues.add(SequenceIssue.builder()
                        .type(SequenceIssue.Type.SEQUENCE_OUT_OF_ORDER)
                        .index(i)
                        .current(current.getSequence())
                        .expected(previous.getSequence() + 1)
                        .message("Tick " + current.getId() + " sequence " + current.getSequence()
                                + " does not follow " + previous.getSequence())
                        .build());
            }
        }
        if (!issues.isEmpty()) {
            log.debug("Sequence validation found {} issues in {} ticks", issues.size(), ticks.size());
        }
        return new SequenceValidationResult(issues, ticks.size());
    }

    /**
     * Validates one order book snapshot: field schema plus book integrity. Integrity
     * violations are reported as errors coded by issue type ({@code invalid_spread} etc.).
     */
    public ValidationResult<MarketData> validateMarketData(MarketData marketData) {
        if (marketData == null) {
            return ValidationResult.invalid(
                    List.of(ValidationError.of("marketData", "required", "market data is required", null)));
        }
        List<ValidationError> errors = new ArrayList<>();
        requireText(errors, "symbol", marketData.getSymbol(), MAX_SYMBOL_LENGTH);
        if (marketData.getTimestamp() != null && marketData.getTimestamp() < 0) {
            errors.add(ValidationError.of(
                    "timestamp", "negative", "timestamp must not be negative", marketData.getTimestamp()));
        }
        validateLevels(errors, "bids", marketData.getBids());
        validateLevels(errors, "asks", marketData.getAsks());

        for (MarketDataIssue issue : integrityIssues(marketData)) {
            String field = issue.getType() == MarketDataIssue.Type.INVALID_SPREAD
                    ? "spread"
                    : issue.getType() == MarketDataIssue.Type.INVALID_BID_ORDERING ? "bids" : "asks";
            errors.add(ValidationError.of(field, issue.getType().getCode(), issue.getMessage(), issue.getLevel()));
        }
        return errors.isEmpty() ? ValidationResult.valid(marketData) : ValidationResult.invalid(errors);
    }

    /** Book-integrity checks only, across many snapshots. */
    public MarketDataValidationResult validateMarketDataIntegrity(List<MarketData> markets) {
        List<MarketDataIssue> issues = new ArrayList<>();
        for (MarketData marketData : markets) {
            issues.addAll(integrityIssues(marketData));
        }
        return new MarketDataValidationResult(issues, markets.size());
    }

    public ValidationResult<ArbitrageOpportunity> validateArbitrageOpportunity(ArbitrageOpportunity opportunity) {
        if (opportunity == null) {
            return ValidationResult.invalid(
                    List.of(ValidationError.of("opportunity", "required", "opportunity is required", null)));
        }
        List<ValidationError> errors = new ArrayList<>();
        requireText(errors, "symbol", opportunity.getSymbol(), MAX_SYMBOL_LENGTH);
        requireText(errors, "exchange1", opportunity.getExchange1(), MAX_EXCHANGE_LENGTH);
        requireText(errors, "exchange2", opportunity.getExchange2(), MAX_EXCHANGE_LENGTH);
        if (opportunity.getExchange1() != null
                && opportunity.getExchange1().equals(opportunity.getExchange2())) {
            errors.add(ValidationError.of(
                    "exchange2", "same_exchange",
                    "Arbitrage must be between different exchanges", opportunity.getExchange2()));
        }

        // Odds prices may be negative (American odds); only presence is required.
        requirePresent(errors, "price1", opportunity.getPrice1());
        requirePresent(errors, "price2", opportunity.getPrice2());
        if (opportunity.getPrice1() != null && opportunity.getPrice2() != null
                && opportunity.getPrice1().compareTo(opportunity.getPrice2()) == 0) {
            errors.add(ValidationError.of(
                    "price2", "same_price", "Arbitrage prices must differ", opportunity.getPrice2()));
        }

        requirePositive(errors, "profit", opportunity.getProfit());

        BigDecimal confidence = opportunity.getConfidence();
        if (confidence == null) {
            errors.add(ValidationError.of("confidence", "required", "confidence is required", null));
        } else if (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0) {
            errors.add(ValidationError.of(
                    "confidence", "out_of_range", "confidence must be between 0 and 1", confidence));
        }

        if (opportunity.getQuantity() != null && opportunity.getQuantity().signum() <= 0) {
            errors.add(ValidationError.of(
                    "quantity", "not_positive", "quantity must be positive", opportunity.getQuantity()));
        }

        List<LegDefinition> legs = opportunity.getLegs();
        if (legs != null) {
            for (int i = 0; i < legs.size(); i++) {
                LegDefinition leg = legs.get(i);
                if (leg == null) {
                    errors.add(ValidationError.of(
                            "legs[" + i + "]", "required", "legs[" + i + "] is required", null));
                    continue;
                }
                String prefix = "legs[" + i + "].";
                requireText(errors, prefix + "exchange", leg.getExchange(), MAX_EXCHANGE_LENGTH);
                if (leg.getSide() == null) {
                    errors.add(ValidationError.of(
                            prefix + "side", "invalid_enum", prefix + "side must be one of buy, sell", null));
                }
                if (leg.getQuantity() != null && leg.getQuantity().signum() <= 0) {
                    errors.add(ValidationError.of(
                            prefix + "quantity", "not_positive",
                            prefix + "quantity must be positive", leg.getQuantity()));
                }
            }
        }
        return errors.isEmpty() ? ValidationResult.valid(opportunity) : ValidationResult.invalid(errors);
    }

    private List<MarketDataIssue> integrityIssues(MarketData marketData) {
        List<MarketDataIssue> issues = new ArrayList<>();
        List<PriceLevel> bids = marketData.getBids();
        List<PriceLevel> asks = marketData.getAsks();

        BigDecimal bestBid = bids.isEmpty() ? null : bids.get(0).getPrice();
        BigDecimal bestAsk = asks.isEmpty() ? null : asks.get(0).getPrice();
        if (bestBid != null && bestAsk != null && bestBid.compareTo(bestAsk) >= 0) {
            issues.add(MarketDataIssue.builder()
                    .type(MarketDataIssue.Type.INVALID_SPREAD)
                    .symbol(marketData.getSymbol())
                    .bestBid(bestBid)
                    .bestAsk(bestAsk)
                    .message("Best bid " + bestBid.toPlainString() + " is not below best ask "
                            + bestAsk.toPlainString())
                    .build());
        }

        for (int i = 1; i < bids.size(); i++) {
            BigDecimal previous = bids.get(i - 1).getPrice();
            BigDecimal current = bids.get(i).getPrice();
            if (previous != null && current != null && current.compareTo(previous) >= 0) {
                issues.add(MarketDataIssue.builder()
                        .type(MarketDataIssue.Type.INVALID_BID_ORDERING)
                        .symbol(marketData.getSymbol())
                        .bestBid(bestBid)
                        .bestAsk(bestAsk)
                        .level(i)
                        .message("Bid level " + i + " price " + current.toPlainString()
                                + " is not below " + previous.toPlainString())
                        .build());
            }
        }

        for (int i = 1; i < asks.size(); i++) {
            BigDecimal previous = asks.get(i - 1).getPrice();
            BigDecimal current = asks.get(i).getPrice();
            if (previous != null && current != null && current.compareTo(previous) <= 0) {
                issues.add(MarketDataIssue.builder()
                        .type(MarketDataIssue.Type.INVALID_ASK_ORDERING)
                        .symbol(marketData.getSymbol())
                        .bestBid(bestBid)
                        .bestAsk(bestAsk)
                        .level(i)
                        .message("Ask level " + i + " price " + current.toPlainString()
                                + " is not above " + previous.toPlainString())
                        .build());
            }
        }
        return issues;
    }

    private void validateLevels(List<ValidationError> errors, String side, List<PriceLevel> levels) {
        for (int i = 0; i < levels.size(); i++) {
            PriceLevel level = levels.get(i);
            requirePositive(errors, side + "[" + i + "].price", level.getPrice());
            requirePositive(errors, side + "[" + i + "].size", level.getSize());
        }
    }

    private void requireText(List<ValidationError> errors, String field, String value, int maxLength) {
        if (value == null || value.isBlank()) {
            errors.add(ValidationError.of(field, "required", field + " is required", value));
        } else if (value.length() > maxLength) {
            errors.add(ValidationError.of(
                    field, "too_long", field + " must be at most " + maxLength + " characters", value));
        }
    }

    private void requirePresent(List<ValidationError> errors, String field, BigDecimal value) {
        if (value == null) {
            errors.add(ValidationError.of(field, "required", field + " is required", null));
        }
    }

    private void requirePositive(List<ValidationError> errors, String field, BigDecimal value) {
        if (value == null) {
            errors.add(ValidationError.of(field, "required", field + " is required", null));
        } else if (value.signum() <= 0) {
            errors.add(ValidationError.of(field, "not_positive", field + " must be positive", value));
        }
    }
}

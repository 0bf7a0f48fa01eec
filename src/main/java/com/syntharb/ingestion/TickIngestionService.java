package com.syntharb.ingestion;

import com.syntharb.api.websocket.BroadcastServer;
import com.syntharb.domain.enums.FeedFormat;
import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.MarketData;
import com.syntharb.domain.model.OddsTick;
import com.syntharb.domain.model.PositionMetadata;
import com.syntharb.domain.model.PriceLevel;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.tracker.PositionTracker;
import com.syntharb.validation.BatchParseResult;
import com.syntharb.validation.DataParser;
import com.syntharb.validation.DataValidator;
import com.syntharb.validation.ParseResult;
import com.syntharb.validation.SequenceValidationResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for the upstream feed: parses and validates raw records, reports per-record
 * outcomes, and pushes accepted data to broadcast clients.
 *
 * <p>Bad records never abort a batch and never reach the tracker. Accepted ticks go out as
 * {@code odds-update}, accepted order books as {@code market-data} and accepted opportunities
 * as {@code arbitrage-alert}.
 */
@Service
public class TickIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TickIngestionService.class);

    public static final String TYPE_ODDS_UPDATE = "odds-update";
    public static final String TYPE_MARKET_DATA = "market-data";
    public static final String TYPE_ARBITRAGE_ALERT = "arbitrage-alert";

    static final String AUTO_OPENED_TAG = "auto-opened";

    private final DataParser dataParser;
    private final DataValidator dataValidator;
    private final BroadcastServer broadcastServer;
    private final PositionTracker positionTracker;
    private final Executor ingestionExecutor;
    private final IngestionSettings settings;

    private final AtomicLong ticksAccepted = new AtomicLong();
    private final AtomicLong ticksRejected = new AtomicLong();

    public TickIngestionService(
            DataParser dataParser,
            DataValidator dataValidator,
            BroadcastServer broadcastServer,
            PositionTracker positionTracker,
            @Qualifier("ingestionExecutor") Executor ingestionExecutor,
            IngestionSettings settings) {
        this.dataParser = dataParser;
        this.dataValidator = dataValidator;
        this.broadcastServer = broadcastServer;
        this.positionTracker = positionTracker;
        this.ingestionExecutor = ingestionExecutor;
        this.settings = settings;
    }

    // ========================
    // TICKS
    // ========================

    public IngestionReport ingestTicks(List<String> raws, FeedFormat format) {
        return process(dataParser.parseTicksBatch(raws, format), format);
    }

    public IngestionReport ingestBinaryTicks(List<byte[]> raws) {
        return process(dataParser.parseBinaryTicksBatch(raws), FeedFormat.BINARY);
    }

    /** Binary records as Base64 strings, the form they take inside a JSON request. */
    public IngestionReport ingestBase64Ticks(List<String> raws) {
        return process(dataParser.parseBase64TicksBatch(raws), FeedFormat.BINARY);
    }

    /**
     * Runs {@link #ingestTicks} on the ingestion executor. The future fails with a
     * {@link java.util.concurrent.TimeoutException} if the batch takes longer than
     * {@code timeout} (or the configured default when null).
     */
    public CompletableFuture<IngestionReport> ingestTicksAsync(List<String> raws, FeedFormat format, Duration timeout) {
        return async(() -> ingestTicks(raws, format), timeout);
    }

    public CompletableFuture<IngestionReport> ingestBinaryTicksAsync(List<byte[]> raws, Duration timeout) {
        return async(() -> ingestBinaryTicks(raws), timeout);
    }

    public CompletableFuture<IngestionReport> ingestBase64TicksAsync(List<String> raws, Duration timeout) {
        return async(() -> ingestBase64Ticks(raws), timeout);
    }

    private CompletableFuture<IngestionReport> async(Supplier<IngestionReport> work, Duration timeout) {
        Duration effective = timeout != null ? timeout : settings.getDefaultTimeout();
        return CompletableFuture.supplyAsync(work, ingestionExecutor)
                .orTimeout(effective.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((report, error) -> {
                    if (error != null) {
                        log.warn("Asynchronous ingestion failed after up to {}: {}", effective, error.toString());
                    }
                });
    }

    private IngestionReport process(BatchParseResult<OddsTick> batch, FeedFormat format) {
        SequenceValidationResult sequence = dataValidator.validateTickSequence(batch.getData());

        long deliveries = 0;
        for (OddsTick tick : batch.getData()) {
            deliveries += broadcastServer.broadcast(TYPE_ODDS_UPDATE, tickPayload(tick));
        }
        ticksAccepted.addAndGet(batch.getSuccessCount());
        ticksRejected.addAndGet(batch.getErrorCount());

        if (batch.getErrorCount() > 0 || !sequence.isValid()) {
            log.warn(
                    "Ingested {} {} ticks: {} rejected, {} sequence issues",
                    batch.getTotalProcessed(),
                    format,
                    batch.getErrorCount(),
                    sequence.getIssues().size());
        } else {
            log.debug("Ingested {} {} ticks", batch.getTotalProcessed(), format);
        }

        return IngestionReport.builder()
                .processed(batch.getTotalProcessed())
                .succeeded(batch.getSuccessCount())
                .failed(batch.getErrorCount())
                .successRate(batch.getSuccessRate())
                .errors(batch.getErrors())
                .sequenceIssues(sequence.getIssues())
                .broadcastDeliveries(deliveries)
                .build();
    }

    // ========================
    // MARKET DATA & OPPORTUNITIES
    // ========================

    public ParseResult<MarketData> ingestMarketData(String json) {
        return publishMarketData(dataParser.parseMarketData(json));
    }

    public ParseResult<MarketData> ingestMarketData(byte[] binary) {
        return publishMarketData(dataParser.parseMarketData(binary));
    }

    private ParseResult<MarketData> publishMarketData(ParseResult<MarketData> result) {
        if (result.isSuccess()) {
            broadcastServer.broadcast(TYPE_MARKET_DATA, marketDataPayload(result.getData()));
        } else {
            log.warn("Rejected market data: {}", result.getError().getMessage());
        }
        return result;
    }

    /**
     * Parses and validates an opportunity, announces it as {@code arbitrage-alert} and, when
     * {@code openPosition} is set, opens a position for it.
     */
    public OpportunityIngestionResult ingestOpportunity(String json, boolean openPosition) {
        ParseResult<ArbitrageOpportunity> result = dataParser.parseArbitrageOpportunity(json);
        if (!result.isSuccess()) {
            log.warn("Rejected opportunity: {}", result.getError().getMessage());
            return OpportunityIngestionResult.builder()
                    .accepted(false)
                    .error(result.getError())
                    .build();
        }

        ArbitrageOpportunity opportunity = result.getData();
        broadcastServer.broadcast(TYPE_ARBITRAGE_ALERT, opportunity);

        SyntheticPosition position = null;
        if (openPosition) {
            PositionMetadata metadata = PositionMetadata.builder()
                    .tags(new ArrayList<>(List.of(AUTO_OPENED_TAG)))
                    .build();
            position = positionTracker.addPosition(opportunity, metadata);
        }
        return OpportunityIngestionResult.builder()
                .accepted(true)
                .opportunity(opportunity)
                .position(position)
                .build();
    }

    // ========================
    // COUNTERS
    // ========================

    public long getTicksAccepted() {
        return ticksAccepted.get();
    }

    public long getTicksRejected() {
        return ticksRejected.get();
    }

    private Map<String, Object> tickPayload(OddsTick tick) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", tick.getId());
        payload.put("timestamp", tick.getTimestamp());
        payload.put("symbol", tick.getSymbol());
        payload.put("price", tick.getPrice());
        payload.put("size", tick.getSize());
        payload.put("exchange", tick.getExchange());
        payload.put("side", tick.getSide().wireName());
        payload.put("sequence", tick.getSequence());
        return payload;
    }

    private Map<String, Object> marketDataPayload(MarketData marketData) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("symbol", marketData.getSymbol());
        payload.put("timestamp", marketData.getTimestamp());
        payload.put("sequence", marketData.getSequence());
        payload.put("bids", levels(marketData.getBids()));
        payload.put("asks", levels(marketData.getAsks()));
        return payload;
    }

    private static List<List<Object>> levels(List<PriceLevel> levels) {
        List<List<Object>> result = new ArrayList<>();
        for (PriceLevel level : levels) {
            result.add(List.of(level.getPrice(), level.getSize()));
        }
        return result;
    }
}

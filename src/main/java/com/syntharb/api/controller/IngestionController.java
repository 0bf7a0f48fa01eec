package com.syntharb.api.controller;

import com.syntharb.api.dto.request.TickBatchRequest;
import com.syntharb.domain.enums.FeedFormat;
import com.syntharb.domain.model.MarketData;
import com.syntharb.exception.BusinessException;
import com.syntharb.exception.ErrorCode;
import com.syntharb.ingestion.IngestionReport;
import com.syntharb.ingestion.OpportunityIngestionResult;
import com.syntharb.ingestion.TickIngestionService;
import com.syntharb.validation.ParseResult;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry points for feed data.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/ingest/ticks -- batch of JSON, CSV or Base64 binary tick records; undecodable
 *       records are reported per index like any other bad record</li>
 *   <li>POST /api/ingest/market-data -- one order book snapshot (JSON)</li>
 *   <li>POST /api/ingest/opportunities?open=true|false -- one opportunity (JSON)</li>
 * </ul>
 *
 * <p>Bad records are reported in the response body, not as HTTP errors.
 */
@RestController
@RequestMapping("/api/ingest")
public class IngestionController {

    private final TickIngestionService tickIngestionService;

    public IngestionController(TickIngestionService tickIngestionService) {
        this.tickIngestionService = tickIngestionService;
    }

    @PostMapping("/ticks")
    public ResponseEntity<IngestionReport> ingestTicks(@Valid @RequestBody TickBatchRequest request) {
        if (request.getTimeoutMs() == null) {
            return ResponseEntity.ok(request.getFormat() == FeedFormat.BINARY
                    ? tickIngestionService.ingestBase64Ticks(request.getRecords())
                    : tickIngestionService.ingestTicks(request.getRecords(), request.getFormat()));
        }

        Duration timeout = Duration.ofMillis(request.getTimeoutMs());
        CompletableFuture<IngestionReport> future = request.getFormat() == FeedFormat.BINARY
                ? tickIngestionService.ingestBase64TicksAsync(request.getRecords(), timeout)
                : tickIngestionService.ingestTicksAsync(request.getRecords(), request.getFormat(), timeout);
        return ResponseEntity.ok(await(future, timeout));
    }

    @PostMapping(value = "/market-data", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ParseResult<MarketData>> ingestMarketData(@RequestBody String json) {
        return ResponseEntity.ok(tickIngestionService.ingestMarketData(json));
    }

    @PostMapping(value = "/opportunities", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OpportunityIngestionResult> ingestOpportunity(
            @RequestBody String json, @RequestParam(defaultValue = "false") boolean open) {
        return ResponseEntity.ok(tickIngestionService.ingestOpportunity(json, open));
    }

    private IngestionReport await(CompletableFuture<IngestionReport> future, Duration timeout) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Ingestion interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new BusinessException(
                        ErrorCode.INGESTION_TIMEOUT, "Ingestion did not complete within " + timeout.toMillis() + "ms");
            }
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, "Ingestion failed: " + e.getCause().getMessage());
        }
    }
}

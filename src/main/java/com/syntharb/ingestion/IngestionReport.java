package com.syntharb.ingestion;

import com.syntharb.validation.ParseError;
import com.syntharb.validation.SequenceIssue;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one batch of ticks: counts, per-index errors and ordering issues among the
 * ticks that were accepted.
 */
@Value
@Builder
public class IngestionReport {

    int processed;
    int succeeded;
    int failed;
    double successRate;

    @Builder.Default
    List<ParseError> errors = List.of();

    @Builder.Default
    List<SequenceIssue> sequenceIssues = List.of();

    /** Number of clients the accepted ticks were queued for, summed over ticks. */
    long broadcastDeliveries;
}

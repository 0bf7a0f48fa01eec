package com.syntharb.validation;

import java.util.List;
import lombok.Getter;

/**
 * Result of parsing a batch. Bad records are reported by index; they never abort
 * the rest of the batch.
 */
@Getter
public class BatchParseResult<T> {

    private final List<T> data;
    private final List<ParseError> errors;
    private final int totalProcessed;

    public BatchParseResult(List<T> data, List<ParseError> errors, int totalProcessed) {
        this.data = List.copyOf(data);
        this.errors = List.copyOf(errors);
        this.totalProcessed = totalProcessed;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public int getSuccessCount() {
        return data.size();
    }

    public int getErrorCount() {
        return errors.size();
    }

    /** Fraction of records that parsed and validated, 1.0 for an empty batch. */
    public double getSuccessRate() {
        return totalProcessed == 0 ? 1.0 : (double) getSuccessCount() / totalProcessed;
    }
}

package com.syntharb.ingestion;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Ingestion tuning, bound from {@code syntharb.ingestion.*}.
 */
@Value
@Builder
public class IngestionSettings {

    /** Applied to asynchronous ingestion when the caller supplies no timeout. */
    Duration defaultTimeout;
}

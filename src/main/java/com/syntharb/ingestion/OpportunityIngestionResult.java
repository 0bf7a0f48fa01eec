package com.syntharb.ingestion;

import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.validation.ParseError;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OpportunityIngestionResult {

    boolean accepted;
    ArbitrageOpportunity opportunity;

    /** The opened position when the caller asked for one, otherwise null. */
    SyntheticPosition position;

    ParseError error;
}

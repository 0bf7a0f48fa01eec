package com.syntharb.api.dto.request;

import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.PositionMetadata;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Opens a position for an opportunity. Business rules on the opportunity itself
 * (distinct exchanges and prices, positive profit, confidence in [0, 1]) are checked by
 * the tracker and reported field by field.
 */
@Data
public class AddPositionRequest {

    @NotNull
    private ArbitrageOpportunity opportunity;

    /** Optional. Notes, tags, assignee and free-form extras. */
    private PositionMetadata metadata;
}

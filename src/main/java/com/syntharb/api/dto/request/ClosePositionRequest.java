package com.syntharb.api.dto.request;

import com.syntharb.domain.enums.CloseReason;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.Data;

@Data
public class ClosePositionRequest {

    @NotNull
    private CloseReason reason;

    /** Recorded as zero when absent. */
    private BigDecimal realizedPnl;
}

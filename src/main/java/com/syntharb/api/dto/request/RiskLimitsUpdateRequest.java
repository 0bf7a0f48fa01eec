package com.syntharb.api.dto.request;

import com.syntharb.risk.RiskLimits;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;

/**
 * Partial update of the risk limits. Only non-null fields are applied.
 */
@Data
public class RiskLimitsUpdateRequest {

    @Positive
    private BigDecimal maxTotalExposure;

    @Positive
    private BigDecimal maxPositionExposure;

    @Positive
    @DecimalMax("1")
    private BigDecimal maxConcentration;

    @Positive
    private BigDecimal maxVar95;

    @Positive
    private BigDecimal maxVar99;

    @Positive
    private Integer maxPositionCount;

    private Boolean alertsEnabled;

    /** ISO-8601 duration, e.g. {@code P7D}. */
    private Duration alertRetention;

    public RiskLimits applyTo(RiskLimits current) {
        RiskLimits.RiskLimitsBuilder builder = current.toBuilder();
        if (maxTotalExposure != null) {
            builder.maxTotalExposure(maxTotalExposure);
        }
        if (maxPositionExposure != null) {
            builder.maxPositionExposure(maxPositionExposure);
        }
        if (maxConcentration != null) {
            builder.maxConcentration(maxConcentration);
        }
        if (maxVar95 != null) {
            builder.maxVar95(maxVar95);
        }
        if (maxVar99 != null) {
            builder.maxVar99(maxVar99);
        }
        if (maxPositionCount != null) {
            builder.maxPositionCount(maxPositionCount);
        }
        if (alertsEnabled != null) {
            builder.alertsEnabled(alertsEnabled);
        }
        if (alertRetention != null) {
            builder.alertRetention(alertRetention);
        }
        return builder.build();
    }
}

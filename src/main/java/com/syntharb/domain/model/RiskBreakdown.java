package com.syntharb.domain.model;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Exposure grouped by sport, symbol and status.
 *
 * <p>The VaR share of a bucket is the portfolio VaR95 weighted by the bucket's share
 * of total active exposure.
 */
@Value
@Builder
public class RiskBreakdown {

    Map<String, Bucket> bySport;
    Map<String, Bucket> bySymbol;
    Map<String, Bucket> byStatus;

    @Value
    @Builder
    public static class Bucket {
        BigDecimal exposure;
        BigDecimal var95Share;
        int positions;
    }
}

package com.syntharb.validation;

import java.util.List;
import lombok.Getter;

@Getter
public class MarketDataValidationResult {

    private final List<MarketDataIssue> issues;
    private final int totalMarkets;

    public MarketDataValidationResult(List<MarketDataIssue> issues, int totalMarkets) {
        this.issues = List.copyOf(issues);
        this.totalMarkets = totalMarkets;
    }

    public boolean isValid() {
        return issues.isEmpty();
    }
}

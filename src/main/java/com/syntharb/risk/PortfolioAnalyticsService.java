package com.syntharb.risk;

import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskBreakdown;
import com.syntharb.tracker.PositionSnapshot;
import com.syntharb.tracker.PositionTracker;
import org.springframework.stereotype.Service;

/**
 * Read side of the portfolio: metrics and breakdowns over the tracker's latest snapshot.
 *
 * <p>Metrics are cached per snapshot version, so repeated reads between mutations return
 * the same instance and never contend with writers.
 */
@Service
public class PortfolioAnalyticsService {

    private final PositionTracker positionTracker;
    private final PortfolioMetricsCalculator calculator;

    private volatile PortfolioMetrics cached;

    public PortfolioAnalyticsService(PositionTracker positionTracker, PortfolioMetricsCalculator calculator) {
        this.positionTracker = positionTracker;
        this.calculator = calculator;
    }

    public PortfolioMetrics getPortfolioMetrics() {
        return metricsFor(positionTracker.getSnapshot());
    }

    public RiskBreakdown getRiskBreakdown() {
        PositionSnapshot snapshot = positionTracker.getSnapshot();
        return breakdownFor(snapshot, metricsFor(snapshot));
    }

    RiskBreakdown breakdownFor(PositionSnapshot snapshot, PortfolioMetrics metrics) {
        return calculator.breakdown(snapshot, metrics.getVar95());
    }

    PortfolioMetrics metricsFor(PositionSnapshot snapshot) {
        PortfolioMetrics current = cached;
        if (current != null && current.getSnapshotVersion() == snapshot.getVersion()) {
            return current;
        }
        PortfolioMetrics computed = calculator.calculate(snapshot);
        // A concurrent reader may have cached a newer version already; never move backwards.
        if (current == null || current.getSnapshotVersion() < computed.getSnapshotVersion()) {
            cached = computed;
        }
        return computed;
    }
}

package com.syntharb.risk;

import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskBreakdown;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.tracker.PositionSnapshot;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Derives {@link PortfolioMetrics} and {@link RiskBreakdown} from a position snapshot.
 *
 * <p>Every figure is recomputed from the full position set. Nothing is carried between
 * calls, so equal snapshots always give equal metrics.
 *
 * <p>VaR is parametric: sample standard deviation of realized PnL over closed positions
 * scaled by the one-sided z-score (1.645 at 95%, 2.326 at 99%). Fewer than two closed
 * positions report zero VaR and zero Sharpe.
 */
@Component
public class PortfolioMetricsCalculator {

    static final BigDecimal Z_95 = new BigDecimal("1.645");
    static final BigDecimal Z_99 = new BigDecimal("2.326");

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final String UNASSIGNED = "unassigned";

    public PortfolioMetrics calculate(PositionSnapshot snapshot) {
        List<SyntheticPosition> positions = snapshot.getPositions();

        int pending = 0;
        int active = 0;
        int completed = 0;
        int cancelled = 0;
        BigDecimal totalExposure = BigDecimal.ZERO;
        BigDecimal totalExpectedPnl = BigDecimal.ZERO;
        List<SyntheticPosition> closed = new ArrayList<>();

        for (SyntheticPosition position : positions) {
            switch (position.getStatus()) {
                case PENDING -> pending++;
                case ACTIVE -> {
                    active++;
                    totalExposure = totalExposure.add(position.getCurrentExposure());
                    totalExpectedPnl = totalExpectedPnl.add(expectedPnl(position));
                }
                case COMPLETED -> {
                    completed++;
                    closed.add(position);
                }
                case CANCELLED -> {
                    cancelled++;
                    closed.add(position);
                }
            }
        }
        closed.sort(Comparator.comparing(
                SyntheticPosition::getClosedAt, Comparator.nullsFirst(Comparator.naturalOrder())));

        List<BigDecimal> pnls = closed.stream().map(PortfolioMetricsCalculator::realized).toList();
        BigDecimal totalRealized = pnls.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal stdDev = sampleStdDev(pnls);

        BigDecimal sharpe = BigDecimal.ZERO;
        if (stdDev.signum() > 0) {
            BigDecimal mean = totalRealized.divide(BigDecimal.valueOf(pnls.size()), MC);
            sharpe = mean.divide(stdDev, MC).setScale(4, RoundingMode.HALF_UP);
        }

        return PortfolioMetrics.builder()
                .snapshotVersion(snapshot.getVersion())
                .totalPositions(positions.size())
                .pendingPositions(pending)
                .activePositions(active)
                .completedPositions(completed)
                .cancelledPositions(cancelled)
                .totalExposure(totalExposure.setScale(2, RoundingMode.HALF_UP))
                .totalExpectedPnl(totalExpectedPnl.setScale(2, RoundingMode.HALF_UP))
                .totalRealizedPnl(totalRealized.setScale(2, RoundingMode.HALF_UP))
                .var95(stdDev.multiply(Z_95).setScale(2, RoundingMode.HALF_UP))
                .var99(stdDev.multiply(Z_99).setScale(2, RoundingMode.HALF_UP))
                .sharpeRatio(sharpe)
                .maxDrawdown(maxDrawdown(pnls))
                .winRate(winRate(closed))
                .averageHoldingPeriodMs(averageHoldingMs(closed))
                .riskAdjustedReturn(totalRealized
                        .divide(totalExposure.max(BigDecimal.ONE), MC)
                        .setScale(4, RoundingMode.HALF_UP))
                .build();
    }

    /**
     * Groups open positions by sport and by symbol, and every position by status.
     * Each bucket's VaR share is {@code var95 × bucketExposure / totalExposure}.
     */
    public RiskBreakdown breakdown(PositionSnapshot snapshot, BigDecimal var95) {
        List<SyntheticPosition> positions = snapshot.getPositions();
        List<SyntheticPosition> open = positions.stream()
                .filter(position -> !position.getStatus().isTerminal())
                .toList();
        BigDecimal totalExposure = open.stream()
                .filter(position -> position.getStatus() == PositionStatus.ACTIVE)
                .map(SyntheticPosition::getCurrentExposure)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return RiskBreakdown.builder()
                .bySport(group(open, position -> keyOrUnassigned(position.getSport()), var95, totalExposure))
                .bySymbol(group(open, position -> keyOrUnassigned(position.getSymbol()), var95, totalExposure))
                .byStatus(group(positions, position -> position.getStatus().name(), var95, totalExposure))
                .build();
    }

    private Map<String, RiskBreakdown.Bucket> group(
            List<SyntheticPosition> positions,
            Function<SyntheticPosition, String> key,
            BigDecimal var95,
            BigDecimal totalExposure) {
        Map<String, BigDecimal> exposure = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SyntheticPosition position : positions) {
            String bucket = key.apply(position);
            BigDecimal positionExposure = position.getStatus() == PositionStatus.ACTIVE
                    ? position.getCurrentExposure()
                    : BigDecimal.ZERO;
            exposure.merge(bucket, positionExposure, BigDecimal::add);
            counts.merge(bucket, 1, Integer::sum);
        }

        Map<String, RiskBreakdown.Bucket> buckets = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> entry : exposure.entrySet()) {
            BigDecimal share = totalExposure.signum() > 0
                    ? var95.multiply(entry.getValue()).divide(totalExposure, MC)
                    : BigDecimal.ZERO;
            buckets.put(entry.getKey(), RiskBreakdown.Bucket.builder()
                    .exposure(entry.getValue().setScale(2, RoundingMode.HALF_UP))
                    .var95Share(share.setScale(2, RoundingMode.HALF_UP))
                    .positions(counts.get(entry.getKey()))
                    .build());
        }
        return buckets;
    }

    static BigDecimal sampleStdDev(List<BigDecimal> values) {
        int n = values.size();
        if (n < 2) {
            return BigDecimal.ZERO;
        }
        BigDecimal mean = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add).divide(BigDecimal.valueOf(n), MC);
        BigDecimal sumSquares = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal deviation = value.subtract(mean);
            sumSquares = sumSquares.add(deviation.multiply(deviation));
        }
        BigDecimal variance = sumSquares.divide(BigDecimal.valueOf(n - 1L), MC);
        return variance.sqrt(MC);
    }

    /** Largest peak-to-trough drop of cumulative realized PnL, starting from zero. */
    static BigDecimal maxDrawdown(List<BigDecimal> pnlsInCloseOrder) {
        BigDecimal cumulative = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        for (BigDecimal pnl : pnlsInCloseOrder) {
            cumulative = cumulative.add(pnl);
            peak = peak.max(cumulative);
            maxDrawdown = maxDrawdown.max(peak.subtract(cumulative));
        }
        return maxDrawdown.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal winRate(List<SyntheticPosition> closed) {
        long completed = 0;
        long winners = 0;
        for (SyntheticPosition position : closed) {
            if (position.getStatus() == PositionStatus.COMPLETED) {
                completed++;
                if (realized(position).signum() > 0) {
                    winners++;
                }
            }
        }
        if (completed == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winners).divide(BigDecimal.valueOf(completed), 4, RoundingMode.HALF_UP);
    }

    private static long averageHoldingMs(List<SyntheticPosition> closed) {
        long total = 0;
        int count = 0;
        for (SyntheticPosition position : closed) {
            Duration holding = position.getHoldingPeriod();
            if (holding != null) {
                total += holding.toMillis();
                count++;
            }
        }
        return count == 0 ? 0 : total / count;
    }

    private static BigDecimal expectedPnl(SyntheticPosition position) {
        if (position.getExpectedPnl() != null) {
            return position.getExpectedPnl();
        }
        return BigDecimal.ZERO;
    }

    private static BigDecimal realized(SyntheticPosition position) {
        return position.getRealizedPnl() != null ? position.getRealizedPnl() : BigDecimal.ZERO;
    }

    private static String keyOrUnassigned(String key) {
        return key == null || key.isBlank() ? UNASSIGNED : key;
    }
}

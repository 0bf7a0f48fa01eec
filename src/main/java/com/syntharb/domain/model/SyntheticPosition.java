package com.syntharb.domain.model;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A multi-leg synthetic arbitrage position.
 *
 * <p>The live instance is owned exclusively by the PositionTracker and only mutated
 * under its lock. Every instance that leaves the tracker (return values, event
 * payloads, metric inputs) is a deep {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SyntheticPosition {

    private String id;
    private ArbitrageOpportunity opportunity;

    @Builder.Default
    private List<MarketLeg> legs = new ArrayList<>();

    private PositionStatus status;
    private CloseReason closeReason;

    @Builder.Default
    private PositionRisk risk = PositionRisk.NONE;

    /** Σ fillPrice × fillQuantity over legs with fills. */
    private BigDecimal totalCost;

    private BigDecimal totalCommission;

    /** Opportunity profit weighted by confidence. */
    private BigDecimal expectedPnl;

    /** Set on close. Null while the position is open. */
    private BigDecimal realizedPnl;

    private PositionMetadata metadata;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant closedAt;

    public BigDecimal getCurrentExposure() {
        return risk != null ? risk.getCurrentExposure() : BigDecimal.ZERO;
    }

    public long getFilledLegCount() {
        return legs.stream()
                .filter(leg -> leg.getStatus() != null && leg.getStatus().hasFill())
                .count();
    }

    public boolean isFullyFilled() {
        return !legs.isEmpty() && legs.stream().allMatch(leg -> leg.getStatus() == LegStatus.FILLED);
    }

    /** Time between creation and close, or null while open. */
    public Duration getHoldingPeriod() {
        if (createdAt == null || closedAt == null) {
            return null;
        }
        return Duration.between(createdAt, closedAt);
    }

    public String getSport() {
        return opportunity != null ? opportunity.getSport() : null;
    }

    public String getSymbol() {
        return opportunity != null ? opportunity.getSymbol() : null;
    }

    public SyntheticPosition copy() {
        return toBuilder()
                .opportunity(opportunity != null ? opportunity.copy() : null)
                .legs(new ArrayList<>(legs.stream().map(MarketLeg::copy).toList()))
                .metadata(metadata != null ? metadata.copy() : null)
                .build();
    }
}

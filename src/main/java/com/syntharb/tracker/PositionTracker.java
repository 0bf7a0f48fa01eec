package com.syntharb.tracker;

import com.syntharb.domain.enums.CloseReason;
import com.syntharb.domain.enums.LegStatus;
import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.model.ArbitrageOpportunity;
import com.syntharb.domain.model.LegDefinition;
import com.syntharb.domain.model.LegFill;
import com.syntharb.domain.model.MarketLeg;
import com.syntharb.domain.model.PositionFilter;
import com.syntharb.domain.model.PositionMetadata;
import com.syntharb.domain.model.PositionRisk;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.EventPublisherHelper;
import com.syntharb.exception.BusinessException;
import com.syntharb.exception.ErrorCode;
import com.syntharb.exception.InvalidTransitionException;
import com.syntharb.exception.LegIndexOutOfRangeException;
import com.syntharb.exception.PositionNotFoundException;
import com.syntharb.validation.DataValidator;
import com.syntharb.validation.ValidationError;
import com.syntharb.validation.ValidationResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns every synthetic position and its lifecycle.
 *
 * <p>State machine: PENDING (no fills) → ACTIVE (at least one leg filled) → COMPLETED or
 * CANCELLED. Terminal positions reject every further mutation with
 * {@link InvalidTransitionException}.
 *
 * <p>Concurrency: all mutations are serialized by one lock per tracker. Each mutation
 * swaps in a fresh immutable {@link PositionSnapshot}; reads go against the snapshot and
 * never block writers. Events are published after the lock is released, but still on the
 * calling thread, so listeners have run by the time a mutation returns. Listeners
 * never hold a reference to the live position, only to copies.
 */
@Service
public class PositionTracker {

    private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

    private static final String ID_PREFIX = "pos_";

    private final DataValidator dataValidator;
    private final EventPublisherHelper eventPublisherHelper;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock. Insertion order is creation order.
    private final Map<String, SyntheticPosition> positions = new LinkedHashMap<>();
    private long version;

    private volatile PositionSnapshot snapshot = PositionSnapshot.EMPTY;

    public PositionTracker(DataValidator dataValidator, EventPublisherHelper eventPublisherHelper) {
        this.dataValidator = dataValidator;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ========================
    // MUTATIONS
    // ========================

    /**
     * Opens a PENDING position from a structurally valid opportunity. All legs start PENDING.
     * Limits are not checked here; breaches surface as risk alerts.
     *
     * @throws BusinessException with {@link ErrorCode#VALIDATION_ERROR} if the opportunity is invalid
     */
    public SyntheticPosition addPosition(ArbitrageOpportunity opportunity, PositionMetadata metadata) {
        ValidationResult<ArbitrageOpportunity> validation = dataValidator.validateArbitrageOpportunity(opportunity);
        if (validation.isInvalid()) {
            log.warn("Rejected opportunity {}: {}", opportunity != null ? opportunity.getId() : null,
                    validation.getErrors());
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Invalid arbitrage opportunity",
                    Map.of("errors", toDetails(validation.getErrors())));
        }

        List<LegDefinition> definitions = opportunity.resolveLegs();
        List<MarketLeg> legs = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            legs.add(MarketLeg.pending(i, definitions.get(i)));
        }

        Instant now = Instant.now();
        SyntheticPosition position = SyntheticPosition.builder()
                .id(ID_PREFIX + UUID.randomUUID())
                .opportunity(opportunity.copy())
                .legs(legs)
                .status(PositionStatus.PENDING)
                .risk(PositionRisk.NONE)
                .totalCost(BigDecimal.ZERO)
                .totalCommission(BigDecimal.ZERO)
                .expectedPnl(opportunity.getProfit()
                        .multiply(opportunity.getConfidence())
                        .setScale(2, RoundingMode.HALF_UP))
                .metadata(metadata != null ? metadata.copy() : PositionMetadata.empty())
                .createdAt(now)
                .updatedAt(now)
                .build();

        SyntheticPosition result;
        lock.lock();
        try {
            positions.put(position.getId(), position);
            result = commit(position);
        } finally {
            lock.unlock();
        }

        log.info(
                "Position {} added: {} {}/{} with {} legs",
                result.getId(),
                opportunity.getSymbol(),
                opportunity.getExchange1(),
                opportunity.getExchange2(),
                legs.size());
        eventPublisherHelper.publishPositionAdded(this, result);
        return result;
    }

    /**
     * Records an execution report against one leg and recomputes exposure from all legs.
     * The first fill moves a PENDING position to ACTIVE.
     */
    public SyntheticPosition updateLegExecution(String positionId, int legIndex, LegFill fill) {
        validateFill(fill);

        SyntheticPosition result;
        boolean activated = false;
        lock.lock();
        try {
            SyntheticPosition position = requirePosition(positionId);
            if (position.getStatus().isTerminal()) {
                throw new InvalidTransitionException(positionId, position.getStatus(), PositionStatus.ACTIVE);
            }
            if (legIndex < 0 || legIndex >= position.getLegs().size()) {
                throw new LegIndexOutOfRangeException(positionId, legIndex, position.getLegs().size());
            }

            Instant now = Instant.now();
            MarketLeg leg = position.getLegs().get(legIndex);
            leg.setStatus(fill.getStatus());
            leg.setFillPrice(fill.getFillPrice());
            leg.setFillQuantity(fill.getFillQuantity());
            leg.setCommission(fill.getCommission() != null ? fill.getCommission() : BigDecimal.ZERO);
            leg.setFilledAt(fill.getStatus().hasFill() ? now : null);

            BigDecimal exposure = ExposureCalculator.exposure(position.getLegs());
            BigDecimal peak = position.getRisk().getPeakExposure().max(exposure);
            position.setRisk(PositionRisk.builder()
                    .currentExposure(exposure)
                    .peakExposure(peak)
                    .build());
            position.setTotalCost(ExposureCalculator.netNotional(position.getLegs()));
            position.setTotalCommission(ExposureCalculator.totalCommission(position.getLegs()));

            if (position.getStatus() == PositionStatus.PENDING && position.getFilledLegCount() > 0) {
                position.setStatus(PositionStatus.ACTIVE);
                activated = true;
            }
            position.setUpdatedAt(now);
            result = commit(position);
        } finally {
            lock.unlock();
        }

        if (activated) {
            log.info("Position {} is now ACTIVE, exposure {}", positionId, result.getCurrentExposure());
        } else {
            log.debug(
                    "Position {} leg {} updated to {}, exposure {}",
                    positionId,
                    legIndex,
                    fill.getStatus(),
                    result.getCurrentExposure());
        }
        eventPublisherHelper.publishPositionUpdated(this, result, legIndex);
        return result;
    }

    /**
     * Moves a position to the terminal status implied by {@code reason}. A null realized
     * PnL is recorded as zero.
     */
    public SyntheticPosition closePosition(String positionId, CloseReason reason, BigDecimal realizedPnl) {
        if (reason == null) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Close reason is required");
        }

        SyntheticPosition result;
        lock.lock();
        try {
            SyntheticPosition position = requirePosition(positionId);
            PositionStatus target = reason.getTerminalStatus();
            if (!position.getStatus().canTransitionTo(target)) {
                throw new InvalidTransitionException(positionId, position.getStatus(), target);
            }

            Instant now = Instant.now();
            position.setStatus(target);
            position.setCloseReason(reason);
            position.setRealizedPnl(realizedPnl != null ? realizedPnl : BigDecimal.ZERO);
            position.setClosedAt(now);
            position.setUpdatedAt(now);
            result = commit(position);
        } finally {
            lock.unlock();
        }

        log.info(
                "Position {} closed as {} ({}), realized PnL {}",
                positionId,
                result.getStatus(),
                reason,
                result.getRealizedPnl());
        eventPublisherHelper.publishPositionClosed(this, result, reason);
        return result;
    }

    // ========================
    // QUERIES
    // ========================

    public SyntheticPosition getPosition(String positionId) {
        SyntheticPosition position = snapshot.get(positionId);
        if (position == null) {
            throw new PositionNotFoundException(positionId);
        }
        return position.copy();
    }

    /** Positions matching the filter, newest first. */
    public List<SyntheticPosition> getPositions(PositionFilter filter) {
        PositionFilter effective = filter != null ? filter : PositionFilter.ALL;
        return snapshot.getPositionsNewestFirst().stream()
                .filter(effective::matches)
                .map(SyntheticPosition::copy)
                .toList();
    }

    public PositionSnapshot getSnapshot() {
        return snapshot;
    }

    // ========================
    // INTERNALS
    // ========================

    private SyntheticPosition requirePosition(String positionId) {
        SyntheticPosition position = positions.get(positionId);
        if (position == null) {
            throw new PositionNotFoundException(positionId);
        }
        return position;
    }

    /** Must hold the lock. Publishes a new snapshot and returns a caller-owned copy. */
    private SyntheticPosition commit(SyntheticPosition position) {
        version++;
        snapshot = snapshot.with(version, position.copy());
        return position.copy();
    }

    private void validateFill(LegFill fill) {
        if (fill == null || fill.getStatus() == null || fill.getStatus() == LegStatus.PENDING) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Leg fill must report FILLED, PARTIAL or CANCELLED");
        }
        if (fill.getStatus().hasFill()) {
            if (fill.getFillPrice() == null || fill.getFillQuantity() == null) {
                throw new BusinessException(
                        ErrorCode.VALIDATION_ERROR, "Fill price and quantity are required for " + fill.getStatus());
            }
            if (fill.getFillQuantity().signum() <= 0) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Fill quantity must be positive");
            }
        }
        if (fill.getCommission() != null && fill.getCommission().signum() < 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Commission must not be negative");
        }
    }

    private static List<Map<String, Object>> toDetails(List<ValidationError> errors) {
        List<Map<String, Object>> details = new ArrayList<>();
        for (ValidationError error : errors) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("field", error.getField());
            entry.put("code", error.getCode());
            entry.put("message", error.getMessage());
            details.add(entry);
        }
        return details;
    }
}

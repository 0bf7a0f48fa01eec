package com.syntharb.risk;

import com.syntharb.domain.enums.PositionStatus;
import com.syntharb.domain.enums.RiskAlertType;
import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.RiskAlertFilter;
import com.syntharb.domain.model.RiskBreakdown;
import com.syntharb.domain.model.SyntheticPosition;
import com.syntharb.event.DomainEvent;
import com.syntharb.event.EventPublisherHelper;
import com.syntharb.exception.ResourceNotFoundException;
import com.syntharb.tracker.PositionSnapshot;
import com.syntharb.tracker.PositionTracker;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Evaluates {@link RiskLimits} against the latest portfolio snapshot and manages the
 * resulting alerts.
 *
 * <p>Debounce is by state, not by time. Each breach scope (limit type, plus the position or
 * bucket it applies to) latches onto the alert it raised. While the latched alert is
 * unacknowledged and the limit stays breached, no new alert is raised. A new alert is raised
 * once the latched one is acknowledged, or once the metric returns within its limit (which
 * stamps the latched alert resolved) and breaches again.
 *
 * <p>Alert state has its own lock, separate from the tracker's, and evaluation only reads
 * immutable snapshots, so alerting never blocks position mutations. Stored alerts are
 * replaced, never modified in place.
 */
@Service
public class RiskAlertService {

    private static final Logger log = LoggerFactory.getLogger(RiskAlertService.class);

    private static final String ID_PREFIX = "alert_";

    private final PositionTracker positionTracker;
    private final PortfolioAnalyticsService portfolioAnalyticsService;
    private final EventPublisherHelper eventPublisherHelper;

    private volatile RiskLimits riskLimits;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock. Insertion order is raise order.
    private final Map<String, RiskAlert> alerts = new LinkedHashMap<>();
    private final Map<String, String> latchedAlertByScope = new HashMap<>();
    private long lastAppliedVersion;

    public RiskAlertService(
            PositionTracker positionTracker,
            PortfolioAnalyticsService portfolioAnalyticsService,
            EventPublisherHelper eventPublisherHelper,
            RiskLimits riskLimits) {
        this.positionTracker = positionTracker;
        this.portfolioAnalyticsService = portfolioAnalyticsService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.riskLimits = riskLimits;
    }

    // ========================
    // EVALUATION
    // ========================

    /** Tracker event hook. Every position event triggers a full re-evaluation. */
    public void onDomainEvent(DomainEvent event) {
        evaluate();
    }

    /**
     * Checks every configured limit against the current snapshot.
     *
     * @return alerts raised by this evaluation (empty when nothing new breached)
     */
    public List<RiskAlert> evaluate() {
        return evaluate(positionTracker.getSnapshot());
    }

    /**
     * Checks every configured limit against {@code snapshot}. A snapshot older than the last
     * one applied is skipped, so a slow evaluation cannot reopen a breach that a newer
     * snapshot has already cleared.
     */
    public List<RiskAlert> evaluate(PositionSnapshot snapshot) {
        RiskLimits limits = riskLimits;
        if (!limits.isAlertsEnabled()) {
            return List.of();
        }

        PortfolioMetrics metrics = portfolioAnalyticsService.metricsFor(snapshot);
        List<Breach> breaches = findBreaches(limits, snapshot, metrics);

        List<RiskAlert> raised = new ArrayList<>();
        lock.lock();
        try {
            if (snapshot.getVersion() < lastAppliedVersion) {
                log.debug("Skipping risk evaluation of snapshot v{}, v{} already applied",
                        snapshot.getVersion(), lastAppliedVersion);
                return List.of();
            }
            lastAppliedVersion = snapshot.getVersion();

            Instant now = Instant.now();
            Map<String, Breach> breachedScopes = new HashMap<>();
            for (Breach breach : breaches) {
                breachedScopes.put(breach.scope, breach);
                RiskAlert latched = alerts.get(latchedAlertByScope.get(breach.scope));
                if (latched != null && !latched.isAcknowledged()) {
                    alerts.put(latched.getId(), latched.toBuilder().currentValue(breach.currentValue).build());
                    continue;
                }
                RiskAlert alert = RiskAlert.builder()
                        .id(ID_PREFIX + UUID.randomUUID())
                        .type(breach.type)
                        .severity(breach.type.getDefaultSeverity())
                        .message(breach.message)
                        .positionId(breach.positionId)
                        .scope(breach.scope)
                        .threshold(breach.threshold)
                        .currentValue(breach.currentValue)
                        .timestamp(now)
                        .build();
                alerts.put(alert.getId(), alert);
                latchedAlertByScope.put(breach.scope, alert.getId());
                raised.add(alert.copy());
            }

            Iterator<Map.Entry<String, String>> latches = latchedAlertByScope.entrySet().iterator();
            while (latches.hasNext()) {
                Map.Entry<String, String> latch = latches.next();
                if (breachedScopes.containsKey(latch.getKey())) {
                    continue;
                }
                RiskAlert alert = alerts.get(latch.getValue());
                if (alert != null && alert.getResolvedAt() == null) {
                    alerts.put(alert.getId(), alert.toBuilder().resolvedAt(now).build());
                    log.info("Risk alert {} resolved: {} back within limit", alert.getId(), latch.getKey());
                }
                latches.remove();
            }
        } finally {
            lock.unlock();
        }

        for (RiskAlert alert : raised) {
            log.warn("Risk alert raised [{}] {}: {}", alert.getSeverity(), alert.getType(), alert.getMessage());
            eventPublisherHelper.publishRiskAlert(this, alert);
        }
        return raised;
    }

    private List<Breach> findBreaches(RiskLimits limits, PositionSnapshot snapshot, PortfolioMetrics metrics) {
        List<Breach> breaches = new ArrayList<>();

        if (exceeds(metrics.getTotalExposure(), limits.getMaxTotalExposure())) {
            breaches.add(new Breach(
                    RiskAlertType.EXPOSURE_LIMIT,
                    RiskAlertType.EXPOSURE_LIMIT.name(),
                    null,
                    limits.getMaxTotalExposure(),
                    metrics.getTotalExposure(),
                    "Total exposure " + metrics.getTotalExposure().toPlainString() + " exceeds limit "
                            + limits.getMaxTotalExposure().toPlainString()));
        }

        if (limits.getMaxPositionExposure() != null) {
            for (SyntheticPosition position : snapshot.getPositions()) {
                if (position.getStatus() == PositionStatus.ACTIVE
                        && exceeds(position.getCurrentExposure(), limits.getMaxPositionExposure())) {
                    breaches.add(new Breach(
                            RiskAlertType.POSITION_EXPOSURE_LIMIT,
                            RiskAlertType.POSITION_EXPOSURE_LIMIT.name() + ":" + position.getId(),
                            position.getId(),
                            limits.getMaxPositionExposure(),
                            position.getCurrentExposure(),
                            "Position " + position.getId() + " exposure "
                                    + position.getCurrentExposure().toPlainString() + " exceeds limit "
                                    + limits.getMaxPositionExposure().toPlainString()));
                }
            }
        }

        if (exceeds(metrics.getVar95(), limits.getMaxVar95())) {
            breaches.add(new Breach(
                    RiskAlertType.VAR95_LIMIT,
                    RiskAlertType.VAR95_LIMIT.name(),
                    null,
                    limits.getMaxVar95(),
                    metrics.getVar95(),
                    "VaR95 " + metrics.getVar95().toPlainString() + " exceeds limit "
                            + limits.getMaxVar95().toPlainString()));
        }

        if (exceeds(metrics.getVar99(), limits.getMaxVar99())) {
            breaches.add(new Breach(
                    RiskAlertType.VAR99_LIMIT,
                    RiskAlertType.VAR99_LIMIT.name(),
                    null,
                    limits.getMaxVar99(),
                    metrics.getVar99(),
                    "VaR99 " + metrics.getVar99().toPlainString() + " exceeds limit "
                            + limits.getMaxVar99().toPlainString()));
        }

        if (limits.getMaxPositionCount() != null && metrics.getOpenPositions() > limits.getMaxPositionCount()) {
            breaches.add(new Breach(
                    RiskAlertType.POSITION_COUNT_LIMIT,
                    RiskAlertType.POSITION_COUNT_LIMIT.name(),
                    null,
                    BigDecimal.valueOf(limits.getMaxPositionCount()),
                    BigDecimal.valueOf(metrics.getOpenPositions()),
                    "Open positions " + metrics.getOpenPositions() + " exceed limit " + limits.getMaxPositionCount()));
        }

        if (limits.getMaxConcentration() != null && metrics.getTotalExposure().signum() > 0) {
            RiskBreakdown breakdown =
                    portfolioAnalyticsService.breakdownFor(snapshot, metrics);
            addConcentrationBreaches(breaches, "sport", breakdown.getBySport(), metrics, limits);
            addConcentrationBreaches(breaches, "symbol", breakdown.getBySymbol(), metrics, limits);
        }
        return breaches;
    }

    private void addConcentrationBreaches(
            List<Breach> breaches,
            String dimension,
            Map<String, RiskBreakdown.Bucket> buckets,
            PortfolioMetrics metrics,
            RiskLimits limits) {
        for (Map.Entry<String, RiskBreakdown.Bucket> bucket : buckets.entrySet()) {
            BigDecimal share = bucket.getValue()
                    .getExposure()
                    .divide(metrics.getTotalExposure(), MathContext.DECIMAL64)
                    .setScale(4, RoundingMode.HALF_UP);
            if (exceeds(share, limits.getMaxConcentration())) {
                breaches.add(new Breach(
                        RiskAlertType.CONCENTRATION_LIMIT,
                        RiskAlertType.CONCENTRATION_LIMIT.name() + ":" + dimension + ":" + bucket.getKey(),
                        null,
                        limits.getMaxConcentration(),
                        share,
                        "Concentration in " + dimension + " " + bucket.getKey() + " is " + share.toPlainString()
                                + " of total exposure, limit " + limits.getMaxConcentration().toPlainString()));
            }
        }
    }

    private static boolean exceeds(BigDecimal value, BigDecimal limit) {
        return limit != null && value != null && value.compareTo(limit) > 0;
    }

    // ========================
    // ALERT MANAGEMENT
    // ========================

    /** Alerts matching the filter, newest first. */
    public List<RiskAlert> getRiskAlerts(RiskAlertFilter filter) {
        RiskAlertFilter effective = filter != null ? filter : RiskAlertFilter.ALL;
        lock.lock();
        try {
            List<RiskAlert> result = new ArrayList<>();
            for (RiskAlert alert : alerts.values()) {
                if (effective.matches(alert)) {
                    result.add(alert.copy());
                }
            }
            Collections.reverse(result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks an alert acknowledged. Acknowledging twice is a no-op; only the first call
     * publishes {@code alertAcknowledged}.
     *
     * @throws ResourceNotFoundException if no alert has this id
     */
    public RiskAlert acknowledgeAlert(String alertId) {
        RiskAlert result;
        lock.lock();
        try {
            RiskAlert alert = alerts.get(alertId);
            if (alert == null) {
                throw new ResourceNotFoundException("RiskAlert", alertId);
            }
            if (alert.isAcknowledged()) {
                return alert.copy();
            }
            RiskAlert acknowledged = alert.toBuilder().acknowledged(true).acknowledgedAt(Instant.now()).build();
            alerts.put(alertId, acknowledged);
            result = acknowledged.copy();
        } finally {
            lock.unlock();
        }

        log.info("Risk alert {} acknowledged", alertId);
        eventPublisherHelper.publishAlertAcknowledged(this, result);
        return result;
    }

    /**
     * Drops acknowledged or resolved alerts older than the retention window. Open,
     * unacknowledged alerts are never pruned.
     *
     * @return number of alerts removed
     */
    @Scheduled(fixedDelayString = "${syntharb.risk.alert-prune-interval-ms:60000}")
    public int pruneExpiredAlerts() {
        RiskLimits limits = riskLimits;
        if (limits.getAlertRetention() == null) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(limits.getAlertRetention());
        int removed = 0;
        lock.lock();
        try {
            Iterator<RiskAlert> iterator = alerts.values().iterator();
            while (iterator.hasNext()) {
                RiskAlert alert = iterator.next();
                boolean closed = alert.isAcknowledged() || alert.getResolvedAt() != null;
                if (closed && alert.getTimestamp().isBefore(cutoff)) {
                    iterator.remove();
                    latchedAlertByScope.remove(alert.getScope(), alert.getId());
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Pruned {} risk alerts older than {}", removed, limits.getAlertRetention());
        }
        return removed;
    }

    // ========================
    // LIMITS
    // ========================

    public RiskLimits getRiskLimits() {
        return riskLimits.toBuilder().build();
    }

    /** Replaces the active limits and re-evaluates immediately. */
    public RiskLimits updateRiskLimits(RiskLimits limits) {
        this.riskLimits = limits.toBuilder().build();
        log.info("Risk limits updated: {}", limits);
        evaluate();
        return getRiskLimits();
    }

    private static final class Breach {
        private final RiskAlertType type;
        private final String scope;
        private final String positionId;
        private final BigDecimal threshold;
        private final BigDecimal currentValue;
        private final String message;

        private Breach(
                RiskAlertType type,
                String scope,
                String positionId,
                BigDecimal threshold,
                BigDecimal currentValue,
                String message) {
            this.type = type;
            this.scope = scope;
            this.positionId = positionId;
            this.threshold = threshold;
            this.currentValue = currentValue;
            this.message = message;
        }
    }
}

package com.syntharb.api.controller;

import com.syntharb.api.dto.request.RiskLimitsUpdateRequest;
import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.RiskAlertType;
import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.RiskAlertFilter;
import com.syntharb.domain.model.RiskBreakdown;
import com.syntharb.risk.PortfolioAnalyticsService;
import com.syntharb.risk.RiskAlertService;
import com.syntharb.risk.RiskLimits;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for portfolio analytics, risk alerts and limits.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/metrics -- portfolio metrics snapshot</li>
 *   <li>GET /api/risk/breakdown -- exposure by sport, symbol and status</li>
 *   <li>GET /api/risk/alerts -- alerts, newest first, filtered by severity/type/acknowledged</li>
 *   <li>POST /api/risk/alerts/{id}/acknowledge -- acknowledge (idempotent)</li>
 *   <li>GET /api/risk/limits -- current limits</li>
 *   <li>PUT /api/risk/limits -- partial update, re-evaluates immediately</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final PortfolioAnalyticsService portfolioAnalyticsService;
    private final RiskAlertService riskAlertService;

    public RiskController(PortfolioAnalyticsService portfolioAnalyticsService, RiskAlertService riskAlertService) {
        this.portfolioAnalyticsService = portfolioAnalyticsService;
        this.riskAlertService = riskAlertService;
    }

    @GetMapping("/metrics")
    public ResponseEntity<PortfolioMetrics> getPortfolioMetrics() {
        return ResponseEntity.ok(portfolioAnalyticsService.getPortfolioMetrics());
    }

    @GetMapping("/breakdown")
    public ResponseEntity<RiskBreakdown> getRiskBreakdown() {
        return ResponseEntity.ok(portfolioAnalyticsService.getRiskBreakdown());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<RiskAlert>> getRiskAlerts(
            @RequestParam(required = false) AlertSeverity severity,
            @RequestParam(required = false) RiskAlertType type,
            @RequestParam(required = false) Boolean acknowledged) {
        RiskAlertFilter filter = RiskAlertFilter.builder()
                .severity(severity)
                .type(type)
                .acknowledged(acknowledged)
                .build();
        return ResponseEntity.ok(riskAlertService.getRiskAlerts(filter));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public ResponseEntity<RiskAlert> acknowledgeAlert(@PathVariable String alertId) {
        return ResponseEntity.ok(riskAlertService.acknowledgeAlert(alertId));
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getRiskLimits() {
        return ResponseEntity.ok(riskAlertService.getRiskLimits());
    }

    /**
     * Updates risk limits. Only non-null fields in the request body are applied.
     */
    @PutMapping("/limits")
    public ResponseEntity<RiskLimits> updateRiskLimits(@Valid @RequestBody RiskLimitsUpdateRequest request) {
        log.info("Risk limits update requested: {}", request);
        RiskLimits updated = request.applyTo(riskAlertService.getRiskLimits());
        return ResponseEntity.ok(riskAlertService.updateRiskLimits(updated));
    }
}

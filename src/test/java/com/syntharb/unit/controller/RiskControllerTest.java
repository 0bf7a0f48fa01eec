package com.syntharb.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.syntharb.api.controller.RiskController;
import com.syntharb.config.ApiResponseAdvice;
import com.syntharb.domain.enums.AlertSeverity;
import com.syntharb.domain.enums.RiskAlertType;
import com.syntharb.domain.model.PortfolioMetrics;
import com.syntharb.domain.model.RiskAlert;
import com.syntharb.domain.model.RiskAlertFilter;
import com.syntharb.domain.model.RiskBreakdown;
import com.syntharb.exception.GlobalExceptionHandler;
import com.syntharb.exception.ResourceNotFoundException;
import com.syntharb.risk.PortfolioAnalyticsService;
import com.syntharb.risk.RiskAlertService;
import com.syntharb.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the RiskController.
 */
@ExtendWith(MockitoExtension.class)
class RiskControllerTest {

    private MockMvc mockMvc;

    @Mock
    private PortfolioAnalyticsService portfolioAnalyticsService;

    @Mock
    private RiskAlertService riskAlertService;

    @BeforeEach
    void setUp() {
        RiskController controller = new RiskController(portfolioAnalyticsService, riskAlertService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static RiskLimits limits() {
        return RiskLimits.builder()
                .maxTotalExposure(new BigDecimal("1000000"))
                .maxPositionExposure(new BigDecimal("100000"))
                .maxVar95(new BigDecimal("50000"))
                .maxVar99(new BigDecimal("75000"))
                .maxPositionCount(100)
                .alertRetention(Duration.ofDays(7))
                .build();
    }

    @Test
    @DisplayName("GET /api/risk/metrics returns the cached portfolio metrics")
    void getMetrics_returns200() throws Exception {
        when(portfolioAnalyticsService.getPortfolioMetrics()).thenReturn(PortfolioMetrics.builder()
                .snapshotVersion(4)
                .totalPositions(3)
                .activePositions(1)
                .completedPositions(2)
                .totalExposure(new BigDecimal("110000.00"))
                .var95(new BigDecimal("171.22"))
                .winRate(new BigDecimal("0.6667"))
                .build());

        mockMvc.perform(get("/api/risk/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.snapshotVersion").value(4))
                .andExpect(jsonPath("$.data.totalPositions").value(3))
                .andExpect(jsonPath("$.data.totalExposure").value(110000.00))
                .andExpect(jsonPath("$.data.var95").value(171.22));
    }

    @Test
    @DisplayName("GET /api/risk/breakdown returns exposure buckets")
    void getBreakdown_returns200() throws Exception {
        RiskBreakdown.Bucket soccer = RiskBreakdown.Bucket.builder()
                .exposure(new BigDecimal("110000.00"))
                .var95Share(new BigDecimal("171.22"))
                .positions(1)
                .build();
        when(portfolioAnalyticsService.getRiskBreakdown()).thenReturn(RiskBreakdown.builder()
                .bySport(Map.of("soccer", soccer))
                .bySymbol(Map.of("EPL-ARS", soccer))
                .byStatus(Map.of("ACTIVE", soccer))
                .build());

        mockMvc.perform(get("/api/risk/breakdown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.bySport.soccer.positions").value(1))
                .andExpect(jsonPath("$.data.byStatus.ACTIVE.exposure").value(110000.00));
    }

    @Test
    @DisplayName("GET /api/risk/alerts builds a filter from query parameters")
    void getAlerts_buildsFilter() throws Exception {
        RiskAlert alert = RiskAlert.builder()
                .id("alert-1")
                .type(RiskAlertType.EXPOSURE_LIMIT)
                .severity(AlertSeverity.CRITICAL)
                .message("Total exposure 1200000.00 exceeds limit 1000000")
                .timestamp(Instant.now())
                .build();
        when(riskAlertService.getRiskAlerts(any())).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/risk/alerts").param("severity", "CRITICAL").param("acknowledged", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("alert-1"))
                .andExpect(jsonPath("$.data[0].type").value("EXPOSURE_LIMIT"))
                .andExpect(jsonPath("$.data[0].acknowledged").value(false));

        ArgumentCaptor<RiskAlertFilter> captor = ArgumentCaptor.forClass(RiskAlertFilter.class);
        verify(riskAlertService).getRiskAlerts(captor.capture());
        assertThat(captor.getValue().getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(captor.getValue().getType()).isNull();
        assertThat(captor.getValue().getAcknowledged()).isFalse();
    }

    @Test
    @DisplayName("POST acknowledge for an unknown alert is a 404")
    void acknowledge_unknown_returns404() throws Exception {
        when(riskAlertService.acknowledgeAlert("nope")).thenThrow(new ResourceNotFoundException("RiskAlert", "nope"));

        mockMvc.perform(post("/api/risk/alerts/nope/acknowledge"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST acknowledge returns the acknowledged alert")
    void acknowledge_returns200() throws Exception {
        when(riskAlertService.acknowledgeAlert("alert-1")).thenReturn(RiskAlert.builder()
                .id("alert-1")
                .type(RiskAlertType.VAR95_LIMIT)
                .severity(AlertSeverity.WARNING)
                .acknowledged(true)
                .acknowledgedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/risk/alerts/alert-1/acknowledge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.acknowledged").value(true));
    }

    @Test
    @DisplayName("GET /api/risk/limits returns the current limits")
    void getLimits_returns200() throws Exception {
        when(riskAlertService.getRiskLimits()).thenReturn(limits());

        mockMvc.perform(get("/api/risk/limits"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.maxPositionExposure").value(100000))
                .andExpect(jsonPath("$.data.alertsEnabled").value(true));
    }

    @Test
    @DisplayName("PUT /api/risk/limits applies only the supplied fields")
    void updateLimits_partial() throws Exception {
        when(riskAlertService.getRiskLimits()).thenReturn(limits());
        when(riskAlertService.updateRiskLimits(any())).thenAnswer(invocation -> invocation.getArgument(0));

        mockMvc.perform(put("/api/risk/limits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxPositionExposure\":50000,\"alertsEnabled\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.maxPositionExposure").value(50000));

        ArgumentCaptor<RiskLimits> captor = ArgumentCaptor.forClass(RiskLimits.class);
        verify(riskAlertService).updateRiskLimits(captor.capture());
        RiskLimits applied = captor.getValue();
        assertThat(applied.getMaxPositionExposure()).isEqualByComparingTo("50000");
        assertThat(applied.getMaxTotalExposure()).isEqualByComparingTo("1000000");
        assertThat(applied.getMaxPositionCount()).isEqualTo(100);
        assertThat(applied.isAlertsEnabled()).isFalse();
        assertThat(applied.getAlertRetention()).isEqualTo(Duration.ofDays(7));
    }

    @Test
    @DisplayName("PUT /api/risk/limits rejects a concentration above 1")
    void updateLimits_invalidConcentration_returns400() throws Exception {
        mockMvc.perform(put("/api/risk/limits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxConcentration\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.details.maxConcentration").exists());

        verify(riskAlertService, never()).updateRiskLimits(any());
    }
}

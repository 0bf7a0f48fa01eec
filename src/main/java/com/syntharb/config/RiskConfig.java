package com.syntharb.config;

import com.syntharb.risk.RiskLimits;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the startup {@link RiskLimits} from application.properties.
 *
 * <p>Every limit defaults to null (disabled). Limits can be replaced at runtime through the
 * Risk API.
 *
 * <p>Properties prefix: {@code syntharb.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${syntharb.risk.max-total-exposure:#{null}}") BigDecimal maxTotalExposure,
            @Value("${syntharb.risk.max-position-exposure:#{null}}") BigDecimal maxPositionExposure,
            @Value("${syntharb.risk.max-concentration:#{null}}") BigDecimal maxConcentration,
            @Value("${syntharb.risk.max-var95:#{null}}") BigDecimal maxVar95,
            @Value("${syntharb.risk.max-var99:#{null}}") BigDecimal maxVar99,
            @Value("${syntharb.risk.max-position-count:#{null}}") Integer maxPositionCount,
            @Value("${syntharb.risk.alerts-enabled:true}") boolean alertsEnabled,
            @Value("${syntharb.risk.alert-retention:#{null}}") Duration alertRetention) {
        return RiskLimits.builder()
                .maxTotalExposure(maxTotalExposure)
                .maxPositionExposure(maxPositionExposure)
                .maxConcentration(maxConcentration)
                .maxVar95(maxVar95)
                .maxVar99(maxVar99)
                .maxPositionCount(maxPositionCount)
                .alertsEnabled(alertsEnabled)
                .alertRetention(alertRetention)
                .build();
    }
}

package com.syntharb.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. Position, alert, tick and broadcast meters
 * are defined in {@link com.syntharb.observability.CustomMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:syntharb}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}

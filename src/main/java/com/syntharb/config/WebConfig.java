package com.syntharb.config;

import com.syntharb.api.websocket.BroadcastSettings;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the REST surface. Dashboards that open the broadcast socket also call the REST
 * API, so both share {@code syntharb.broadcast.allowed-origin}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final BroadcastSettings broadcastSettings;

    public WebConfig(BroadcastSettings broadcastSettings) {
        this.broadcastSettings = broadcastSettings;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(broadcastSettings.getAllowedOrigin())
                .allowedMethods("GET", "POST", "PUT", "OPTIONS")
                .allowedHeaders("*");
    }
}

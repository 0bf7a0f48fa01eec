package com.syntharb.config;

import com.syntharb.api.websocket.BroadcastSettings;
import com.syntharb.api.websocket.OverflowPolicy;
import com.syntharb.ingestion.IngestionSettings;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Typed settings for the broadcast server and the ingestion path.
 *
 * <p>Properties prefixes: {@code syntharb.broadcast.*}, {@code syntharb.ingestion.*}
 */
@Configuration
public class BroadcastConfig {

    @Bean
    public BroadcastSettings broadcastSettings(
            @Value("${syntharb.broadcast.path:/ws}") String path,
            @Value("${syntharb.broadcast.allowed-origin:*}") String allowedOrigin,
            @Value("${syntharb.broadcast.max-queue-size:1024}") int maxQueueSize,
            @Value("${syntharb.broadcast.overflow-policy:DROP_OLDEST}") OverflowPolicy overflowPolicy,
            @Value("${syntharb.broadcast.shutdown-flush-timeout:PT5S}") Duration shutdownFlushTimeout) {
        return BroadcastSettings.builder()
                .path(path)
                .allowedOrigin(allowedOrigin)
                .maxQueueSize(maxQueueSize)
                .overflowPolicy(overflowPolicy)
                .shutdownFlushTimeout(shutdownFlushTimeout)
                .build();
    }

    @Bean
    public IngestionSettings ingestionSettings(
            @Value("${syntharb.ingestion.default-timeout:PT10S}") Duration defaultTimeout) {
        return IngestionSettings.builder().defaultTimeout(defaultTimeout).build();
    }
}

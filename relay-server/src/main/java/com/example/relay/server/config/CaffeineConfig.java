package com.example.relay.server.config;

import com.example.relay.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;

@Configuration
@AllArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    /**
     * Last status reported by each device, keyed by device id.
     */
    @Bean
    public Cache<String, Map<String, Object>> deviceStatusCache() {
        return Caffeine.newBuilder()
                .maximumSize(appProperties.getPresence().getStatusCacheMaxSize())
                .expireAfterWrite(Duration.ofMinutes(appProperties.getPresence().getStatusCacheTtlMinutes()))
                .recordStats()
                .build();
    }
}

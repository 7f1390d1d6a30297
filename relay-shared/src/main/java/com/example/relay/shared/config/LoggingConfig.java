package com.example.relay.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

@Configuration
@Slf4j
public class LoggingConfig {

    /**
     * Debug-level request/response logging for the REST surface and the WebSocket upgrade.
     */
    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            if (!log.isDebugEnabled()) {
                return chain.filter(exchange);
            }
            long startTime = System.currentTimeMillis();
            String path = exchange.getRequest().getURI().getPath();
            String method = exchange.getRequest().getMethod().name();

            log.debug("Incoming request: {} {} from {}",
                    method, path, exchange.getRequest().getRemoteAddress());

            return chain.filter(exchange)
                .then(Mono.fromRunnable(() -> log.debug("Outgoing response: {} {} - {} in {}ms",
                        method,
                        path,
                        exchange.getResponse().getStatusCode(),
                        System.currentTimeMillis() - startTime)));
        };
    }
}

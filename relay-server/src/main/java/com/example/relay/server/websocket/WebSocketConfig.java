package com.example.relay.server.websocket;

import com.example.relay.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping relayWebSocketMapping(RelayWebSocketHandler handler, AppProperties appProperties) {
        return new SimpleUrlHandlerMapping(Map.of(appProperties.getWebsocket().getPath(), handler), -1);
    }
}

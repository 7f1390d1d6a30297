package com.example.relay.server.controller;

import com.example.relay.server.dto.RelayStatsResponse;
import com.example.relay.server.mapper.RelayApiMapper;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.OffsetDateTime;

@RestController
@RequestMapping("/api/relay")
@RequiredArgsConstructor
public class RelayStatsController {

    private final ConnectionRegistry registry;
    private final RelayApiMapper mapper;
    private final AppProperties appProperties;
    private final Clock clock;

    @GetMapping("/stats")
    public ResponseEntity<RelayStatsResponse> getStats() {
        return ResponseEntity.ok(mapper.toRelayStatsResponse(registry.stats(), appProperties.getPodName(), OffsetDateTime.now(clock)));
    }
}

package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayStatsResponse {

    private String podName;
    private int connectedDevices;
    private int connectedControllers;
    private int controllerSessions;
    private int totalSessions;
    private OffsetDateTime timestamp;
}

package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * {@code status} uses the lowercase wire form; {@code queuePosition} is set only while PENDING.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandResponse {

    private Long id;
    private String deviceId;
    private String action;
    private Map<String, Object> params;
    private String status;
    private String error;
    private Long queuePosition;
    private OffsetDateTime createdAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime completedAt;
}

package com.example.relay.server.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import com.example.relay.shared.util.Constants.DevicePresence;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A paired device with its live presence and last reported status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceResponse {

    private String deviceId;
    private String name;
    private DevicePresence presence;
    private OffsetDateTime lastSeen;
    private Map<String, Object> status;
    private Map<String, Object> settings;
    private Map<String, Object> deviceInfo;
    private OffsetDateTime createdAt;
}

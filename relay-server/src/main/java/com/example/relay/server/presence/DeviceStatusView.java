package com.example.relay.server.presence;

import com.example.relay.shared.util.Constants.DevicePresence;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Live presence plus the last status the device reported.
 */
public record DeviceStatusView(String deviceId, DevicePresence presence, OffsetDateTime lastSeen,
                               Map<String, Object> status) {
}

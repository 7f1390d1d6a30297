package com.example.relay.server.message;

import java.util.Map;

/**
 * Devices send their own {@code deviceId}; controllers send the {@code targetDeviceId} they watch.
 */
public record RegisterMessage(Long seq, String deviceId, String targetDeviceId, Map<String, Object> deviceInfo)
        implements RelayMessage {

    public RegisterMessage {
        if (isBlank(deviceId) && isBlank(targetDeviceId)) {
            throw new IllegalArgumentException("register requires deviceId or targetDeviceId");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public MessageType type() {
        return MessageType.REGISTER;
    }
}

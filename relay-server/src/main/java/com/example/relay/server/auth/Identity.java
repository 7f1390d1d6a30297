package com.example.relay.server.auth;

import com.example.relay.shared.util.Constants.ClientRole;

/**
 * Who a verified access token speaks for. For a device {@code subject} equals {@code deviceId};
 * for a controller {@code deviceId} is the single device it may watch.
 */
public record Identity(String subject, ClientRole role, String deviceId) {

    public boolean isDevice() {
        return role == ClientRole.DEVICE;
    }
}

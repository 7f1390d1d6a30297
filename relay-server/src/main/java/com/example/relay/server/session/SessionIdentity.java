package com.example.relay.server.session;

import com.example.relay.shared.util.Constants.ClientRole;

public record SessionIdentity(String identity, ClientRole role, String deviceId) {
}

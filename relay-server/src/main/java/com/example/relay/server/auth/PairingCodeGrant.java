package com.example.relay.server.auth;

import java.time.OffsetDateTime;

public record PairingCodeGrant(String code, OffsetDateTime expiresAt) {
}

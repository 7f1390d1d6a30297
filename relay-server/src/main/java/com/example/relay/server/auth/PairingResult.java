package com.example.relay.server.auth;

/**
 * Returned once, when a pairing code is redeemed. The plain secret is never stored.
 */
public record PairingResult(String deviceId, String deviceSecret, AuthTokens tokens) {
}

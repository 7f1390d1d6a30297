package com.example.relay.server.auth;

public record ControllerRegistration(String controllerId, String deviceId, AuthTokens tokens) {
}

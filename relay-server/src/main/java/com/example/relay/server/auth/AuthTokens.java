package com.example.relay.server.auth;

public record AuthTokens(String accessToken, String refreshToken, long expiresIn) {
}

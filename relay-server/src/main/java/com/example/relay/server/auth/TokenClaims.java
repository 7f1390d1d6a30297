package com.example.relay.server.auth;

import com.example.relay.shared.util.Constants.ClientRole;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signed token body. Times are epoch seconds.
 */
public record TokenClaims(
        @JsonProperty("sub") String subject,
        @JsonProperty("role") ClientRole role,
        @JsonProperty("did") String deviceId,
        @JsonProperty("iat") long issuedAt,
        @JsonProperty("exp") long expiresAt,
        @JsonProperty("jti") String tokenId,
        @JsonProperty("rt") boolean refresh) {

    public Identity identity() {
        return new Identity(subject, role, deviceId);
    }
}

package com.example.relay.server.auth;

import com.example.relay.shared.config.AppProperties;
import com.example.relay.shared.exception.TokenExpiredException;
import com.example.relay.shared.exception.TokenInvalidException;
import com.example.relay.shared.util.Constants.ClientRole;
import com.example.relay.shared.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.UUID;

/**
 * Compact signed tokens: {@code base64url(claims-json) + "." + base64url(HMAC-SHA256(secret, first part))}.
 */
@Component
public class TokenService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final AppProperties appProperties;
    private final Clock clock;
    private final ObjectMapper mapper = JsonUtils.mapper();

    public TokenService(AppProperties appProperties, Clock clock) {
        this.appProperties = appProperties;
        this.clock = clock;
    }

    public String issueAccessToken(String subject, ClientRole role, String deviceId) {
        return sign(newClaims(subject, role, deviceId, accessTokenTtl(), false));
    }

    public TokenClaims newRefreshClaims(String subject, ClientRole role, String deviceId) {
        return newClaims(subject, role, deviceId, Duration.ofDays(appProperties.getAuth().getRefreshTokenExpireDays()), true);
    }

    public Duration accessTokenTtl() {
        return Duration.ofMinutes(appProperties.getAuth().getAccessTokenExpireMinutes());
    }

    public String sign(TokenClaims claims) {
        try {
            String payload = ENCODER.encodeToString(mapper.writeValueAsBytes(claims));
            return payload + "." + ENCODER.encodeToString(hmac(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize token claims", e);
        }
    }

    /**
     * Checks signature then expiry.
     *
     * @throws TokenInvalidException for a malformed token or a bad signature
     * @throws TokenExpiredException for a well-formed token past its expiry
     */
    public TokenClaims parse(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException("Missing token");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new TokenInvalidException("Malformed token");
        }
        String payload = token.substring(0, dot);
        byte[] signature;
        byte[] body;
        try {
            signature = DECODER.decode(token.substring(dot + 1));
            body = DECODER.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new TokenInvalidException("Malformed token", e);
        }
        if (!MessageDigest.isEqual(signature, hmac(payload))) {
            throw new TokenInvalidException("Bad token signature");
        }
        TokenClaims claims;
        try {
            claims = mapper.readValue(body, TokenClaims.class);
        } catch (IOException e) {
            throw new TokenInvalidException("Unreadable token claims", e);
        }
        if (claims.subject() == null || claims.role() == null || claims.deviceId() == null) {
            throw new TokenInvalidException("Incomplete token claims");
        }
        if (clock.instant().getEpochSecond() >= claims.expiresAt()) {
            throw new TokenExpiredException("Token expired");
        }
        return claims;
    }

    private TokenClaims newClaims(String subject, ClientRole role, String deviceId, Duration ttl, boolean refresh) {
        long now = clock.instant().getEpochSecond();
        return new TokenClaims(subject, role, deviceId, now, now + ttl.getSeconds(), UUID.randomUUID().toString(), refresh);
    }

    private byte[] hmac(String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(appProperties.getAuth().getTokenSecret().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}

package com.example.relay.server.auth;

import com.example.relay.server.session.DeviceLockManager;
import com.example.relay.shared.aspect.Monitored;
import com.example.relay.shared.config.AppProperties;
import com.example.relay.shared.exception.AuthFailureException;
import com.example.relay.shared.exception.InvalidOrExpiredCodeException;
import com.example.relay.shared.exception.PairingCodeAlreadyIssuedException;
import com.example.relay.shared.exception.RefreshInvalidException;
import com.example.relay.shared.exception.ResourceNotFoundException;
import com.example.relay.shared.exception.TokenInvalidException;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.model.PairingCode;
import com.example.relay.shared.model.RefreshToken;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.store.PairingCodeStore;
import com.example.relay.shared.store.RefreshTokenStore;
import com.example.relay.shared.util.Constants;
import com.example.relay.shared.util.Constants.ClientRole;
import com.example.relay.shared.util.Constants.DevicePresence;
import com.example.relay.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Credentials for devices and controllers: pairing codes, device secrets, access and refresh tokens.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("auth")
public class AuthGate {

    private static final int MAX_CODE_ATTEMPTS = 10;

    private final PairingCodeStore pairingCodeStore;
    private final DeviceStore deviceStore;
    private final RefreshTokenStore refreshTokenStore;
    private final TokenService tokenService;
    private final PasswordEncoder passwordEncoder;
    private final DeviceLockManager lockManager;
    private final AppProperties appProperties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Issues a single-use code for {@code deviceClaim}. Expired codes are purged first.
     *
     * @throws PairingCodeAlreadyIssuedException if the claim still holds an unused, unexpired code
     */
    public PairingCodeGrant issuePairingCode(String deviceClaim) {
        return lockManager.withLock("pairing:" + deviceClaim, () -> {
            OffsetDateTime now = now();
            int purged = pairingCodeStore.purgeExpired(now);
            if (purged > 0) {
                log.debug("Purged {} expired pairing codes", purged);
            }
            pairingCodeStore.findActiveByClaim(deviceClaim, now).ifPresent(active -> {
                throw new PairingCodeAlreadyIssuedException("A pairing code is already active for this claim until " + active.getExpiresAt());
            });

            OffsetDateTime expiresAt = now.plusMinutes(appProperties.getAuth().getPairingCodeExpireMinutes());
            PairingCode pairingCode = pairingCodeStore.insert(PairingCode.builder()
                    .code(uniqueCode())
                    .deviceClaim(deviceClaim)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .used(false)
                    .build());
            log.info("Pairing code issued for claim '{}', expires at {}", deviceClaim, expiresAt);
            return new PairingCodeGrant(pairingCode.getCode(), pairingCode.getExpiresAt());
        });
    }

    /**
     * Consumes the code and creates the device. Of two concurrent redeems of one code at most one succeeds.
     *
     * @throws InvalidOrExpiredCodeException if the code is unknown, expired or already used
     */
    @Transactional
    public PairingResult redeemPairingCode(String code, String name, Map<String, Object> deviceInfo) {
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        OffsetDateTime now = now();
        pairingCodeStore.findByCode(normalized)
                .filter(p -> p.isActive(now))
                .orElseThrow(() -> new InvalidOrExpiredCodeException("Invalid or expired pairing code"));

        String deviceId = UUID.randomUUID().toString();
        if (!pairingCodeStore.consume(normalized, deviceId, now)) {
            throw new InvalidOrExpiredCodeException("Invalid or expired pairing code");
        }

        String secret = newDeviceSecret();
        deviceStore.create(Device.builder()
                .id(deviceId)
                .name(name == null || name.isBlank() ? "Device " + deviceId.substring(0, 8) : name)
                .secretHash(passwordEncoder.encode(secret))
                .presence(DevicePresence.OFFLINE)
                .deviceInfo(JsonUtils.toJsonObject(deviceInfo))
                .settings(JsonUtils.toJsonObject(defaultSettings()))
                .unpaired(false)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Device {} paired with code {}", deviceId, normalized);
        return new PairingResult(deviceId, secret, issueTokens(deviceId, ClientRole.DEVICE, deviceId));
    }

    public Optional<PairingCode> lookupPairingCode(String code) {
        return pairingCodeStore.findByCode(code.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @throws TokenInvalidException for a malformed or badly signed token, a refresh token, or
     *         a token whose device has been unpaired
     */
    public Identity verifyAccessToken(String token) {
        TokenClaims claims = tokenService.parse(token);
        if (claims.refresh()) {
            throw new TokenInvalidException("Refresh tokens cannot be used for access");
        }
        if (!isPaired(claims.deviceId())) {
            throw new TokenInvalidException("Device is not paired");
        }
        return claims.identity();
    }

    /**
     * @throws RefreshInvalidException if the token is malformed, expired, revoked, not a refresh
     *         token, or bound to an unpaired device
     */
    public AuthTokens refresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = tokenService.parse(refreshToken);
        } catch (AuthFailureException e) {
            throw new RefreshInvalidException("Invalid refresh token: " + e.getMessage());
        }
        if (!claims.refresh()) {
            throw new RefreshInvalidException("Not a refresh token");
        }
        RefreshToken stored = refreshTokenStore.findById(claims.tokenId())
                .orElseThrow(() -> new RefreshInvalidException("Unknown refresh token"));
        if (stored.isRevoked()) {
            throw new RefreshInvalidException("Refresh token revoked");
        }
        if (!stored.getExpiresAt().isAfter(now())) {
            throw new RefreshInvalidException("Refresh token expired");
        }
        if (!isPaired(claims.deviceId())) {
            throw new RefreshInvalidException("Device is not paired");
        }
        String accessToken = tokenService.issueAccessToken(claims.subject(), claims.role(), claims.deviceId());
        return new AuthTokens(accessToken, refreshToken, tokenService.accessTokenTtl().getSeconds());
    }

    /**
     * @throws AuthFailureException for an unknown or unpaired device or a wrong secret
     */
    @Transactional
    public AuthTokens login(String deviceId, String secret) {
        Device device = deviceStore.findById(deviceId)
                .filter(d -> !d.isUnpaired())
                .orElseThrow(() -> new AuthFailureException("Invalid credentials"));
        if (secret == null || !passwordEncoder.matches(secret, device.getSecretHash())) {
            throw new AuthFailureException("Invalid credentials");
        }
        log.info("Device {} logged in", deviceId);
        return issueTokens(deviceId, ClientRole.DEVICE, deviceId);
    }

    /**
     * Issues a controller identity bound to one paired device.
     *
     * @throws ResourceNotFoundException if the device is unknown or unpaired
     */
    @Transactional
    public ControllerRegistration registerController(String deviceId, String name) {
        if (!isPaired(deviceId)) {
            throw new ResourceNotFoundException("Device not found: " + deviceId);
        }
        String controllerId = UUID.randomUUID().toString();
        log.info("Controller {} ({}) registered for device {}", controllerId, name, deviceId);
        return new ControllerRegistration(controllerId, deviceId, issueTokens(controllerId, ClientRole.CONTROLLER, deviceId));
    }

    /**
     * Revokes every refresh token bound to the device, including its controllers' tokens.
     */
    public int revokeDevice(String deviceId) {
        int revoked = refreshTokenStore.revokeAllForDevice(deviceId);
        log.info("Revoked {} refresh tokens for device {}", revoked, deviceId);
        return revoked;
    }

    public int purgeExpired() {
        OffsetDateTime now = now();
        return pairingCodeStore.purgeExpired(now) + refreshTokenStore.purgeExpired(now);
    }

    private AuthTokens issueTokens(String subject, ClientRole role, String deviceId) {
        String accessToken = tokenService.issueAccessToken(subject, role, deviceId);
        TokenClaims refreshClaims = tokenService.newRefreshClaims(subject, role, deviceId);
        refreshTokenStore.insert(RefreshToken.builder()
                .id(refreshClaims.tokenId())
                .subject(subject)
                .role(role)
                .deviceId(deviceId)
                .issuedAt(toDateTime(refreshClaims.issuedAt()))
                .expiresAt(toDateTime(refreshClaims.expiresAt()))
                .revoked(false)
                .build());
        Duration ttl = tokenService.accessTokenTtl();
        return new AuthTokens(accessToken, tokenService.sign(refreshClaims), ttl.getSeconds());
    }

    private boolean isPaired(String deviceId) {
        return deviceStore.findById(deviceId).map(d -> !d.isUnpaired()).orElse(false);
    }

    private String uniqueCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            StringBuilder code = new StringBuilder(Constants.PAIRING_CODE_LENGTH);
            for (int i = 0; i < Constants.PAIRING_CODE_LENGTH; i++) {
                code.append(Constants.PAIRING_CODE_ALPHABET.charAt(secureRandom.nextInt(Constants.PAIRING_CODE_ALPHABET.length())));
            }
            if (pairingCodeStore.findByCode(code.toString()).isEmpty()) {
                return code.toString();
            }
        }
        throw new IllegalStateException("Could not generate a unique pairing code");
    }

    private String newDeviceSecret() {
        byte[] bytes = new byte[32];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static OffsetDateTime toDateTime(long epochSecond) {
        return Instant.ofEpochSecond(epochSecond).atOffset(ZoneOffset.UTC);
    }

    static Map<String, Object> defaultSettings() {
        Map<String, Object> soundDetection = new LinkedHashMap<>();
        soundDetection.put("enabled", true);
        soundDetection.put("threshold", -30);
        soundDetection.put("recordDuration", 30);
        Map<String, Object> camera = new LinkedHashMap<>();
        camera.put("quality", "medium");
        camera.put("fps", 10);
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("trackingEnabled", true);
        location.put("updateInterval", 300);

        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("soundDetection", soundDetection);
        settings.put("camera", camera);
        settings.put("location", location);
        return settings;
    }
}

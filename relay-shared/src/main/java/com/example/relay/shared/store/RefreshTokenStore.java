package com.example.relay.shared.store;

import com.example.relay.shared.model.RefreshToken;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface RefreshTokenStore {

    RefreshToken insert(RefreshToken refreshToken);

    Optional<RefreshToken> findById(String tokenId);

    int revokeAllForDevice(String deviceId);

    int purgeExpired(OffsetDateTime now);
}

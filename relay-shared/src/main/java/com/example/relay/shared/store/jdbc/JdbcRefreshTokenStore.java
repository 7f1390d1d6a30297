package com.example.relay.shared.store.jdbc;

import com.example.relay.shared.model.RefreshToken;
import com.example.relay.shared.repository.RefreshTokenRepository;
import com.example.relay.shared.store.RefreshTokenStore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jdbc.core.JdbcAggregateOperations;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Optional;

@Service
@Profile("!memory")
@RequiredArgsConstructor
public class JdbcRefreshTokenStore implements RefreshTokenStore {

    private final RefreshTokenRepository refreshTokenRepository;
    private final JdbcAggregateOperations jdbcAggregateOperations;

    @Override
    public RefreshToken insert(RefreshToken refreshToken) {
        return jdbcAggregateOperations.insert(refreshToken);
    }

    @Override
    public Optional<RefreshToken> findById(String tokenId) {
        return refreshTokenRepository.findById(tokenId);
    }

    @Override
    public int revokeAllForDevice(String deviceId) {
        return refreshTokenRepository.revokeAllForDevice(deviceId);
    }

    @Override
    public int purgeExpired(OffsetDateTime now) {
        return refreshTokenRepository.deleteExpired(now);
    }
}

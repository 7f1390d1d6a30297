package com.example.relay.shared.store.memory;

import com.example.relay.shared.model.RefreshToken;
import com.example.relay.shared.store.RefreshTokenStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Profile("memory")
public class InMemoryRefreshTokenStore implements RefreshTokenStore {

    private final ConcurrentHashMap<String, RefreshToken> tokens = new ConcurrentHashMap<>();

    @Override
    public RefreshToken insert(RefreshToken refreshToken) {
        RefreshToken copy = refreshToken.toBuilder().build();
        tokens.put(copy.getId(), copy);
        return copy.toBuilder().build();
    }

    @Override
    public Optional<RefreshToken> findById(String tokenId) {
        return Optional.ofNullable(tokens.get(tokenId)).map(t -> t.toBuilder().build());
    }

    @Override
    public int revokeAllForDevice(String deviceId) {
        AtomicInteger revoked = new AtomicInteger();
        tokens.replaceAll((id, t) -> {
            if (deviceId.equals(t.getDeviceId()) && !t.isRevoked()) {
                revoked.incrementAndGet();
                return t.toBuilder().revoked(true).build();
            }
            return t;
        });
        return revoked.get();
    }

    @Override
    public int purgeExpired(OffsetDateTime now) {
        int before = tokens.size();
        tokens.values().removeIf(t -> !t.getExpiresAt().isAfter(now));
        return before - tokens.size();
    }
}

package com.example.relay.shared.store.memory;

import com.example.relay.shared.model.PairingCode;
import com.example.relay.shared.store.PairingCodeStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Profile("memory")
public class InMemoryPairingCodeStore implements PairingCodeStore {

    private final ConcurrentHashMap<String, PairingCode> codes = new ConcurrentHashMap<>();

    @Override
    public PairingCode insert(PairingCode pairingCode) {
        PairingCode copy = pairingCode.toBuilder().build();
        if (codes.putIfAbsent(copy.getCode(), copy) != null) {
            throw new IllegalStateException("Pairing code collision: " + copy.getCode());
        }
        return copy.toBuilder().build();
    }

    @Override
    public Optional<PairingCode> findByCode(String code) {
        return Optional.ofNullable(codes.get(code)).map(c -> c.toBuilder().build());
    }

    @Override
    public Optional<PairingCode> findActiveByClaim(String deviceClaim, OffsetDateTime now) {
        return codes.values().stream()
                .filter(c -> deviceClaim.equals(c.getDeviceClaim()) && c.isActive(now))
                .max(Comparator.comparing(PairingCode::getCreatedAt))
                .map(c -> c.toBuilder().build());
    }

    @Override
    public boolean consume(String code, String deviceId, OffsetDateTime now) {
        boolean[] consumed = {false};
        codes.computeIfPresent(code, (k, c) -> {
            if (!c.isActive(now)) {
                return c;
            }
            consumed[0] = true;
            return c.toBuilder().used(true).deviceId(deviceId).build();
        });
        return consumed[0];
    }

    @Override
    public int purgeExpired(OffsetDateTime now) {
        int before = codes.size();
        codes.values().removeIf(c -> !c.isUsed() && !c.getExpiresAt().isAfter(now));
        return before - codes.size();
    }
}

package com.example.relay.shared.store;

import com.example.relay.shared.model.PairingCode;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface PairingCodeStore {

    PairingCode insert(PairingCode pairingCode);

    Optional<PairingCode> findByCode(String code);

    Optional<PairingCode> findActiveByClaim(String deviceClaim, OffsetDateTime now);

    /**
     * Marks the code used if it is still unused and unexpired. Atomic: at most one
     * caller gets {@code true} for a given code.
     */
    boolean consume(String code, String deviceId, OffsetDateTime now);

    int purgeExpired(OffsetDateTime now);
}

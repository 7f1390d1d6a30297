package com.example.relay.shared.store.jdbc;

import com.example.relay.shared.model.PairingCode;
import com.example.relay.shared.repository.PairingCodeRepository;
import com.example.relay.shared.store.PairingCodeStore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jdbc.core.JdbcAggregateOperations;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Optional;

@Service
@Profile("!memory")
@RequiredArgsConstructor
public class JdbcPairingCodeStore implements PairingCodeStore {

    private final PairingCodeRepository pairingCodeRepository;
    private final JdbcAggregateOperations jdbcAggregateOperations;

    @Override
    public PairingCode insert(PairingCode pairingCode) {
        return jdbcAggregateOperations.insert(pairingCode);
    }

    @Override
    public Optional<PairingCode> findByCode(String code) {
        return pairingCodeRepository.findById(code);
    }

    @Override
    public Optional<PairingCode> findActiveByClaim(String deviceClaim, OffsetDateTime now) {
        return pairingCodeRepository.findActiveByClaim(deviceClaim, now);
    }

    @Override
    public boolean consume(String code, String deviceId, OffsetDateTime now) {
        return pairingCodeRepository.consume(code, deviceId, now) == 1;
    }

    @Override
    public int purgeExpired(OffsetDateTime now) {
        return pairingCodeRepository.deleteExpired(now);
    }
}

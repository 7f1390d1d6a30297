package com.example.relay.shared.repository;

import com.example.relay.shared.model.PairingCode;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Optional;

@Repository
public interface PairingCodeRepository extends CrudRepository<PairingCode, String> {

    @Query("""
        SELECT * FROM pairing_codes
        WHERE device_claim = :claim AND used = FALSE AND expires_at > :now
        ORDER BY created_at DESC
        LIMIT 1
    """)
    Optional<PairingCode> findActiveByClaim(@Param("claim") String claim, @Param("now") OffsetDateTime now);

    /**
     * Single conditional update, so of two concurrent redeems at most one sees 1.
     */
    @Modifying
    @Query("UPDATE pairing_codes SET used = TRUE, device_id = :deviceId WHERE code = :code AND used = FALSE AND expires_at > :now")
    int consume(@Param("code") String code, @Param("deviceId") String deviceId, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM pairing_codes WHERE expires_at <= :now AND used = FALSE")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

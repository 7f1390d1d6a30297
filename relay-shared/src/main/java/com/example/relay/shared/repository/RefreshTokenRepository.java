package com.example.relay.shared.repository;

import com.example.relay.shared.model.RefreshToken;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface RefreshTokenRepository extends CrudRepository<RefreshToken, String> {

    @Modifying
    @Query("UPDATE refresh_tokens SET revoked = TRUE WHERE device_id = :deviceId AND revoked = FALSE")
    int revokeAllForDevice(@Param("deviceId") String deviceId);

    @Modifying
    @Query("DELETE FROM refresh_tokens WHERE expires_at <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

package com.example.relay.shared.repository;

import com.example.relay.shared.model.Device;
import org.springframework.data.jdbc.repository.query.Modifying;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface DeviceRepository extends CrudRepository<Device, String> {

    @Query("SELECT * FROM devices WHERE unpaired = FALSE ORDER BY created_at")
    List<Device> findAllPaired();

    @Modifying
    @Query("UPDATE devices SET presence = :presence, last_seen = :lastSeen, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updatePresence(@Param("id") String id, @Param("presence") String presence, @Param("lastSeen") OffsetDateTime lastSeen);

    @Modifying
    @Query("UPDATE devices SET last_seen = :lastSeen WHERE id = :id")
    int updateLastSeen(@Param("id") String id, @Param("lastSeen") OffsetDateTime lastSeen);

    @Modifying
    @Query("UPDATE devices SET current_status = :status, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updateCurrentStatus(@Param("id") String id, @Param("status") String status);

    @Modifying
    @Query("UPDATE devices SET settings = :settings, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updateSettings(@Param("id") String id, @Param("settings") String settings);

    @Modifying
    @Query("UPDATE devices SET device_info = :deviceInfo, updated_at = CURRENT_TIMESTAMP WHERE id = :id")
    int updateDeviceInfo(@Param("id") String id, @Param("deviceInfo") String deviceInfo);

    @Modifying
    @Query("UPDATE devices SET unpaired = TRUE, presence = 'OFFLINE', updated_at = CURRENT_TIMESTAMP WHERE id = :id AND unpaired = FALSE")
    int markUnpaired(@Param("id") String id);
}

package com.example.relay.shared.repository;

import com.example.relay.shared.model.Command;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

@Repository
public interface CommandRepository extends CrudRepository<Command, Long> {

    @Query("SELECT * FROM commands WHERE device_id = :deviceId AND status = 'PENDING' ORDER BY id")
    List<Command> findPendingByDeviceId(@Param("deviceId") String deviceId);

    @Query("""
        SELECT * FROM commands
        WHERE device_id = :deviceId
        ORDER BY id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Command> findHistory(@Param("deviceId") String deviceId,
                              @Param("limit") int limit,
                              @Param("offset") int offset);

    @Query("""
        SELECT * FROM commands
        WHERE device_id = :deviceId AND status = :status
        ORDER BY id DESC
        LIMIT :limit OFFSET :offset
    """)
    List<Command> findHistoryByStatus(@Param("deviceId") String deviceId,
                                      @Param("status") String status,
                                      @Param("limit") int limit,
                                      @Param("offset") int offset);

    @Query("SELECT DISTINCT device_id FROM commands WHERE status = 'PENDING' AND created_at < :cutoff")
    List<String> findDeviceIdsWithPendingBefore(@Param("cutoff") OffsetDateTime cutoff);

    @Query("SELECT COUNT(*) FROM commands WHERE device_id = :deviceId AND status = 'PENDING' AND id < :id")
    long countPendingAhead(@Param("deviceId") String deviceId, @Param("id") Long id);
}

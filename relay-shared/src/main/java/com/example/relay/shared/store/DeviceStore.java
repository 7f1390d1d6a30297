package com.example.relay.shared.store;

import com.example.relay.shared.model.Device;
import com.example.relay.shared.util.Constants.DevicePresence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for paired devices. The JDBC implementation is the default; the
 * {@code memory} profile swaps in a map-backed one.
 */
public interface DeviceStore {

    Device create(Device device);

    Optional<Device> findById(String deviceId);

    List<Device> findAllPaired();

    void updatePresence(String deviceId, DevicePresence presence, OffsetDateTime lastSeen);

    void updateLastSeen(String deviceId, OffsetDateTime lastSeen);

    void updateCurrentStatus(String deviceId, String statusJson);

    void updateSettings(String deviceId, String settingsJson);

    void updateDeviceInfo(String deviceId, String deviceInfoJson);

    /**
     * @return false if the device is unknown or already unpaired
     */
    boolean markUnpaired(String deviceId);
}

package com.example.relay.shared.store.jdbc;

import com.example.relay.shared.model.Device;
import com.example.relay.shared.repository.DeviceRepository;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.util.Constants.DevicePresence;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.data.jdbc.core.JdbcAggregateOperations;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Profile("!memory")
@RequiredArgsConstructor
public class JdbcDeviceStore implements DeviceStore {

    private final DeviceRepository deviceRepository;
    private final JdbcAggregateOperations jdbcAggregateOperations;

    @Override
    public Device create(Device device) {
        // ids are assigned by the caller, so save() would attempt an update
        return jdbcAggregateOperations.insert(device);
    }

    @Override
    public Optional<Device> findById(String deviceId) {
        return deviceRepository.findById(deviceId);
    }

    @Override
    public List<Device> findAllPaired() {
        return deviceRepository.findAllPaired();
    }

    @Override
    public void updatePresence(String deviceId, DevicePresence presence, OffsetDateTime lastSeen) {
        deviceRepository.updatePresence(deviceId, presence.name(), lastSeen);
    }

    @Override
    public void updateLastSeen(String deviceId, OffsetDateTime lastSeen) {
        deviceRepository.updateLastSeen(deviceId, lastSeen);
    }

    @Override
    public void updateCurrentStatus(String deviceId, String statusJson) {
        deviceRepository.updateCurrentStatus(deviceId, statusJson);
    }

    @Override
    public void updateSettings(String deviceId, String settingsJson) {
        deviceRepository.updateSettings(deviceId, settingsJson);
    }

    @Override
    public void updateDeviceInfo(String deviceId, String deviceInfoJson) {
        deviceRepository.updateDeviceInfo(deviceId, deviceInfoJson);
    }

    @Override
    public boolean markUnpaired(String deviceId) {
        return deviceRepository.markUnpaired(deviceId) > 0;
    }
}

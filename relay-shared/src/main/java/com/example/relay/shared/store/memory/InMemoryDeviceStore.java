package com.example.relay.shared.store.memory;

import com.example.relay.shared.model.Device;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.util.Constants.DevicePresence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Service
@Profile("memory")
@Slf4j
public class InMemoryDeviceStore implements DeviceStore {

    private final ConcurrentHashMap<String, Device> devices = new ConcurrentHashMap<>();

    @Override
    public Device create(Device device) {
        Device copy = device.toBuilder().build();
        if (devices.putIfAbsent(copy.getId(), copy) != null) {
            throw new IllegalStateException("Device already exists: " + copy.getId());
        }
        return copy.toBuilder().build();
    }

    @Override
    public Optional<Device> findById(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId)).map(d -> d.toBuilder().build());
    }

    @Override
    public List<Device> findAllPaired() {
        return devices.values().stream()
                .filter(d -> !d.isUnpaired())
                .sorted(Comparator.comparing(Device::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(d -> d.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public void updatePresence(String deviceId, DevicePresence presence, OffsetDateTime lastSeen) {
        modify(deviceId, d -> d.toBuilder().presence(presence).lastSeen(lastSeen).updatedAt(OffsetDateTime.now()).build());
    }

    @Override
    public void updateLastSeen(String deviceId, OffsetDateTime lastSeen) {
        modify(deviceId, d -> d.toBuilder().lastSeen(lastSeen).build());
    }

    @Override
    public void updateCurrentStatus(String deviceId, String statusJson) {
        modify(deviceId, d -> d.toBuilder().currentStatus(statusJson).updatedAt(OffsetDateTime.now()).build());
    }

    @Override
    public void updateSettings(String deviceId, String settingsJson) {
        modify(deviceId, d -> d.toBuilder().settings(settingsJson).updatedAt(OffsetDateTime.now()).build());
    }

    @Override
    public void updateDeviceInfo(String deviceId, String deviceInfoJson) {
        modify(deviceId, d -> d.toBuilder().deviceInfo(deviceInfoJson).updatedAt(OffsetDateTime.now()).build());
    }

    @Override
    public boolean markUnpaired(String deviceId) {
        boolean[] changed = {false};
        devices.computeIfPresent(deviceId, (id, d) -> {
            if (d.isUnpaired()) {
                return d;
            }
            changed[0] = true;
            return d.toBuilder().unpaired(true).presence(DevicePresence.OFFLINE).updatedAt(OffsetDateTime.now()).build();
        });
        return changed[0];
    }

    private void modify(String deviceId, UnaryOperator<Device> change) {
        if (devices.computeIfPresent(deviceId, (id, d) -> change.apply(d)) == null) {
            log.debug("Ignoring update for unknown device {}", deviceId);
        }
    }
}

package com.example.relay.server.device;

import com.example.relay.server.auth.AuthGate;
import com.example.relay.server.presence.PresenceTracker;
import com.example.relay.server.session.CloseReason;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.Session;
import com.example.relay.shared.aspect.Monitored;
import com.example.relay.shared.exception.ResourceNotFoundException;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Device level operations exposed over REST: listing, settings and unpairing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("devices")
public class DeviceService {

    private final DeviceStore deviceStore;
    private final ConnectionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final AuthGate authGate;

    public List<Device> listPaired() {
        return deviceStore.findAllPaired();
    }

    /**
     * @throws ResourceNotFoundException if the device is unknown or unpaired
     */
    public Device getPaired(String deviceId) {
        return deviceStore.findById(deviceId)
                .filter(device -> !device.isUnpaired())
                .orElseThrow(() -> new ResourceNotFoundException("Device not found: " + deviceId));
    }

    /**
     * Merges {@code changes} into the stored settings. A null value removes the key.
     */
    public Device updateSettings(String deviceId, Map<String, Object> changes) {
        Device device = getPaired(deviceId);
        Map<String, Object> settings = JsonUtils.parseObject(device.getSettings());
        changes.forEach((key, value) -> {
            if (value == null) {
                settings.remove(key);
            } else {
                settings.put(key, value);
            }
        });
        String json = JsonUtils.toJsonObject(settings);
        deviceStore.updateSettings(deviceId, json);
        log.info("Updated settings of device {}: {}", deviceId, changes.keySet());
        return device.toBuilder().settings(json).build();
    }

    /**
     * Soft unpair: the row stays, its refresh tokens are revoked and a live session is closed.
     * Pending commands are left to expire.
     */
    public void unpair(String deviceId) {
        if (!deviceStore.markUnpaired(deviceId)) {
            throw new ResourceNotFoundException("Device not found: " + deviceId);
        }
        authGate.revokeDevice(deviceId);
        presenceTracker.evict(deviceId);
        registry.lookupDeviceSession(deviceId).ifPresent(session -> session.close(CloseReason.UNPAIRED));
        for (Session controller : registry.lookupControllerSessions(deviceId)) {
            controller.close(CloseReason.UNPAIRED);
        }
        log.info("Device {} unpaired", deviceId);
    }
}

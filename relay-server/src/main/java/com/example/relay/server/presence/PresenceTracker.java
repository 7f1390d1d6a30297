package com.example.relay.server.presence;

import com.example.relay.server.command.CommandQueue;
import com.example.relay.server.message.OutboundMessage;
import com.example.relay.server.message.RelayMessageFactory;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.RegistryListener;
import com.example.relay.server.session.Session;
import com.example.relay.shared.exception.ResourceNotFoundException;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.util.Constants.DevicePresence;
import com.example.relay.shared.util.JsonUtils;
import com.github.benmanes.caffeine.cache.Cache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * Derives ONLINE/OFFLINE from device session admission and removal and pushes each transition
 * to the device's controllers. Controller sessions never change presence.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PresenceTracker implements RegistryListener {

    private final ConnectionRegistry registry;
    private final DeviceStore deviceStore;
    private final CommandQueue commandQueue;
    private final RelayMessageFactory messageFactory;
    private final Cache<String, Map<String, Object>> deviceStatusCache;
    private final Clock clock;

    @PostConstruct
    public void init() {
        registry.addListener(this);
    }

    @Override
    public void onDeviceAdmitted(Session session) {
        String deviceId = session.getDeviceId();
        OffsetDateTime now = OffsetDateTime.now(clock);
        deviceStore.updatePresence(deviceId, DevicePresence.ONLINE, now);
        log.info("Device {} is ONLINE", deviceId);

        OutboundMessage status = messageFactory.status(deviceId, DevicePresence.ONLINE, now, cachedStatus(deviceId).orElse(null));
        session.send(status);
        broadcast(deviceId, status);
        commandQueue.drain(deviceId);
    }

    @Override
    public void onDeviceRemoved(Session session) {
        String deviceId = session.getDeviceId();
        OffsetDateTime now = OffsetDateTime.now(clock);
        deviceStore.updatePresence(deviceId, DevicePresence.OFFLINE, now);
        log.info("Device {} is OFFLINE", deviceId);
        broadcast(deviceId, messageFactory.status(deviceId, DevicePresence.OFFLINE, now, cachedStatus(deviceId).orElse(null)));
    }

    @Override
    public void onControllerAdmitted(Session session) {
        DeviceStatusView view = currentStatus(session.getDeviceId());
        if (!session.send(messageFactory.status(view.deviceId(), view.presence(), view.lastSeen(), view.status()))) {
            registry.dropUnresponsive(session);
        }
    }

    /**
     * Refreshes last-seen on heartbeat. Presence is unchanged.
     */
    public void touch(String deviceId) {
        deviceStore.updateLastSeen(deviceId, OffsetDateTime.now(clock));
    }

    /**
     * Caches and persists a device-reported status, then forwards it to the controllers.
     */
    public void recordStatus(String deviceId, Map<String, Object> status) {
        deviceStatusCache.put(deviceId, status);
        deviceStore.updateCurrentStatus(deviceId, JsonUtils.toJsonObject(status));
        OffsetDateTime now = OffsetDateTime.now(clock);
        deviceStore.updateLastSeen(deviceId, now);
        broadcast(deviceId, messageFactory.status(deviceId, presenceOf(deviceId), now, status));
    }

    /**
     * @throws ResourceNotFoundException if the device was never paired
     */
    public DeviceStatusView currentStatus(String deviceId) {
        Device device = deviceStore.findById(deviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Device not found: " + deviceId));
        return view(device);
    }

    public DeviceStatusView view(Device device) {
        Map<String, Object> status = Optional.ofNullable(deviceStatusCache.getIfPresent(device.getId()))
                .orElseGet(() -> {
                    Map<String, Object> stored = JsonUtils.parseObject(device.getCurrentStatus());
                    if (!stored.isEmpty()) {
                        deviceStatusCache.put(device.getId(), stored);
                    }
                    return stored.isEmpty() ? null : stored;
                });
        return new DeviceStatusView(device.getId(), presenceOf(device.getId()), device.getLastSeen(), status);
    }

    /**
     * Live presence, taken from the registry rather than the stored column.
     */
    public DevicePresence presenceOf(String deviceId) {
        return registry.isDeviceConnected(deviceId) ? DevicePresence.ONLINE : DevicePresence.OFFLINE;
    }

    public void evict(String deviceId) {
        deviceStatusCache.invalidate(deviceId);
    }

    /**
     * Runs before the registry closes its sessions, while the store is still available.
     */
    @PreDestroy
    public void markConnectedDevicesOffline() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (String deviceId : registry.connectedDeviceIds()) {
            try {
                deviceStore.updatePresence(deviceId, DevicePresence.OFFLINE, now);
            } catch (RuntimeException e) {
                log.warn("Could not mark device {} offline on shutdown: {}", deviceId, e.getMessage());
            }
        }
    }

    private Optional<Map<String, Object>> cachedStatus(String deviceId) {
        return Optional.ofNullable(deviceStatusCache.getIfPresent(deviceId));
    }

    private void broadcast(String deviceId, OutboundMessage message) {
        for (Session controller : registry.lookupControllerSessions(deviceId)) {
            try {
                if (!controller.send(message)) {
                    log.debug("Status for device {} not accepted by controller session {}", deviceId, controller.getId());
                    registry.dropUnresponsive(controller);
                }
            } catch (RuntimeException e) {
                log.warn("Status broadcast to controller session {} failed: {}", controller.getId(), e.getMessage());
            }
        }
    }
}

package com.example.relay.server.session;

import com.example.relay.server.message.RelayMessageCodec;
import com.example.relay.shared.config.MonitoringConfig;
import com.example.relay.shared.util.Constants.ClientRole;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Live sessions keyed by identity. Holds at most one device session per device: admitting a
 * second one closes the first with {@link CloseReason#SUPERSEDED}. Every mutation for a device
 * runs under that device's lock, and listeners are notified before the lock is released.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final Map<String, Session> deviceSessions = new ConcurrentHashMap<>();
    private final Map<String, Set<Session>> controllerSessions = new ConcurrentHashMap<>();
    private final Map<String, Set<Session>> watchersByDevice = new ConcurrentHashMap<>();
    private final Map<String, Session> sessionsById = new ConcurrentHashMap<>();
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    private final DeviceLockManager lockManager;
    private final RelayMessageCodec codec;
    private final MonitoringConfig.RelayMetricsCollector metricsCollector;
    private final Clock clock;

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    public Session admitDevice(String deviceId, Transport transport) {
        return lockManager.withLock(deviceId, () -> {
            Session session = new Session(ClientRole.DEVICE, deviceId, deviceId, transport, codec, OffsetDateTime.now(clock));
            Session previous = deviceSessions.put(deviceId, session);
            if (previous != null) {
                sessionsById.remove(previous.getId());
                previous.close(CloseReason.SUPERSEDED);
                metricsCollector.incrementCounter("relay.sessions.superseded");
                log.info("Device {} session {} superseded by {}", deviceId, previous.getId(), session.getId());
            }
            sessionsById.put(session.getId(), session);
            updateSessionGauge();
            log.info("Device {} admitted on session {}", deviceId, session.getId());
            notifyListeners(l -> l.onDeviceAdmitted(session), session);
            return session;
        });
    }

    public Session admitController(String controllerId, String deviceId, Transport transport) {
        return lockManager.withLock(deviceId, () -> {
            Session session = new Session(ClientRole.CONTROLLER, controllerId, deviceId, transport, codec, OffsetDateTime.now(clock));
            controllerSessions.computeIfAbsent(controllerId, k -> ConcurrentHashMap.newKeySet()).add(session);
            watchersByDevice.computeIfAbsent(deviceId, k -> ConcurrentHashMap.newKeySet()).add(session);
            sessionsById.put(session.getId(), session);
            updateSessionGauge();
            log.info("Controller {} admitted on session {} watching device {}", controllerId, session.getId(), deviceId);
            notifyListeners(l -> l.onControllerAdmitted(session), session);
            return session;
        });
    }

    /**
     * Frees the session. A second call, or a call for a session that was already superseded,
     * changes nothing and returns empty.
     */
    public Optional<SessionIdentity> remove(Session session) {
        return lockManager.withLock(session.getDeviceId(), () -> {
            if (!sessionsById.remove(session.getId(), session)) {
                return Optional.empty();
            }
            updateSessionGauge();
            if (session.isDevice()) {
                deviceSessions.remove(session.getDeviceId(), session);
                log.info("Device {} session {} removed", session.getDeviceId(), session.getId());
                notifyListeners(l -> l.onDeviceRemoved(session), session);
            } else {
                removeFromSet(controllerSessions, session.getIdentity(), session);
                removeFromSet(watchersByDevice, session.getDeviceId(), session);
                log.info("Controller {} session {} removed", session.getIdentity(), session.getId());
                notifyListeners(l -> l.onControllerRemoved(session), session);
            }
            return Optional.of(new SessionIdentity(session.getIdentity(), session.getRole(), session.getDeviceId()));
        });
    }

    /**
     * Removes a session whose transport refused a control write and closes it with
     * {@link CloseReason#TRANSPORT_FAILURE}. A no-op for a session that is already gone.
     */
    public void dropUnresponsive(Session session) {
        lockManager.withLock(session.getDeviceId(), () -> {
            if (remove(session).isPresent()) {
                metricsCollector.incrementCounter("relay.sessions.dropped");
                log.warn("Session {} refused a write and was dropped", session);
            }
            session.close(CloseReason.TRANSPORT_FAILURE);
        });
    }

    public Optional<Session> lookupDeviceSession(String deviceId) {
        return Optional.ofNullable(deviceSessions.get(deviceId));
    }

    public List<Session> lookupControllerSessions(String deviceId) {
        Set<Session> watchers = watchersByDevice.get(deviceId);
        return watchers == null ? List.of() : List.copyOf(watchers);
    }

    public boolean isCurrentDeviceSession(Session session) {
        return session.isDevice() && deviceSessions.get(session.getDeviceId()) == session;
    }

    public boolean isDeviceConnected(String deviceId) {
        return deviceSessions.containsKey(deviceId);
    }

    public List<String> connectedDeviceIds() {
        return List.copyOf(deviceSessions.keySet());
    }

    public RegistryStats stats() {
        int controllerSessionCount = controllerSessions.values().stream().mapToInt(Set::size).sum();
        return new RegistryStats(deviceSessions.size(), controllerSessions.size(), controllerSessionCount, sessionsById.size());
    }

    /**
     * Closes every session with {@code reason} and forgets them without notifying listeners.
     */
    @PreDestroy
    public void closeAll() {
        closeAll(CloseReason.SERVER_SHUTDOWN);
    }

    public void closeAll(CloseReason reason) {
        List<Session> sessions = new ArrayList<>(sessionsById.values());
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Closing {} sessions: {}", sessions.size(), reason);
        for (Session session : sessions) {
            lockManager.withLock(session.getDeviceId(), () -> {
                sessionsById.remove(session.getId());
                if (session.isDevice()) {
                    deviceSessions.remove(session.getDeviceId(), session);
                } else {
                    removeFromSet(controllerSessions, session.getIdentity(), session);
                    removeFromSet(watchersByDevice, session.getDeviceId(), session);
                }
                session.close(reason);
            });
        }
        updateSessionGauge();
    }

    private void removeFromSet(Map<String, Set<Session>> index, String key, Session session) {
        index.computeIfPresent(key, (k, sessions) -> {
            sessions.remove(session);
            return sessions.isEmpty() ? null : sessions;
        });
    }

    private void updateSessionGauge() {
        metricsCollector.setGauge("relay.sessions.active", sessionsById.size());
    }

    private void notifyListeners(Consumer<RegistryListener> event, Session session) {
        for (RegistryListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Registry listener {} failed for {}", listener.getClass().getSimpleName(), session, e);
            }
        }
    }
}

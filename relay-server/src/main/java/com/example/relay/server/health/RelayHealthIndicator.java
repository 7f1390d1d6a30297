package com.example.relay.server.health;

import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.RegistryStats;
import com.example.relay.shared.store.DeviceStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the relay: live sessions, the device store and the status cache.
 */
@Component
public class RelayHealthIndicator implements HealthIndicator {

    private static final String PROBE_DEVICE_ID = "health-probe";

    private final ConnectionRegistry registry;
    private final DeviceStore deviceStore;
    private final Cache<String, Map<String, Object>> deviceStatusCache;

    public RelayHealthIndicator(ConnectionRegistry registry,
                                DeviceStore deviceStore,
                                Cache<String, Map<String, Object>> deviceStatusCache) {
        this.registry = registry;
        this.deviceStore = deviceStore;
        this.deviceStatusCache = deviceStatusCache;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean sessionsHealthy = checkSessions(details);
        boolean storeHealthy = checkStore(details);
        checkCache(details);

        Health.Builder builder = sessionsHealthy && storeHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkSessions(Map<String, Object> details) {
        try {
            RegistryStats stats = registry.stats();
            details.put("connectedDevices", stats.connectedDevices());
            details.put("connectedControllers", stats.connectedControllers());
            details.put("totalSessions", stats.totalSessions());
            details.put("sessionStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("sessionStatus", "DOWN");
            details.put("sessionError", e.getMessage());
            return false;
        }
    }

    private boolean checkStore(Map<String, Object> details) {
        try {
            deviceStore.findById(PROBE_DEVICE_ID);
            details.put("storeStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("storeStatus", "DOWN");
            details.put("storeError", e.getMessage());
            return false;
        }
    }

    private void checkCache(Map<String, Object> details) {
        CacheStats stats = deviceStatusCache.stats();
        details.put("statusCacheSize", deviceStatusCache.estimatedSize());
        details.put("statusCacheHitRate", stats.hitRate());
    }
}

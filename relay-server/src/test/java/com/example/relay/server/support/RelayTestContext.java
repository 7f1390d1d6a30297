package com.example.relay.server.support;

import com.example.relay.server.auth.AuthGate;
import com.example.relay.server.auth.TokenService;
import com.example.relay.server.command.CommandQueue;
import com.example.relay.server.media.MediaRouter;
import com.example.relay.server.message.RelayMessageCodec;
import com.example.relay.server.message.RelayMessageFactory;
import com.example.relay.server.presence.PresenceTracker;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.DeviceLockManager;
import com.example.relay.server.websocket.InboundMessageDispatcher;
import com.example.relay.shared.config.AppProperties;
import com.example.relay.shared.config.MonitoringConfig;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.store.memory.InMemoryCommandStore;
import com.example.relay.shared.store.memory.InMemoryDeviceStore;
import com.example.relay.shared.store.memory.InMemoryPairingCodeStore;
import com.example.relay.shared.store.memory.InMemoryRefreshTokenStore;
import com.example.relay.shared.util.Constants.DevicePresence;
import com.example.relay.shared.util.JsonUtils;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * The relay core wired by hand over in-memory stores, the way the application context wires it.
 */
public class RelayTestContext {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    public final AppProperties properties = new AppProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MonitoringConfig.RelayMetricsCollector metrics = new MonitoringConfig.RelayMetricsCollector(meterRegistry);
    public final InMemoryDeviceStore deviceStore = new InMemoryDeviceStore();
    public final InMemoryCommandStore commandStore = new InMemoryCommandStore();
    public final InMemoryPairingCodeStore pairingCodeStore = new InMemoryPairingCodeStore();
    public final InMemoryRefreshTokenStore refreshTokenStore = new InMemoryRefreshTokenStore();
    public final Cache<String, Map<String, Object>> statusCache = Caffeine.newBuilder().maximumSize(100).build();
    public final DeviceLockManager lockManager = new DeviceLockManager();
    public final RelayMessageCodec codec = new RelayMessageCodec(JsonUtils.mapper());
    public final RelayMessageFactory messageFactory = new RelayMessageFactory(clock);
    public final ConnectionRegistry registry = new ConnectionRegistry(lockManager, codec, metrics, clock);
    public final CommandQueue commandQueue =
            new CommandQueue(commandStore, registry, lockManager, messageFactory, metrics, properties, clock);
    public final PresenceTracker presenceTracker =
            new PresenceTracker(registry, deviceStore, commandQueue, messageFactory, statusCache, clock);
    public final MediaRouter mediaRouter = new MediaRouter(registry, messageFactory, metrics);
    public final TokenService tokenService;
    public final AuthGate authGate;
    public final InboundMessageDispatcher dispatcher;

    public RelayTestContext() {
        properties.getAuth().setTokenSecret("test-secret");
        presenceTracker.init();
        tokenService = new TokenService(properties, clock);
        authGate = new AuthGate(pairingCodeStore, deviceStore, refreshTokenStore, tokenService,
                new BCryptPasswordEncoder(4), lockManager, properties, clock);
        dispatcher = new InboundMessageDispatcher(codec, messageFactory, registry, presenceTracker, commandQueue,
                mediaRouter, deviceStore, metrics, clock);
    }

    public Device pairedDevice(String deviceId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return deviceStore.create(Device.builder()
                .id(deviceId)
                .name("Device " + deviceId)
                .secretHash("unused")
                .presence(DevicePresence.OFFLINE)
                .settings("{}")
                .unpaired(false)
                .createdAt(now)
                .updatedAt(now)
                .build());
    }
}

package com.example.relay.shared.store.jdbc;

import com.example.relay.shared.config.JdbcConfig;
import com.example.relay.shared.model.Command;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.model.PairingCode;
import com.example.relay.shared.model.RefreshToken;
import com.example.relay.shared.util.Constants.ClientRole;
import com.example.relay.shared.util.Constants.CommandStatus;
import com.example.relay.shared.util.Constants.DevicePresence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.jdbc.DataJdbcTest;
import org.springframework.context.annotation.Import;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJdbcTest
@Import({JdbcConfig.class, JdbcDeviceStore.class, JdbcCommandStore.class,
        JdbcPairingCodeStore.class, JdbcRefreshTokenStore.class})
class JdbcStoresTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private JdbcDeviceStore deviceStore;
    @Autowired
    private JdbcCommandStore commandStore;
    @Autowired
    private JdbcPairingCodeStore pairingCodeStore;
    @Autowired
    private JdbcRefreshTokenStore refreshTokenStore;

    @BeforeEach
    void setUp() {
        deviceStore.create(device("dev-1"));
        deviceStore.create(device("dev-2"));
    }

    @Test
    void deviceFieldsRoundTripAndUnpairIsOneShot() {
        deviceStore.updatePresence("dev-1", DevicePresence.ONLINE, NOW.plusMinutes(1));
        deviceStore.updateSettings("dev-1", "{\"nightMode\":true}");

        Device stored = deviceStore.findById("dev-1").orElseThrow();
        assertThat(stored.getPresence()).isEqualTo(DevicePresence.ONLINE);
        assertThat(stored.getLastSeen().toInstant()).isEqualTo(NOW.plusMinutes(1).toInstant());
        assertThat(stored.getSettings()).isEqualTo("{\"nightMode\":true}");

        assertThat(deviceStore.markUnpaired("dev-1")).isTrue();
        assertThat(deviceStore.markUnpaired("dev-1")).isFalse();
        assertThat(deviceStore.markUnpaired("nobody")).isFalse();
        assertThat(deviceStore.findAllPaired()).extracting(Device::getId).containsExactly("dev-2");
    }

    @Test
    void pendingCommandsComeBackInCreationOrder() {
        Command first = commandStore.insert(pending("dev-1", "start_camera", NOW));
        Command second = commandStore.insert(pending("dev-1", "capture_photo", NOW.plusSeconds(1)));
        Command third = commandStore.insert(pending("dev-1", "stop_camera", NOW.plusSeconds(2)));
        commandStore.insert(pending("dev-2", "get_status", NOW));

        commandStore.update(second.toBuilder().status(CommandStatus.DELIVERED).deliveredAt(NOW).build());

        assertThat(first.getId()).isLessThan(second.getId());
        assertThat(commandStore.findPending("dev-1")).extracting(Command::getId)
                .containsExactly(first.getId(), third.getId());
        assertThat(commandStore.countPendingAhead("dev-1", third.getId())).isEqualTo(1);
        assertThat(commandStore.findHistory("dev-1", null, 10, 0)).extracting(Command::getId)
                .containsExactly(third.getId(), second.getId(), first.getId());
        assertThat(commandStore.findHistory("dev-1", CommandStatus.DELIVERED, 10, 0)).hasSize(1);
        assertThat(commandStore.findHistory("dev-1", null, 1, 1)).extracting(Command::getId)
                .containsExactly(second.getId());
    }

    @Test
    void devicesWithStalePendingCommandsAreFound() {
        commandStore.insert(pending("dev-1", "start_camera", NOW.minusHours(3)));
        commandStore.insert(pending("dev-2", "start_camera", NOW));

        List<String> stale = commandStore.findDeviceIdsWithPendingBefore(NOW.minusHours(1));

        assertThat(stale).containsExactly("dev-1");
    }

    @Test
    void pairingCodeIsConsumedOnce() {
        pairingCodeStore.insert(PairingCode.builder()
                .code("A1B2C3")
                .deviceClaim("phone")
                .createdAt(NOW)
                .expiresAt(NOW.plusMinutes(10))
                .used(false)
                .build());

        assertThat(pairingCodeStore.findActiveByClaim("phone", NOW)).isPresent();
        assertThat(pairingCodeStore.consume("A1B2C3", "dev-1", NOW)).isTrue();
        assertThat(pairingCodeStore.consume("A1B2C3", "dev-2", NOW)).isFalse();
        assertThat(pairingCodeStore.findActiveByClaim("phone", NOW)).isEmpty();
        assertThat(pairingCodeStore.findByCode("A1B2C3").orElseThrow().getDeviceId()).isEqualTo("dev-1");
    }

    @Test
    void expiredPairingCodesArePurged() {
        pairingCodeStore.insert(PairingCode.builder()
                .code("0F0F0F")
                .deviceClaim("tablet")
                .createdAt(NOW.minusMinutes(20))
                .expiresAt(NOW.minusMinutes(10))
                .used(false)
                .build());

        assertThat(pairingCodeStore.consume("0F0F0F", "dev-1", NOW)).isFalse();
        assertThat(pairingCodeStore.purgeExpired(NOW)).isEqualTo(1);
        assertThat(pairingCodeStore.findByCode("0F0F0F")).isEmpty();
    }

    @Test
    void refreshTokensAreRevokedPerDevice() {
        refreshTokenStore.insert(token("t-1", "dev-1"));
        refreshTokenStore.insert(token("t-2", "dev-1"));
        refreshTokenStore.insert(token("t-3", "dev-2"));

        assertThat(refreshTokenStore.revokeAllForDevice("dev-1")).isEqualTo(2);
        assertThat(refreshTokenStore.findById("t-1").orElseThrow().isRevoked()).isTrue();
        assertThat(refreshTokenStore.findById("t-3").orElseThrow().isRevoked()).isFalse();
    }

    private static Device device(String id) {
        return Device.builder()
                .id(id)
                .name("Device " + id)
                .secretHash("hash")
                .presence(DevicePresence.OFFLINE)
                .settings("{}")
                .unpaired(false)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static Command pending(String deviceId, String action, OffsetDateTime createdAt) {
        return Command.builder()
                .deviceId(deviceId)
                .action(action)
                .status(CommandStatus.PENDING)
                .createdAt(createdAt.truncatedTo(ChronoUnit.MILLIS))
                .build();
    }

    private static RefreshToken token(String id, String deviceId) {
        return RefreshToken.builder()
                .id(id)
                .subject(deviceId)
                .role(ClientRole.DEVICE)
                .deviceId(deviceId)
                .issuedAt(NOW)
                .expiresAt(NOW.plusDays(7))
                .revoked(false)
                .build();
    }
}

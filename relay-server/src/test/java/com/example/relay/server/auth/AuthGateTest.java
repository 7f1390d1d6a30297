package com.example.relay.server.auth;

import com.example.relay.server.support.RelayTestContext;
import com.example.relay.shared.exception.AuthFailureException;
import com.example.relay.shared.exception.InvalidOrExpiredCodeException;
import com.example.relay.shared.exception.PairingCodeAlreadyIssuedException;
import com.example.relay.shared.exception.RefreshInvalidException;
import com.example.relay.shared.exception.ResourceNotFoundException;
import com.example.relay.shared.exception.TokenInvalidException;
import com.example.relay.shared.model.Device;
import com.example.relay.shared.util.Constants;
import com.example.relay.shared.util.Constants.ClientRole;
import com.example.relay.shared.util.Constants.DevicePresence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthGateTest {

    private RelayTestContext ctx;
    private AuthGate authGate;

    @BeforeEach
    void setUp() {
        ctx = new RelayTestContext();
        authGate = ctx.authGate;
    }

    @Test
    void pairingCodeUsesTheHexAlphabet() {
        PairingCodeGrant grant = authGate.issuePairingCode("phone-1");

        assertThat(grant.code()).hasSize(Constants.PAIRING_CODE_LENGTH).matches("[0-9A-F]{6}");
        assertThat(Duration.between(ctx.clock.instant(), grant.expiresAt().toInstant())).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void secondCodeForTheSameClaimIsRejectedUntilTheFirstExpires() {
        authGate.issuePairingCode("phone-1");

        assertThatThrownBy(() -> authGate.issuePairingCode("phone-1"))
                .isInstanceOf(PairingCodeAlreadyIssuedException.class);
        assertThat(authGate.issuePairingCode("phone-2").code()).isNotBlank();

        ctx.clock.advance(Duration.ofMinutes(11));
        assertThat(authGate.issuePairingCode("phone-1").code()).isNotBlank();
    }

    @Test
    void redeemCreatesAnOfflineDeviceWithHashedSecret() {
        PairingCodeGrant grant = authGate.issuePairingCode("phone-1");

        PairingResult result = authGate.redeemPairingCode(grant.code().toLowerCase(), "Kitchen", Map.of("model", "Pixel"));

        Device device = ctx.deviceStore.findById(result.deviceId()).orElseThrow();
        assertThat(device.getName()).isEqualTo("Kitchen");
        assertThat(device.getPresence()).isEqualTo(DevicePresence.OFFLINE);
        assertThat(device.getSecretHash()).isNotEqualTo(result.deviceSecret()).startsWith("$2");
        assertThat(device.getDeviceInfo()).contains("Pixel");
        assertThat(authGate.verifyAccessToken(result.tokens().accessToken()))
                .isEqualTo(new Identity(result.deviceId(), ClientRole.DEVICE, result.deviceId()));
    }

    @Test
    void codeCanOnlyBeRedeemedOnce() {
        PairingCodeGrant grant = authGate.issuePairingCode("phone-1");
        authGate.redeemPairingCode(grant.code(), null, null);

        assertThatThrownBy(() -> authGate.redeemPairingCode(grant.code(), null, null))
                .isInstanceOf(InvalidOrExpiredCodeException.class);
        assertThat(authGate.lookupPairingCode(grant.code()).orElseThrow().isUsed()).isTrue();
    }

    @Test
    void expiredOrUnknownCodesCannotBeRedeemed() {
        PairingCodeGrant grant = authGate.issuePairingCode("phone-1");
        ctx.clock.advance(Duration.ofMinutes(10));

        assertThatThrownBy(() -> authGate.redeemPairingCode(grant.code(), null, null))
                .isInstanceOf(InvalidOrExpiredCodeException.class);
        assertThatThrownBy(() -> authGate.redeemPairingCode("ZZZZZZ", null, null))
                .isInstanceOf(InvalidOrExpiredCodeException.class);
    }

    @Test
    void concurrentRedeemsOfOneCodeProduceOneDevice() throws Exception {
        PairingCodeGrant grant = authGate.issuePairingCode("phone-1");
        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PairingResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return authGate.redeemPairingCode(grant.code(), null, null);
                }));
            }
            start.countDown();
            int succeeded = 0;
            for (Future<PairingResult> result : results) {
                try {
                    result.get(10, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(InvalidOrExpiredCodeException.class);
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        assertThat(ctx.deviceStore.findAllPaired()).hasSize(1);
    }

    @Test
    void refreshIssuesANewAccessTokenUntilRevoked() {
        PairingResult paired = authGate.redeemPairingCode(authGate.issuePairingCode("phone-1").code(), null, null);
        String refreshToken = paired.tokens().refreshToken();

        AuthTokens refreshed = authGate.refresh(refreshToken);
        assertThat(authGate.verifyAccessToken(refreshed.accessToken()).subject()).isEqualTo(paired.deviceId());
        assertThat(refreshed.refreshToken()).isEqualTo(refreshToken);

        authGate.revokeDevice(paired.deviceId());
        assertThatThrownBy(() -> authGate.refresh(refreshToken)).isInstanceOf(RefreshInvalidException.class);
    }

    @Test
    void tokensAreNotInterchangeable() {
        PairingResult paired = authGate.redeemPairingCode(authGate.issuePairingCode("phone-1").code(), null, null);

        assertThatThrownBy(() -> authGate.verifyAccessToken(paired.tokens().refreshToken()))
                .isInstanceOf(TokenInvalidException.class);
        assertThatThrownBy(() -> authGate.refresh(paired.tokens().accessToken()))
                .isInstanceOf(RefreshInvalidException.class);
        assertThatThrownBy(() -> authGate.refresh("garbage"))
                .isInstanceOf(RefreshInvalidException.class);
    }

    @Test
    void unpairedDeviceLosesAccess() {
        PairingResult paired = authGate.redeemPairingCode(authGate.issuePairingCode("phone-1").code(), null, null);
        ctx.deviceStore.markUnpaired(paired.deviceId());

        assertThatThrownBy(() -> authGate.verifyAccessToken(paired.tokens().accessToken()))
                .isInstanceOf(TokenInvalidException.class);
        assertThatThrownBy(() -> authGate.login(paired.deviceId(), paired.deviceSecret()))
                .isInstanceOf(AuthFailureException.class);
    }

    @Test
    void loginChecksTheDeviceSecret() {
        PairingResult paired = authGate.redeemPairingCode(authGate.issuePairingCode("phone-1").code(), null, null);

        AuthTokens tokens = authGate.login(paired.deviceId(), paired.deviceSecret());

        assertThat(authGate.verifyAccessToken(tokens.accessToken()).deviceId()).isEqualTo(paired.deviceId());
        assertThatThrownBy(() -> authGate.login(paired.deviceId(), "wrong"))
                .isInstanceOf(AuthFailureException.class);
        assertThatThrownBy(() -> authGate.login("unknown", "wrong"))
                .isInstanceOf(AuthFailureException.class);
    }

    @Test
    void controllerIsBoundToOnePairedDevice() {
        PairingResult paired = authGate.redeemPairingCode(authGate.issuePairingCode("phone-1").code(), null, null);

        ControllerRegistration registration = authGate.registerController(paired.deviceId(), "Tablet");

        Identity identity = authGate.verifyAccessToken(registration.tokens().accessToken());
        assertThat(identity.role()).isEqualTo(ClientRole.CONTROLLER);
        assertThat(identity.subject()).isEqualTo(registration.controllerId());
        assertThat(identity.deviceId()).isEqualTo(paired.deviceId());
        assertThatThrownBy(() -> authGate.registerController("no-such-device", null))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}

package com.example.relay.server;

import com.example.relay.server.dto.CommandResponse;
import com.example.relay.server.dto.ControllerResponse;
import com.example.relay.server.dto.DeviceResponse;
import com.example.relay.server.dto.PairingCodeResponse;
import com.example.relay.server.dto.PairingResponse;
import com.example.relay.shared.util.Constants.DevicePresence;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "resilience4j.ratelimiter.instances.pairingCodeLimiter.limit-for-period=1000")
class RelayServerIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    private final WebSocketClient webSocketClient = new ReactorNettyWebSocketClient();

    @Test
    void queuedCommandReachesDeviceWhenItConnects() {
        PairingResponse device = pairDevice();
        ControllerResponse controller = registerController(device.getDeviceId());

        CommandResponse submitted = webTestClient.post()
                .uri("/api/devices/{id}/commands", device.getDeviceId())
                .header("Authorization", "Bearer " + controller.getAccessToken())
                .bodyValue(Map.of("action", "start_camera", "params", Map.of("camera", "front")))
                .exchange()
                .expectStatus().isAccepted()
                .expectBody(CommandResponse.class)
                .returnResult().getResponseBody();
        assertThat(submitted).isNotNull();
        assertThat(submitted.getStatus()).isEqualTo("pending");
        assertThat(submitted.getQueuePosition()).isEqualTo(1L);

        List<String> received = new CopyOnWriteArrayList<>();
        webSocketClient.execute(wsUri(device.getAccessToken()), session ->
                        session.send(Mono.just(session.textMessage(
                                        "{\"type\":\"register\",\"deviceId\":\"" + device.getDeviceId() + "\"}")))
                                .thenMany(session.receive()
                                        .map(WebSocketMessage::getPayloadAsText)
                                        .doOnNext(received::add)
                                        .filter(text -> text.contains("\"type\":\"command\""))
                                        .take(1))
                                .then(session.close()))
                .block(TIMEOUT);

        assertThat(received).anySatisfy(text -> assertThat(text).contains("\"action\":\"start_camera\"", "\"camera\":\"front\""));

        // the store write follows the socket write, so poll briefly
        CommandResponse delivered = null;
        for (int attempt = 0; attempt < 50; attempt++) {
            delivered = fetchCommand(device.getDeviceId(), submitted.getId());
            if ("delivered".equals(delivered.getStatus())) {
                break;
            }
            sleep(Duration.ofMillis(100));
        }
        assertThat(delivered.getStatus()).isEqualTo("delivered");
        assertThat(delivered.getQueuePosition()).isNull();
    }

    @Test
    void connectionWithBadTokenIsClosedWithAuthFailure() {
        AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();

        webSocketClient.execute(wsUri("not-a-token"), session ->
                        session.receive().then()
                                .then(session.closeStatus())
                                .doOnNext(closeStatus::set)
                                .then())
                .block(TIMEOUT);

        assertThat(closeStatus.get()).isNotNull();
        assertThat(closeStatus.get().getCode()).isEqualTo(4401);
    }

    @Test
    void deviceStatusIsVisibleOverRest() {
        PairingResponse device = pairDevice();

        DeviceResponse response = webTestClient.get()
                .uri("/api/devices/{id}", device.getDeviceId())
                .exchange()
                .expectStatus().isOk()
                .expectBody(DeviceResponse.class)
                .returnResult().getResponseBody();

        assertThat(response).isNotNull();
        assertThat(response.getPresence()).isEqualTo(DevicePresence.OFFLINE);
        assertThat(response.getName()).isEqualTo("Hallway");
        assertThat(response.getSettings()).containsKey("soundDetection");
    }

    @Test
    void settingsAreMerged() {
        PairingResponse device = pairDevice();

        webTestClient.patch()
                .uri("/api/devices/{id}/settings", device.getDeviceId())
                .bodyValue(Map.of("nightMode", true))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.settings.nightMode").isEqualTo(true)
                .jsonPath("$.settings.soundDetection").exists();
    }

    @Test
    void unpairedDeviceDisappears() {
        PairingResponse device = pairDevice();

        webTestClient.delete().uri("/api/devices/{id}", device.getDeviceId())
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.get().uri("/api/devices/{id}", device.getDeviceId())
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404);
        webTestClient.post().uri("/api/auth/refresh")
                .bodyValue(Map.of("refreshToken", device.getRefreshToken()))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void pairingErrorsMapToHttpStatuses() {
        String claim = "claim-" + UUID.randomUUID();
        webTestClient.post().uri("/api/auth/pair")
                .bodyValue(Map.of("deviceClaim", claim))
                .exchange()
                .expectStatus().isCreated();
        webTestClient.post().uri("/api/auth/pair")
                .bodyValue(Map.of("deviceClaim", claim))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT);
        webTestClient.post().uri("/api/auth/redeem")
                .bodyValue(Map.of("code", "FFFFFF"))
                .exchange()
                .expectStatus().isBadRequest();
        webTestClient.post().uri("/api/auth/pair")
                .bodyValue(Map.of())
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void unknownActionIsABadRequest() {
        PairingResponse device = pairDevice();

        webTestClient.post()
                .uri("/api/devices/{id}/commands", device.getDeviceId())
                .bodyValue(Map.of("action", "fly"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("fly"));
    }

    private PairingResponse pairDevice() {
        PairingCodeResponse code = webTestClient.post().uri("/api/auth/pair")
                .bodyValue(Map.of("deviceClaim", "claim-" + UUID.randomUUID()))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(PairingCodeResponse.class)
                .returnResult().getResponseBody();
        assertThat(code).isNotNull();

        PairingResponse paired = webTestClient.post().uri("/api/auth/redeem")
                .bodyValue(Map.of("code", code.getCode(), "name", "Hallway"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(PairingResponse.class)
                .returnResult().getResponseBody();
        assertThat(paired).isNotNull();
        return paired;
    }

    private ControllerResponse registerController(String deviceId) {
        ControllerResponse response = webTestClient.post().uri("/api/auth/controllers")
                .bodyValue(Map.of("deviceId", deviceId, "name", "Tablet"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(ControllerResponse.class)
                .returnResult().getResponseBody();
        assertThat(response).isNotNull();
        return response;
    }

    private CommandResponse fetchCommand(String deviceId, Long commandId) {
        CommandResponse response = webTestClient.get()
                .uri("/api/devices/{id}/commands/{commandId}", deviceId, commandId)
                .exchange()
                .expectStatus().isOk()
                .expectBody(CommandResponse.class)
                .returnResult().getResponseBody();
        assertThat(response).isNotNull();
        return response;
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private URI wsUri(String token) {
        return URI.create("ws://localhost:" + port + "/ws?token=" + token);
    }
}

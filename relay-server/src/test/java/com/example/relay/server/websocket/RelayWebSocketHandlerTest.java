package com.example.relay.server.websocket;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import reactor.core.publisher.Mono;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class RelayWebSocketHandlerTest {

    @Test
    void tokenIsReadFromQueryParameter() {
        assertThat(RelayWebSocketHandler.extractToken(handshake("ws://relay/ws?token=abc.def", new HttpHeaders())))
                .isEqualTo("abc.def");
    }

    @Test
    void bearerHeaderIsUsedWhenQueryHasNoToken() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer xyz.123");

        assertThat(RelayWebSocketHandler.extractToken(handshake("ws://relay/ws", headers))).isEqualTo("xyz.123");
    }

    @Test
    void missingTokenYieldsNull() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz");

        assertThat(RelayWebSocketHandler.extractToken(handshake("ws://relay/ws", headers))).isNull();
    }

    private static HandshakeInfo handshake(String uri, HttpHeaders headers) {
        return new HandshakeInfo(URI.create(uri), headers, Mono.empty(), null);
    }
}

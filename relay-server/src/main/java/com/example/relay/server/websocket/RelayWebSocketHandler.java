package com.example.relay.server.websocket;

import com.example.relay.server.auth.AuthGate;
import com.example.relay.server.auth.Identity;
import com.example.relay.server.session.CloseReason;
import com.example.relay.server.session.SinkTransport;
import com.example.relay.shared.config.AppProperties;
import com.example.relay.shared.exception.AuthFailureException;
import com.example.relay.shared.util.Constants;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.UUID;

/**
 * Entry point for device and controller connections. The access token is checked before any
 * frame is read; the connection is only bound to a session once it sends {@code register}.
 */
@Component
@Slf4j
public class RelayWebSocketHandler implements WebSocketHandler {

    private final AuthGate authGate;
    private final InboundMessageDispatcher dispatcher;
    private final AppProperties appProperties;
    private final Scheduler relayWorkScheduler;

    public RelayWebSocketHandler(AuthGate authGate,
                                 InboundMessageDispatcher dispatcher,
                                 AppProperties appProperties,
                                 @Qualifier("relayWorkScheduler") Scheduler relayWorkScheduler) {
        this.authGate = authGate;
        this.dispatcher = dispatcher;
        this.appProperties = appProperties;
        this.relayWorkScheduler = relayWorkScheduler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        String token = extractToken(webSocketSession.getHandshakeInfo());
        return Mono.fromCallable(() -> authGate.verifyAccessToken(token))
                .subscribeOn(relayWorkScheduler)
                .flatMap(identity -> serve(webSocketSession, identity))
                .onErrorResume(AuthFailureException.class, e -> {
                    log.warn("Rejected WebSocket connection {}: {}", webSocketSession.getId(), e.getMessage());
                    return webSocketSession.close(CloseReason.AUTH_FAILED.toCloseStatus());
                });
    }

    private Mono<Void> serve(WebSocketSession webSocketSession, Identity identity) {
        String connectionId = UUID.randomUUID().toString();
        SinkTransport transport = new SinkTransport(connectionId, appProperties.getMedia().getBufferSize(),
                appProperties.getWebsocket().getControlBufferSize());
        ConnectionContext context = new ConnectionContext(identity, transport, malformedLimiter(connectionId));
        log.info("WebSocket connection {} opened for {} {}", connectionId, identity.role(), identity.subject());

        Mono<Void> input = webSocketSession.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> Mono.fromRunnable(() -> dispatcher.dispatch(context, text))
                        .subscribeOn(relayWorkScheduler))
                .then()
                .doFinally(signal -> relayWorkScheduler.schedule(() -> dispatcher.onDisconnect(context)));

        Mono<Void> output = webSocketSession.send(transport.outbound().map(webSocketSession::textMessage));

        Mono<Void> closer = transport.closeSignal()
                .flatMap(reason -> {
                    log.info("Closing WebSocket connection {} with {}", connectionId, reason);
                    return webSocketSession.close(reason.toCloseStatus());
                });

        return Mono.when(input, output, closer)
                .doOnError(e -> log.warn("WebSocket connection {} failed: {}", connectionId, e.getMessage()));
    }

    private RateLimiter malformedLimiter(String connectionId) {
        AppProperties.WebSocket props = appProperties.getWebsocket();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(props.getMalformedLimit())
                .limitRefreshPeriod(Duration.ofMillis(props.getMalformedWindow()))
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("malformed-" + connectionId, config);
    }

    static String extractToken(HandshakeInfo handshakeInfo) {
        String fromQuery = UriComponentsBuilder.fromUri(handshakeInfo.getUri())
                .build()
                .getQueryParams()
                .getFirst(Constants.TOKEN_QUERY_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String header = handshakeInfo.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(Constants.BEARER_PREFIX)) {
            return header.substring(Constants.BEARER_PREFIX.length()).trim();
        }
        return null;
    }
}

package com.example.relay.server.websocket;

import com.example.relay.server.auth.Identity;
import com.example.relay.server.session.Session;
import com.example.relay.server.session.Transport;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.Getter;

/**
 * State of one WebSocket connection: who authenticated, its transport, and the session once
 * {@code register} has been accepted.
 */
@Getter
public class ConnectionContext {

    private final Identity identity;
    private final Transport transport;
    private final RateLimiter malformedLimiter;
    private Session session;
    private boolean disconnected;

    public ConnectionContext(Identity identity, Transport transport, RateLimiter malformedLimiter) {
        this.identity = identity;
        this.transport = transport;
        this.malformedLimiter = malformedLimiter;
    }

    public synchronized Session getSession() {
        return session;
    }

    synchronized void attach(Session session) {
        this.session = session;
    }

    /**
     * @return false if the connection was already marked disconnected
     */
    synchronized boolean markDisconnected() {
        if (disconnected) {
            return false;
        }
        disconnected = true;
        return true;
    }

    public synchronized boolean isDisconnected() {
        return disconnected;
    }

    public String connectionId() {
        return transport.id();
    }
}

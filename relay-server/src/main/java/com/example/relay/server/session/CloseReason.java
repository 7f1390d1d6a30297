package com.example.relay.server.session;

import org.springframework.web.reactive.socket.CloseStatus;

public enum CloseReason {
    NORMAL(1000, "closed"),
    SERVER_SHUTDOWN(1001, "server shutting down"),
    TRANSPORT_FAILURE(1011, "write rejected"),
    SUPERSEDED(4001, "superseded by a newer device session"),
    MALFORMED(4400, "too many malformed messages"),
    UNPAIRED(4403, "device unpaired"),
    AUTH_FAILED(4401, "unauthorized");

    private final int code;
    private final String description;

    CloseReason(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public CloseStatus toCloseStatus() {
        return new CloseStatus(code, description);
    }
}

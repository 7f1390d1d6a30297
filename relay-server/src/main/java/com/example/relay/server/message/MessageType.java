package com.example.relay.server.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of envelope types carried over the WebSocket, in both directions.
 */
public enum MessageType {
    REGISTER("register"),
    STATUS("status"),
    COMMAND("command"),
    COMMAND_ACK("command_ack"),
    FRAME("frame"),
    AUDIO("audio"),
    LOCATION("location"),
    PING("ping");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<MessageType> fromWire(String value) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(value)).findFirst();
    }
}

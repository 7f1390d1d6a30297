package com.example.relay.server.message;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A server-to-client envelope before sequencing. The session stamps {@code seq} when it is sent.
 */
public record OutboundMessage(String type, Map<String, Object> body) {

    public static final String PONG = "pong";

    public OutboundMessage {
        body = body == null ? Map.of() : body;
    }

    public static OutboundMessage of(MessageType type, Map<String, Object> body) {
        return new OutboundMessage(type.wireName(), body);
    }

    public Map<String, Object> envelope(long seq) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", type);
        envelope.put("seq", seq);
        envelope.putAll(body);
        return envelope;
    }
}

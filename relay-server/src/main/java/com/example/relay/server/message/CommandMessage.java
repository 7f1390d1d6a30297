package com.example.relay.server.message;

import java.util.Map;

public record CommandMessage(Long seq, String action, Map<String, Object> params) implements RelayMessage {

    public CommandMessage {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("command requires an action");
        }
        params = params == null ? Map.of() : params;
    }

    @Override
    public MessageType type() {
        return MessageType.COMMAND;
    }
}

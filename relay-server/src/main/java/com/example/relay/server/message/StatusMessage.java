package com.example.relay.server.message;

import java.util.Map;

public record StatusMessage(Long seq, Map<String, Object> status) implements RelayMessage {

    public StatusMessage {
        if (status == null) {
            throw new IllegalArgumentException("status requires a status object");
        }
    }

    @Override
    public MessageType type() {
        return MessageType.STATUS;
    }
}

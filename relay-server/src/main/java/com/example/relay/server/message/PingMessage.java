package com.example.relay.server.message;

public record PingMessage(Long seq) implements RelayMessage {

    @Override
    public MessageType type() {
        return MessageType.PING;
    }
}

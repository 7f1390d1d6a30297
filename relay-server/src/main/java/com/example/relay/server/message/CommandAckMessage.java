package com.example.relay.server.message;

public record CommandAckMessage(Long seq, Long commandId, String status, String error) implements RelayMessage {

    public CommandAckMessage {
        if (commandId == null) {
            throw new IllegalArgumentException("command_ack requires a commandId");
        }
        if (status == null || status.isBlank()) {
            throw new IllegalArgumentException("command_ack requires a status");
        }
    }

    @Override
    public MessageType type() {
        return MessageType.COMMAND_ACK;
    }
}

package com.example.relay.shared.exception;

import lombok.Getter;

/**
 * An acknowledgement named a command that doesn't exist, belongs to another device,
 * or would move the command backwards. The ack is ignored; the session stays open.
 */
@Getter
public class UnknownCommandException extends RuntimeException {

    private final Long commandId;

    public UnknownCommandException(Long commandId, String message) {
        super(message);
        this.commandId = commandId;
    }
}

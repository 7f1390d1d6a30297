package com.example.relay.server.command;

import com.example.relay.shared.model.Command;

/**
 * Result of an enqueue. {@code queuePosition} is 1-based and only set while the command is still pending.
 */
public record QueuedCommand(Command command, Long queuePosition) {
}

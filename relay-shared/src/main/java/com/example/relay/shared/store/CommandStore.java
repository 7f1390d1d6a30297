package com.example.relay.shared.store;

import com.example.relay.shared.model.Command;
import com.example.relay.shared.util.Constants.CommandStatus;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

public interface CommandStore {

    /**
     * Inserts a new command and returns it with its generated id.
     */
    Command insert(Command command);

    Command update(Command command);

    Optional<Command> findById(Long commandId);

    /**
     * PENDING commands of the device, oldest first.
     */
    List<Command> findPending(String deviceId);

    /**
     * Newest first; {@code status} may be null for no filter.
     */
    List<Command> findHistory(String deviceId, CommandStatus status, int limit, int offset);

    List<String> findDeviceIdsWithPendingBefore(OffsetDateTime cutoff);

    long countPendingAhead(String deviceId, Long commandId);
}

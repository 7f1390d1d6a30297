package com.example.relay.shared.store.jdbc;

import com.example.relay.shared.model.Command;
import com.example.relay.shared.repository.CommandRepository;
import com.example.relay.shared.store.CommandStore;
import com.example.relay.shared.util.Constants.CommandStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Profile("!memory")
@RequiredArgsConstructor
public class JdbcCommandStore implements CommandStore {

    private final CommandRepository commandRepository;

    @Override
    public Command insert(Command command) {
        if (command.getId() != null) {
            throw new IllegalArgumentException("New commands must not carry an id");
        }
        return commandRepository.save(command);
    }

    @Override
    public Command update(Command command) {
        return commandRepository.save(command);
    }

    @Override
    public Optional<Command> findById(Long commandId) {
        return commandRepository.findById(commandId);
    }

    @Override
    public List<Command> findPending(String deviceId) {
        return commandRepository.findPendingByDeviceId(deviceId);
    }

    @Override
    public List<Command> findHistory(String deviceId, CommandStatus status, int limit, int offset) {
        if (status == null) {
            return commandRepository.findHistory(deviceId, limit, offset);
        }
        return commandRepository.findHistoryByStatus(deviceId, status.name(), limit, offset);
    }

    @Override
    public List<String> findDeviceIdsWithPendingBefore(OffsetDateTime cutoff) {
        return commandRepository.findDeviceIdsWithPendingBefore(cutoff);
    }

    @Override
    public long countPendingAhead(String deviceId, Long commandId) {
        return commandRepository.countPendingAhead(deviceId, commandId);
    }
}

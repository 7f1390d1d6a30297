package com.example.relay.shared.store.memory;

import com.example.relay.shared.model.Command;
import com.example.relay.shared.store.CommandStore;
import com.example.relay.shared.util.Constants.CommandStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Profile("memory")
public class InMemoryCommandStore implements CommandStore {

    private final ConcurrentSkipListMap<Long, Command> commands = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Command insert(Command command) {
        if (command.getId() != null) {
            throw new IllegalArgumentException("New commands must not carry an id");
        }
        Command stored = command.toBuilder().id(sequence.incrementAndGet()).build();
        commands.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Command update(Command command) {
        if (command.getId() == null || !commands.containsKey(command.getId())) {
            throw new IllegalArgumentException("Unknown command: " + command.getId());
        }
        Command stored = command.toBuilder().build();
        commands.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<Command> findById(Long commandId) {
        if (commandId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(commands.get(commandId)).map(c -> c.toBuilder().build());
    }

    @Override
    public List<Command> findPending(String deviceId) {
        // skip-list iteration is already in id order
        return commands.values().stream()
                .filter(c -> c.getDeviceId().equals(deviceId) && c.getStatus() == CommandStatus.PENDING)
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<Command> findHistory(String deviceId, CommandStatus status, int limit, int offset) {
        return commands.descendingMap().values().stream()
                .filter(c -> c.getDeviceId().equals(deviceId))
                .filter(c -> status == null || c.getStatus() == status)
                .skip(offset)
                .limit(limit)
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
    }

    @Override
    public List<String> findDeviceIdsWithPendingBefore(OffsetDateTime cutoff) {
        return commands.values().stream()
                .filter(c -> c.getStatus() == CommandStatus.PENDING && c.getCreatedAt().isBefore(cutoff))
                .map(Command::getDeviceId)
                .distinct()
                .sorted(Comparator.naturalOrder())
                .collect(Collectors.toList());
    }

    @Override
    public long countPendingAhead(String deviceId, Long commandId) {
        return commands.headMap(commandId, false).values().stream()
                .filter(c -> c.getDeviceId().equals(deviceId) && c.getStatus() == CommandStatus.PENDING)
                .count();
    }
}

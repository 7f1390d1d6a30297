package com.example.relay.server.command;

import com.example.relay.server.message.RelayMessageFactory;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.DeviceLockManager;
import com.example.relay.server.session.Session;
import com.example.relay.shared.aspect.Monitored;
import com.example.relay.shared.config.AppProperties;
import com.example.relay.shared.config.MonitoringConfig;
import com.example.relay.shared.exception.UnknownCommandException;
import com.example.relay.shared.model.Command;
import com.example.relay.shared.store.CommandStore;
import com.example.relay.shared.util.Constants.CommandAction;
import com.example.relay.shared.util.Constants.CommandStatus;
import com.example.relay.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-device FIFO of commands. Pending commands outlive the device's connection and are
 * delivered in creation order when it comes back. Delivery is at most once: a command that
 * reached DELIVERED is never sent again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("commands")
public class CommandQueue {

    private static final Set<CommandStatus> ACKNOWLEDGEABLE =
            EnumSet.of(CommandStatus.EXECUTING, CommandStatus.COMPLETED, CommandStatus.FAILED);

    private final CommandStore commandStore;
    private final ConnectionRegistry registry;
    private final DeviceLockManager lockManager;
    private final RelayMessageFactory messageFactory;
    private final MonitoringConfig.RelayMetricsCollector metricsCollector;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Stores a PENDING command and, if the device is connected, delivers right away.
     *
     * @throws IllegalArgumentException for an action outside {@link CommandAction}
     */
    public QueuedCommand enqueue(String deviceId, String action, Map<String, Object> params) {
        if (CommandAction.fromWire(action).isEmpty()) {
            throw new IllegalArgumentException("Unknown command action: " + action);
        }
        return lockManager.withLock(deviceId, () -> {
            Command command = commandStore.insert(Command.builder()
                    .deviceId(deviceId)
                    .action(action)
                    .params(JsonUtils.toJsonObject(params))
                    .status(CommandStatus.PENDING)
                    .createdAt(now())
                    .build());
            metricsCollector.incrementCounter("relay.commands.enqueued");
            log.info("Command {} ({}) queued for device {}", command.getId(), action, deviceId);

            drain(deviceId);

            Command current = commandStore.findById(command.getId()).orElse(command);
            Long position = current.getStatus() == CommandStatus.PENDING
                    ? commandStore.countPendingAhead(deviceId, current.getId()) + 1
                    : null;
            return new QueuedCommand(current, position);
        });
    }

    /**
     * Sends pending commands to the live device session, oldest first. A command becomes
     * DELIVERED only after the transport accepted it; the first refused write ends the drain
     * and drops the session.
     *
     * @return number of commands delivered
     */
    public int drain(String deviceId) {
        return lockManager.withLock(deviceId, () -> {
            Optional<Session> maybeSession = registry.lookupDeviceSession(deviceId);
            if (maybeSession.isEmpty()) {
                return 0;
            }
            Session session = maybeSession.get();
            List<Command> pending = commandStore.findPending(deviceId);
            int delivered = 0;
            for (Command command : pending) {
                if (!session.send(messageFactory.command(command))) {
                    log.warn("Device {} refused command {}; dropping session {}", deviceId, command.getId(), session.getId());
                    registry.dropUnresponsive(session);
                    break;
                }
                commandStore.update(command.toBuilder()
                        .status(CommandStatus.DELIVERED)
                        .deliveredAt(now())
                        .build());
                delivered++;
            }
            if (delivered > 0) {
                metricsCollector.incrementCounter("relay.commands.delivered", delivered);
                log.info("Delivered {} of {} pending commands to device {}", delivered, pending.size(), deviceId);
            }
            return delivered;
        });
    }

    /**
     * Applies a device's acknowledgement and forwards the new state to the device's controllers.
     *
     * @throws UnknownCommandException if the id is unknown, belongs to another device, or the
     *         transition is not allowed from the command's current status
     */
    public Command acknowledge(String deviceId, Long commandId, CommandStatus newStatus, String error) {
        return lockManager.withLock(deviceId, () -> {
            Command command = commandStore.findById(commandId)
                    .filter(c -> c.getDeviceId().equals(deviceId))
                    .orElseThrow(() -> new UnknownCommandException(commandId,
                            "Command " + commandId + " not found for device " + deviceId));
            if (!ACKNOWLEDGEABLE.contains(newStatus) || !command.getStatus().canTransitionTo(newStatus)) {
                throw new UnknownCommandException(commandId,
                        "Command " + commandId + " cannot move from " + command.getStatus() + " to " + newStatus);
            }
            Command.CommandBuilder updated = command.toBuilder().status(newStatus).error(error);
            if (newStatus.isTerminal()) {
                updated.completedAt(now());
            }
            Command saved = commandStore.update(updated.build());
            log.info("Command {} on device {} is now {}", commandId, deviceId, newStatus);
            notifyControllers(saved);
            return saved;
        });
    }

    /**
     * Marks PENDING commands older than {@code ttl} as EXPIRED. Expired commands are never retried.
     *
     * @return number of commands expired
     */
    public int expire(String deviceId, Duration ttl) {
        return lockManager.withLock(deviceId, () -> {
            OffsetDateTime now = now();
            OffsetDateTime cutoff = now.minus(ttl);
            int expired = 0;
            for (Command command : commandStore.findPending(deviceId)) {
                if (command.getCreatedAt().isBefore(cutoff)) {
                    Command saved = commandStore.update(command.toBuilder()
                            .status(CommandStatus.EXPIRED)
                            .completedAt(now)
                            .build());
                    notifyControllers(saved);
                    expired++;
                }
            }
            if (expired > 0) {
                metricsCollector.incrementCounter("relay.commands.expired", expired);
                log.info("Expired {} pending commands for device {}", expired, deviceId);
            }
            return expired;
        });
    }

    /**
     * Runs {@link #expire(String, Duration)} for every device holding a pending command older than {@code ttl}.
     */
    public int expireAll(Duration ttl) {
        List<String> deviceIds = commandStore.findDeviceIdsWithPendingBefore(now().minus(ttl));
        int total = 0;
        for (String deviceId : deviceIds) {
            try {
                total += expire(deviceId, ttl);
            } catch (RuntimeException e) {
                log.error("Error expiring commands for device {}", deviceId, e);
            }
        }
        return total;
    }

    public Optional<Command> find(Long commandId) {
        return commandStore.findById(commandId);
    }

    public List<Command> history(String deviceId, CommandStatus status, int limit, int offset) {
        int boundedLimit = Math.max(1, Math.min(limit, appProperties.getCommands().getHistoryMaxLimit()));
        return commandStore.findHistory(deviceId, status, boundedLimit, Math.max(0, offset));
    }

    /**
     * 1-based position among the device's pending commands, empty once the command left PENDING.
     */
    public Optional<Long> queuePosition(Long commandId) {
        return commandStore.findById(commandId)
                .filter(c -> c.getStatus() == CommandStatus.PENDING)
                .map(c -> commandStore.countPendingAhead(c.getDeviceId(), c.getId()) + 1);
    }

    private void notifyControllers(Command command) {
        for (Session controller : registry.lookupControllerSessions(command.getDeviceId())) {
            if (!controller.send(messageFactory.commandAck(command))) {
                log.debug("Could not forward command {} update to controller session {}", command.getId(), controller.getId());
                registry.dropUnresponsive(controller);
            }
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}

package com.example.relay.server.websocket;

import com.example.relay.server.auth.Identity;
import com.example.relay.server.command.CommandQueue;
import com.example.relay.server.command.QueuedCommand;
import com.example.relay.server.media.MediaFrame;
import com.example.relay.server.media.MediaRouter;
import com.example.relay.server.message.AudioMessage;
import com.example.relay.server.message.CommandAckMessage;
import com.example.relay.server.message.CommandMessage;
import com.example.relay.server.message.FrameMessage;
import com.example.relay.server.message.LocationMessage;
import com.example.relay.server.message.OutboundMessage;
import com.example.relay.server.message.PingMessage;
import com.example.relay.server.message.RegisterMessage;
import com.example.relay.server.message.RelayMessage;
import com.example.relay.server.message.RelayMessageCodec;
import com.example.relay.server.message.RelayMessageFactory;
import com.example.relay.server.message.StatusMessage;
import com.example.relay.server.presence.PresenceTracker;
import com.example.relay.server.session.CloseReason;
import com.example.relay.server.session.ConnectionRegistry;
import com.example.relay.server.session.Session;
import com.example.relay.shared.config.MonitoringConfig;
import com.example.relay.shared.exception.MalformedMessageException;
import com.example.relay.shared.exception.UnknownCommandException;
import com.example.relay.shared.store.DeviceStore;
import com.example.relay.shared.util.Constants.CommandStatus;
import com.example.relay.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Decodes and routes inbound messages of one connection. Called sequentially per connection.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InboundMessageDispatcher {

    private final RelayMessageCodec codec;
    private final RelayMessageFactory messageFactory;
    private final ConnectionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final CommandQueue commandQueue;
    private final MediaRouter mediaRouter;
    private final DeviceStore deviceStore;
    private final MonitoringConfig.RelayMetricsCollector metricsCollector;
    private final Clock clock;

    public void dispatch(ConnectionContext context, String text) {
        if (!context.getTransport().isOpen()) {
            return;
        }
        try {
            handle(context, codec.decode(text));
        } catch (MalformedMessageException e) {
            onMalformed(context, e);
        } catch (UnknownCommandException e) {
            log.warn("Ignoring acknowledgement on connection {}: {}", context.connectionId(), e.getMessage());
        }
    }

    void handle(ConnectionContext context, RelayMessage message) {
        if (message instanceof PingMessage ping) {
            onPing(context, ping);
            return;
        }
        if (message instanceof RegisterMessage register) {
            onRegister(context, register);
            return;
        }
        Session session = context.getSession();
        if (session == null) {
            throw new MalformedMessageException(message.type().wireName() + " before register");
        }
        Runnable route = switch (message.type()) {
            case STATUS -> () -> onStatus(requireDevice(session, message), (StatusMessage) message);
            case COMMAND -> () -> onCommand(requireController(session, message), (CommandMessage) message);
            case COMMAND_ACK -> () -> onCommandAck(requireDevice(session, message), (CommandAckMessage) message);
            case FRAME -> () -> mediaRouter.publish(requireDevice(session, message), MediaFrame.of((FrameMessage) message, clock.millis()));
            case AUDIO -> () -> mediaRouter.publish(requireDevice(session, message), MediaFrame.of((AudioMessage) message, clock.millis()));
            case LOCATION -> () -> mediaRouter.relayLocation(requireDevice(session, message), (LocationMessage) message);
            case REGISTER, PING -> throw new IllegalStateException("Handled above: " + message.type());
        };
        route.run();
    }

    /**
     * Removes the connection's session, if any. Safe to call more than once.
     */
    public void onDisconnect(ConnectionContext context) {
        Session session;
        synchronized (context) {
            if (!context.markDisconnected()) {
                return;
            }
            session = context.getSession();
        }
        if (session != null) {
            registry.remove(session);
        }
        context.getTransport().close(CloseReason.NORMAL);
        log.debug("Connection {} finished", context.connectionId());
    }

    private void onRegister(ConnectionContext context, RegisterMessage register) {
        if (context.getSession() != null) {
            throw new MalformedMessageException("Connection already registered");
        }
        Identity identity = context.getIdentity();
        Session session;
        if (identity.isDevice()) {
            if (!identity.subject().equals(register.deviceId())) {
                rejectRegistration(context, "device token does not match deviceId " + register.deviceId());
                return;
            }
            if (register.deviceInfo() != null && !register.deviceInfo().isEmpty()) {
                deviceStore.updateDeviceInfo(identity.deviceId(), JsonUtils.toJsonObject(register.deviceInfo()));
            }
            session = registry.admitDevice(identity.deviceId(), context.getTransport());
        } else {
            if (!identity.deviceId().equals(register.targetDeviceId())) {
                rejectRegistration(context, "controller is not bound to device " + register.targetDeviceId());
                return;
            }
            session = registry.admitController(identity.subject(), identity.deviceId(), context.getTransport());
        }

        boolean lateAdmission;
        synchronized (context) {
            context.attach(session);
            lateAdmission = context.isDisconnected();
        }
        if (lateAdmission) {
            // the connection went away while the session was being admitted
            registry.remove(session);
        }
    }

    private void rejectRegistration(ConnectionContext context, String reason) {
        log.warn("Rejecting register on connection {} for {}: {}", context.connectionId(), context.getIdentity().subject(), reason);
        context.getTransport().close(CloseReason.AUTH_FAILED);
    }

    private void onStatus(Session session, StatusMessage message) {
        if (!registry.isCurrentDeviceSession(session)) {
            log.debug("Ignoring status from stale session {}", session.getId());
            return;
        }
        presenceTracker.recordStatus(session.getDeviceId(), message.status());
    }

    private void onCommand(Session session, CommandMessage message) {
        try {
            QueuedCommand queued = commandQueue.enqueue(session.getDeviceId(), message.action(), message.params());
            reply(session, messageFactory.submissionResult(queued.command(), queued.queuePosition(), message.seq()));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected command '{}' from controller {}: {}", message.action(), session.getIdentity(), e.getMessage());
            reply(session, messageFactory.submissionRejected(message.action(), e.getMessage(), message.seq()));
        }
    }

    private void onCommandAck(Session session, CommandAckMessage message) {
        CommandStatus status = CommandStatus.fromWire(message.status())
                .orElseThrow(() -> new MalformedMessageException("Unknown command status: " + message.status()));
        commandQueue.acknowledge(session.getDeviceId(), message.commandId(), status, message.error());
    }

    private void onPing(ConnectionContext context, PingMessage ping) {
        Session session = context.getSession();
        if (session == null) {
            if (!context.getTransport().send(codec.encode(messageFactory.pong(ping.seq()), 0))) {
                context.getTransport().close(CloseReason.TRANSPORT_FAILURE);
            }
            return;
        }
        reply(session, messageFactory.pong(ping.seq()));
        if (session.isDevice() && registry.isCurrentDeviceSession(session)) {
            presenceTracker.touch(session.getDeviceId());
        }
    }

    private void onMalformed(ConnectionContext context, MalformedMessageException e) {
        metricsCollector.incrementCounter("relay.messages.malformed");
        log.debug("Dropping malformed message on connection {}: {}", context.connectionId(), e.getMessage());
        if (!context.getMalformedLimiter().acquirePermission()) {
            log.warn("Connection {} exceeded the malformed message limit; closing", context.connectionId());
            context.getTransport().close(CloseReason.MALFORMED);
        }
    }

    private void reply(Session session, OutboundMessage message) {
        if (!session.send(message)) {
            registry.dropUnresponsive(session);
        }
    }

    private static Session requireDevice(Session session, RelayMessage message) {
        if (!session.isDevice()) {
            throw new MalformedMessageException(message.type().wireName() + " is only accepted from devices");
        }
        return session;
    }

    private static Session requireController(Session session, RelayMessage message) {
        if (session.isDevice()) {
            throw new MalformedMessageException(message.type().wireName() + " is only accepted from controllers");
        }
        return session;
    }
}

package com.example.relay.server.message;

import com.example.relay.server.media.MediaFrame;
import com.example.relay.shared.model.Command;
import com.example.relay.shared.util.Constants.DevicePresence;
import com.example.relay.shared.util.Constants.MediaKind;
import com.example.relay.shared.util.JsonUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the server-to-client envelopes. Absent values are left out of the body.
 */
@Component
public class RelayMessageFactory {

    public static final String STATUS_REJECTED = "rejected";

    private final Clock clock;

    public RelayMessageFactory(Clock clock) {
        this.clock = clock;
    }

    public OutboundMessage status(String deviceId, DevicePresence presence, OffsetDateTime lastSeen,
                                  Map<String, Object> reportedStatus) {
        return OutboundMessage.of(MessageType.STATUS, body(
                "deviceId", deviceId,
                "online", presence == DevicePresence.ONLINE,
                "presence", presence.name().toLowerCase(),
                "lastSeen", lastSeen != null ? lastSeen.toString() : null,
                "status", reportedStatus));
    }

    public OutboundMessage command(Command command) {
        return OutboundMessage.of(MessageType.COMMAND, body(
                "commandId", command.getId(),
                "action", command.getAction(),
                "params", JsonUtils.parseObject(command.getParams()),
                "createdAt", command.getCreatedAt() != null ? command.getCreatedAt().toString() : null));
    }

    /**
     * Forwarded device acknowledgement, as seen by controllers.
     */
    public OutboundMessage commandAck(Command command) {
        return OutboundMessage.of(MessageType.COMMAND_ACK, body(
                "commandId", command.getId(),
                "deviceId", command.getDeviceId(),
                "action", command.getAction(),
                "status", command.getStatus().wireName(),
                "error", command.getError()));
    }

    /**
     * Reply to a controller's {@code command} submission.
     */
    public OutboundMessage submissionResult(Command command, Long queuePosition, Long replyTo) {
        return OutboundMessage.of(MessageType.COMMAND_ACK, body(
                "replyTo", replyTo,
                "commandId", command.getId(),
                "deviceId", command.getDeviceId(),
                "action", command.getAction(),
                "status", command.getStatus().wireName(),
                "queuePosition", queuePosition));
    }

    public OutboundMessage submissionRejected(String action, String error, Long replyTo) {
        return OutboundMessage.of(MessageType.COMMAND_ACK, body(
                "replyTo", replyTo,
                "action", action,
                "status", STATUS_REJECTED,
                "error", error));
    }

    public OutboundMessage media(String deviceId, MediaFrame frame) {
        Map<String, Object> body = body(
                "deviceId", deviceId,
                "sequence", frame.sequence(),
                "timestamp", frame.timestamp());
        body.putAll(frame.payload());
        return OutboundMessage.of(frame.kind() == MediaKind.FRAME ? MessageType.FRAME : MessageType.AUDIO, body);
    }

    public OutboundMessage location(String deviceId, LocationMessage location) {
        return OutboundMessage.of(MessageType.LOCATION, body(
                "deviceId", deviceId,
                "latitude", location.latitude(),
                "longitude", location.longitude(),
                "altitude", location.altitude(),
                "accuracy", location.accuracy(),
                "speed", location.speed(),
                "heading", location.heading(),
                "timestamp", location.timestamp() != null ? location.timestamp() : clock.millis()));
    }

    public OutboundMessage pong(Long replyTo) {
        return new OutboundMessage(OutboundMessage.PONG, body(
                "replyTo", replyTo,
                "timestamp", clock.millis()));
    }

    private static Map<String, Object> body(Object... keysAndValues) {
        Map<String, Object> body = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            Object value = keysAndValues[i + 1];
            if (value != null) {
                body.put((String) keysAndValues[i], value);
            }
        }
        return body;
    }
}

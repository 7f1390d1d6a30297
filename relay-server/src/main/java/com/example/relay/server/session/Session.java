package com.example.relay.server.session;

import com.example.relay.server.message.OutboundMessage;
import com.example.relay.server.message.RelayMessageCodec;
import com.example.relay.shared.util.Constants.ClientRole;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One admitted connection. {@code identity} is the device id for devices and the controller id
 * for controllers; {@code deviceId} is always the device the session belongs to or watches.
 * Every outbound frame is stamped with the next value of a per-session counter.
 */
@Getter
public class Session {

    private final String id;
    private final ClientRole role;
    private final String identity;
    private final String deviceId;
    private final Transport transport;
    private final OffsetDateTime connectedAt;
    @Getter(AccessLevel.NONE)
    private final RelayMessageCodec codec;
    @Getter(AccessLevel.NONE)
    private final AtomicLong outboundSeq = new AtomicLong();

    public Session(ClientRole role, String identity, String deviceId, Transport transport,
                   RelayMessageCodec codec, OffsetDateTime connectedAt) {
        this.id = transport.id();
        this.role = role;
        this.identity = identity;
        this.deviceId = deviceId;
        this.transport = transport;
        this.codec = codec;
        this.connectedAt = connectedAt;
    }

    public synchronized boolean send(OutboundMessage message) {
        return transport.send(codec.encode(message, outboundSeq.incrementAndGet()));
    }

    public boolean sendMedia(OutboundMessage message) {
        return transport.sendMedia(codec.encode(message, outboundSeq.incrementAndGet()));
    }

    public long lastSequence() {
        return outboundSeq.get();
    }

    public boolean isDevice() {
        return role == ClientRole.DEVICE;
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    public void close(CloseReason reason) {
        transport.close(reason);
    }

    @Override
    public String toString() {
        return "Session[" + id + ", " + role + ", " + identity + " -> " + deviceId + "]";
    }
}

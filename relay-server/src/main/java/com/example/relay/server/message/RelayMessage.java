package com.example.relay.server.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An inbound envelope. The {@code type} property selects the record; {@code seq} is the
 * sender's optional sequence number and is echoed nowhere.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RegisterMessage.class, name = "register"),
    @JsonSubTypes.Type(value = StatusMessage.class, name = "status"),
    @JsonSubTypes.Type(value = CommandMessage.class, name = "command"),
    @JsonSubTypes.Type(value = CommandAckMessage.class, name = "command_ack"),
    @JsonSubTypes.Type(value = FrameMessage.class, name = "frame"),
    @JsonSubTypes.Type(value = AudioMessage.class, name = "audio"),
    @JsonSubTypes.Type(value = LocationMessage.class, name = "location"),
    @JsonSubTypes.Type(value = PingMessage.class, name = "ping")
})
public sealed interface RelayMessage
        permits RegisterMessage, StatusMessage, CommandMessage, CommandAckMessage,
                FrameMessage, AudioMessage, LocationMessage, PingMessage {

    MessageType type();

    Long seq();
}

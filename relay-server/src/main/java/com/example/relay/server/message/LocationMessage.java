package com.example.relay.server.message;

public record LocationMessage(Long seq, Double latitude, Double longitude, Double altitude, Double accuracy,
                              Double speed, Double heading, Long timestamp) implements RelayMessage {

    public LocationMessage {
        if (latitude == null || longitude == null) {
            throw new IllegalArgumentException("location requires latitude and longitude");
        }
    }

    @Override
    public MessageType type() {
        return MessageType.LOCATION;
    }
}

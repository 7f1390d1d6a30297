package com.example.relay.server.message;

public record AudioMessage(Long seq, long sequence, String data, Integer sampleRate, Integer channels,
                           Integer duration, Long timestamp) implements RelayMessage {

    public AudioMessage {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("audio requires data");
        }
    }

    @Override
    public MessageType type() {
        return MessageType.AUDIO;
    }
}

package com.example.relay.server.message;

/**
 * One camera frame; {@code data} is a base64 JPEG.
 */
public record FrameMessage(Long seq, long sequence, String data, Integer width, Integer height,
                           Integer quality, Long timestamp) implements RelayMessage {

    public FrameMessage {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("frame requires data");
        }
    }

    @Override
    public MessageType type() {
        return MessageType.FRAME;
    }
}

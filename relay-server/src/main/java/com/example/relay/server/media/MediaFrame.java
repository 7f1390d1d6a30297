package com.example.relay.server.media;

import com.example.relay.server.message.AudioMessage;
import com.example.relay.server.message.FrameMessage;
import com.example.relay.shared.util.Constants.MediaKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ephemeral media unit relayed from a device to its controllers. Never stored.
 */
public record MediaFrame(MediaKind kind, long sequence, Map<String, Object> payload, long timestamp) {

    public static MediaFrame of(FrameMessage message, long receivedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", message.data());
        putIfPresent(payload, "width", message.width());
        putIfPresent(payload, "height", message.height());
        putIfPresent(payload, "quality", message.quality());
        return new MediaFrame(MediaKind.FRAME, message.sequence(), payload,
                message.timestamp() != null ? message.timestamp() : receivedAt);
    }

    public static MediaFrame of(AudioMessage message, long receivedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("data", message.data());
        putIfPresent(payload, "sampleRate", message.sampleRate());
        putIfPresent(payload, "channels", message.channels());
        putIfPresent(payload, "duration", message.duration());
        return new MediaFrame(MediaKind.AUDIO, message.sequence(), payload,
                message.timestamp() != null ? message.timestamp() : receivedAt);
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}

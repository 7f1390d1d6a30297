package com.example.relay.server.message;

import com.example.relay.shared.exception.MalformedMessageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Text frame (JSON) to {@link RelayMessage} and {@link OutboundMessage} to text frame.
 */
@Component
@Slf4j
public class RelayMessageCodec {

    private final ObjectReader reader;
    private final ObjectWriter writer;

    public RelayMessageCodec(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(RelayMessage.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.writer = objectMapper.writer();
    }

    /**
     * @throws MalformedMessageException for invalid JSON, a missing or unknown type,
     *         or a payload failing its record's validation
     */
    public RelayMessage decode(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedMessageException("Empty message");
        }
        try {
            RelayMessage message = reader.readValue(text);
            if (message == null) {
                throw new MalformedMessageException("Empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Malformed message: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(OutboundMessage message, long seq) {
        try {
            return writer.writeValueAsString(message.envelope(seq));
        } catch (JsonProcessingException e) {
            // bodies are built from maps of plain values, so this is a programming error
            throw new IllegalStateException("Failed to encode outbound " + message.type() + " message", e);
        }
    }
}

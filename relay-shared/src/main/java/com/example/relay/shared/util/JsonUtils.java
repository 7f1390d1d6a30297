package com.example.relay.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON helpers for the free-form blobs (command params, settings, device info, status)
 * kept as text columns.
 */
@Slf4j
public final class JsonUtils {

    private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonUtils() {}

    public static ObjectMapper mapper() {
        return objectMapper;
    }

    /**
     * Parses a JSON object string.
     *
     * @return the parsed map, or an empty map for null, blank or unparseable input
     */
    public static Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse JSON object string: {}", json, e);
            return new LinkedHashMap<>();
        }
    }

    /**
     * Serializes a map to a JSON object string; null and empty maps become {@code null}.
     */
    public static String toJsonObject(Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize map to JSON object string", e);
            return null;
        }
    }
}

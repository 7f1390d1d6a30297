package com.example.relay.shared.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonUtilsTest {

    @Test
    void unreadableJsonBecomesAnEmptyMap() {
        assertThat(JsonUtils.parseObject(null)).isEmpty();
        assertThat(JsonUtils.parseObject("[1,2]")).isEmpty();
        assertThat(JsonUtils.parseObject("{broken")).isEmpty();
    }

    @Test
    void parsedMapIsMutableAndKeepsOrder() {
        Map<String, Object> parsed = JsonUtils.parseObject("{\"b\":1,\"a\":{\"x\":true}}");

        parsed.put("c", 3);

        assertThat(parsed.keySet()).containsExactly("b", "a", "c");
        assertThat(parsed.get("a")).isEqualTo(Map.of("x", true));
    }

    @Test
    void emptyMapsAreStoredAsNull() {
        assertThat(JsonUtils.toJsonObject(null)).isNull();
        assertThat(JsonUtils.toJsonObject(new LinkedHashMap<>())).isNull();
        assertThat(JsonUtils.toJsonObject(Map.of("k", "v"))).isEqualTo("{\"k\":\"v\"}");
    }
}

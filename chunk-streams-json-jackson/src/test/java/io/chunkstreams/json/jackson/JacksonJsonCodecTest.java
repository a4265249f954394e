package io.chunkstreams.json.jackson;

import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonCodecs;
import io.chunkstreams.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void serviceLoaderFindsJacksonCodec() {
        JsonCodec loaded = JsonCodecs.loadDefault();
        assertThat(loaded).isInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void writesCompactSingleLineJson() throws Exception {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("type", "progress");
        value.put("text", "line one\nline two");
        value.put("steps", List.of(1, 2));

        String json = codec.writeString(value);

        assertThat(json).isEqualTo("{\"type\":\"progress\",\"text\":\"line one\\nline two\",\"steps\":[1,2]}");
        assertThat(json).doesNotContain("\n");
    }

    @Test
    void readObjectKeepsMemberOrder() throws Exception {
        Map<String, Object> parsed = codec.readObject("{\"b\":1,\"a\":{\"nested\":true}}");
        assertThat(parsed.keySet()).containsExactly("b", "a");
        assertThat(parsed.get("a")).isEqualTo(Map.of("nested", true));
    }

    @Test
    void readObjectRejectsMalformedAndNonObjectJson() {
        assertThatThrownBy(() -> codec.readObject("{bad json")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("[1,2]")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("{\"a\":1} trailing")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("  ")).isInstanceOf(JsonException.class);
    }
}

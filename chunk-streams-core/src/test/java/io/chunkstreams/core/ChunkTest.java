package io.chunkstreams.core;

import io.chunkstreams.json.jackson.JacksonJsonCodec;
import io.chunkstreams.json.spi.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void parseKeepsSingleLineTextVerbatim() {
        Chunk chunk = Chunk.parse("{\"type\":\"x\",\"ratio\":1.50}", codec);

        assertThat(chunk.json()).isEqualTo("{\"type\":\"x\",\"ratio\":1.50}");
        assertThat(chunk.type()).contains("x");
    }

    @Test
    void parseCompactsMultiLineJson() {
        Chunk chunk = Chunk.parse("{\n  \"type\": \"text-delta\",\n  \"delta\": \"hi\"\n}", codec);

        assertThat(chunk.json()).isEqualTo("{\"type\":\"text-delta\",\"delta\":\"hi\"}");
        assertThat(chunk.type()).contains("text-delta");
    }

    @Test
    void typeIsOptional() {
        assertThat(Chunk.parse("{\"id\":1}", codec).type()).isEmpty();
        assertThat(Chunk.parse("{\"type\":7}", codec).type()).isEmpty();
    }

    @Test
    void rejectsMalformedAndNonObjectJson() {
        assertThatThrownBy(() -> Chunk.parse("{bad json", codec))
                .isInstanceOf(ChunkStreamsException.MalformedChunk.class)
                .hasMessageContaining("{bad json");
        assertThatThrownBy(() -> Chunk.parse("\"just a string\"", codec))
                .isInstanceOf(ChunkStreamsException.MalformedChunk.class);
    }

    @Test
    void ofSerializesPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "progress");
        payload.put("step", 3);

        Chunk chunk = Chunk.of(payload, codec);

        assertThat(chunk.json()).isEqualTo("{\"type\":\"progress\",\"step\":3}");
        assertThat(chunk.type()).contains("progress");
        assertThat(chunk).isEqualTo(Chunk.parse("{\"type\":\"progress\",\"step\":3}", codec));
    }
}

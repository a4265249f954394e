package io.chunkstreams.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonException;

import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}. Object members keep document order.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory())
                .disable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    /** The mapper must not pretty-print; chunks travel as single lines. */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Cannot write chunk payload as JSON", e);
        }
    }

    @Override
    public Map<String, Object> readObject(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot parse empty JSON text");
        }
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (Exception e) {
            throw new JsonException("Invalid JSON text", e);
        }
        if (node == null || !node.isObject()) {
            throw new JsonException("Expected a JSON object but got " + (node == null ? "nothing" : node.getNodeType()));
        }
        return mapper.convertValue(node, OBJECT_TYPE);
    }

}

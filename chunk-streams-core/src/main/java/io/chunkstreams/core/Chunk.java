package io.chunkstreams.core;

import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonException;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One unit of progress or result information emitted by a producer.
 *
 * <p>A chunk is a JSON object held as single-line JSON text. Apart from the optional {@code "type"}
 * discriminator the payload is opaque to the streaming layer. Instances are immutable and compare
 * by their JSON text.
 */
public final class Chunk {

    public static final String TYPE_FIELD = "type";

    private final String json;
    private final String type;

    private Chunk(String json, String type) {
        this.json = json;
        this.type = type;
    }

    /**
     * Parses JSON text into a chunk.
     *
     * <p>Text without line breaks is kept verbatim; anything else is re-serialized compactly so the
     * chunk fits on one log line and one SSE data line.
     *
     * @throws ChunkStreamsException.MalformedChunk if the text is not a JSON object
     */
    public static Chunk parse(String json, JsonCodec codec) {
        Objects.requireNonNull(codec, "codec");
        try {
            Map<String, Object> members = codec.readObject(json);
            String text = json.indexOf('\n') < 0 && json.indexOf('\r') < 0
                    ? json.strip()
                    : codec.writeString(members);
            return new Chunk(text, typeOf(members));
        } catch (JsonException e) {
            throw new ChunkStreamsException.MalformedChunk("not a JSON object: " + abbreviate(json), e);
        }
    }

    /**
     * Serializes a payload (a map or a bean) into a chunk.
     *
     * @throws ChunkStreamsException.MalformedChunk if the payload does not serialize to a JSON object
     */
    public static Chunk of(Object payload, JsonCodec codec) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(codec, "codec");
        try {
            String text = codec.writeString(payload);
            return new Chunk(text, typeOf(codec.readObject(text)));
        } catch (JsonException e) {
            throw new ChunkStreamsException.MalformedChunk("payload is not a JSON object: " + payload.getClass().getName(), e);
        }
    }

    public String json() {
        return json;
    }

    public Optional<String> type() {
        return Optional.ofNullable(type);
    }

    private static String typeOf(Map<String, Object> members) {
        Object t = members.get(TYPE_FIELD);
        return t instanceof String s ? s : null;
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() <= 100 ? s : s.substring(0, 100) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk)) return false;
        return json.equals(((Chunk) o).json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return json;
    }
}

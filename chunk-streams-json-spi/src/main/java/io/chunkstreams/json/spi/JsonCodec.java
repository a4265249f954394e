package io.chunkstreams.json.spi;

import java.util.Map;

/**
 * Minimal JSON codec used by chunk streams.
 * Implementations wrap a specific JSON library and are discovered through {@link JsonCodecProvider}.
 *
 * <p>Chunks are opaque to the streaming layer, so the codec only needs to move between
 * compact JSON text and generic object trees.
 */
public interface JsonCodec {

    /**
     * Serializes a value to compact, single-line JSON text.
     * @param value the object to serialize
     * @return JSON string without line breaks
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    /**
     * Parses JSON text that must hold a JSON object.
     * @param json JSON string
     * @return the object's members in document order
     * @throws JsonException if the text is not valid JSON or not an object
     */
    Map<String, Object> readObject(String json) throws JsonException;
}

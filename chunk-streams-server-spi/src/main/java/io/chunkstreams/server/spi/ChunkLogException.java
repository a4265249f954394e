package io.chunkstreams.server.spi;

import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.core.StreamKey;

/**
 * Raised when a {@link ChunkLog} cannot commit or read a stream's history.
 *
 * <p>Append failures always reach the producer; a chunk that could not be recorded is never emitted.
 */
public class ChunkLogException extends ChunkStreamsException {
    private final StreamKey key;

    public ChunkLogException(StreamKey key, String message, Throwable cause) {
        super(message + " [stream=" + key + "]", cause);
        this.key = key;
    }

    public StreamKey key() {
        return key;
    }
}

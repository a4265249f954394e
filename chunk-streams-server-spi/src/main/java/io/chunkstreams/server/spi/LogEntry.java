package io.chunkstreams.server.spi;

import io.chunkstreams.core.Chunk;

import java.util.Objects;

/**
 * A chunk as recorded in a {@link ChunkLog}.
 *
 * @param seq 1-based position of the chunk in its stream; gap-free and strictly increasing
 * @param chunk the recorded chunk
 */
public record LogEntry(long seq, Chunk chunk) {
    public LogEntry {
        if (seq < 1) throw new IllegalArgumentException("seq must be >= 1");
        Objects.requireNonNull(chunk, "chunk");
    }
}

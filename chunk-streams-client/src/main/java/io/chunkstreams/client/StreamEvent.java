package io.chunkstreams.client;

import io.chunkstreams.core.Chunk;

import java.util.Objects;

/**
 * Decoded events of a chunk stream subscription.
 *
 * <p>Every (re)connection starts with {@link Connected}: whatever state was built so far is
 * stale and the history that follows replaces it.
 */
public sealed interface StreamEvent permits StreamEvent.Connected, StreamEvent.Data, StreamEvent.Done {

    /**
     * A connection was opened; the server replays the full history next.
     *
     * @param attempt 1 for the first connection, incremented on every reconnect
     */
    record Connected(int attempt) implements StreamEvent {
        public Connected {
            if (attempt < 1) throw new IllegalArgumentException("attempt must be >= 1");
        }
    }

    /**
     * A chunk, in stream order.
     *
     * @param chunk the decoded chunk
     */
    record Data(Chunk chunk) implements StreamEvent {
        public Data {
            Objects.requireNonNull(chunk, "chunk");
        }
    }

    /**
     * The server ended the stream; no reconnect follows.
     */
    record Done() implements StreamEvent {}
}

package io.chunkstreams.server.spi;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;

import java.util.List;

/**
 * Append-only, per-key ordered record of every chunk emitted for a stream.
 *
 * <p>A key's log comes into existence on its first append and is never truncated. Implementations
 * serialize appends per key; a read that overlaps an append never sees a partial record and always
 * returns a prefix of the eventual history.
 */
public interface ChunkLog {

    /**
     * Durably record a chunk as the next entry of the stream.
     *
     * @return the sequence number assigned to the chunk
     * @throws ChunkLogException if the chunk could not be committed
     */
    long append(StreamKey key, Chunk chunk);

    /**
     * All entries recorded so far, in emission order. Unknown keys yield an empty list.
     *
     * @return an immutable snapshot; reading again restarts from the beginning
     * @throws ChunkLogException if the history cannot be read
     */
    List<LogEntry> read(StreamKey key);

    /**
     * Entries with a sequence number greater than {@code afterSeq}, in order.
     */
    default List<LogEntry> readAfter(StreamKey key, long afterSeq) {
        List<LogEntry> all = read(key);
        if (afterSeq <= 0) return all;
        int from = 0;
        while (from < all.size() && all.get(from).seq() <= afterSeq) from++;
        return all.subList(from, all.size());
    }

    /**
     * Whether any chunk has been recorded for the key.
     */
    boolean exists(StreamKey key);

    /**
     * Sequence number of the last committed entry, or 0 when the stream has no history.
     */
    long lastSequence(StreamKey key);
}

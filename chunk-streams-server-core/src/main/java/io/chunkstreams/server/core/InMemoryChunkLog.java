package io.chunkstreams.server.core;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.server.spi.ChunkLog;
import io.chunkstreams.server.spi.LogEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference in-memory {@link ChunkLog}.
 *
 * <p>Good for unit tests and examples. History lives as long as the process.
 */
public final class InMemoryChunkLog implements ChunkLog {

    private final Map<StreamKey, KeyLog> logs = new ConcurrentHashMap<>();

    @Override
    public long append(StreamKey key, Chunk chunk) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(chunk, "chunk");
        return logs.computeIfAbsent(key, k -> new KeyLog()).append(chunk);
    }

    @Override
    public List<LogEntry> read(StreamKey key) {
        KeyLog log = logs.get(key);
        return log == null ? List.of() : log.snapshot(0);
    }

    @Override
    public List<LogEntry> readAfter(StreamKey key, long afterSeq) {
        KeyLog log = logs.get(key);
        return log == null ? List.of() : log.snapshot(afterSeq);
    }

    @Override
    public boolean exists(StreamKey key) {
        return lastSequence(key) > 0;
    }

    @Override
    public long lastSequence(StreamKey key) {
        KeyLog log = logs.get(key);
        return log == null ? 0 : log.size();
    }

    private static final class KeyLog {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<LogEntry> entries = new ArrayList<>();

        long append(Chunk chunk) {
            lock.lock();
            try {
                long seq = entries.size() + 1L;
                entries.add(new LogEntry(seq, chunk));
                return seq;
            } finally {
                lock.unlock();
            }
        }

        List<LogEntry> snapshot(long afterSeq) {
            lock.lock();
            try {
                // seq n sits at index n - 1
                int from = (int) Math.min(Math.max(afterSeq, 0), entries.size());
                return List.copyOf(entries.subList(from, entries.size()));
            } finally {
                lock.unlock();
            }
        }

        long size() {
            lock.lock();
            try {
                return entries.size();
            } finally {
                lock.unlock();
            }
        }
    }
}

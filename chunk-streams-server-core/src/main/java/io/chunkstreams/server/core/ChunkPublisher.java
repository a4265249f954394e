package io.chunkstreams.server.core;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.server.spi.ChunkLog;
import io.chunkstreams.server.spi.ChunkLogException;
import io.chunkstreams.server.spi.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Producer-facing entry point: records a chunk durably, then emits it to live listeners.
 *
 * <p>Append and emit happen under one per-key lock, so live listeners see entries of a key in
 * sequence order. Emission only hands entries to non-blocking listeners; a slow observer never
 * holds up the producer.
 */
public final class ChunkPublisher {

    private static final Logger log = LoggerFactory.getLogger(ChunkPublisher.class);

    private final ChunkLog chunkLog;
    private final ChunkBus bus;
    private final ConnectionRegistry registry;
    private final ConcurrentHashMap<StreamKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ChunkPublisher(ChunkLog chunkLog, ChunkBus bus, ConnectionRegistry registry) {
        this.chunkLog = Objects.requireNonNull(chunkLog, "chunkLog");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Append the chunk to the key's log and emit it.
     *
     * @return the recorded entry
     * @throws ChunkLogException if the chunk could not be recorded; nothing is emitted in that case
     */
    public LogEntry publish(StreamKey key, Chunk chunk) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(chunk, "chunk");
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            long seq = chunkLog.append(key, chunk);
            LogEntry entry = new LogEntry(seq, chunk);
            bus.emit(key, entry);
            log.debug("Published chunk: stream={}, seq={}, type={}", key, seq, chunk.type().orElse("-"));
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * End the stream for every connected observer with the end-of-stream sentinel. Observers that
     * connect later still get the full replay.
     */
    public void complete(StreamKey key) {
        registry.closeConnections(key);
    }
}

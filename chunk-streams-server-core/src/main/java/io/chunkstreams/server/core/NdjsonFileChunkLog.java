package io.chunkstreams.server.core;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonCodecs;
import io.chunkstreams.server.spi.ChunkLog;
import io.chunkstreams.server.spi.ChunkLogException;
import io.chunkstreams.server.spi.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-based {@link ChunkLog} storing one JSON chunk per line.
 *
 * <p>Storage layout:
 * <pre>
 * dataDir/
 *   {stream-key}.chunks.ndjson   - one compact JSON object per line, in emission order
 * </pre>
 *
 * <p>The sequence number of a chunk is its 1-based line number. Appends for a key are serialized
 * by a per-key lock and become visible to readers only once the whole line, newline included, has
 * been written. Readers never look past the last committed newline, so an in-flight append is
 * either fully visible or not at all.
 *
 * <p>When a key is first touched after a restart, an unterminated trailing line (a torn write) is
 * truncated. Lines that fail to parse are skipped but keep their sequence number.
 */
public final class NdjsonFileChunkLog implements ChunkLog {

    private static final Logger log = LoggerFactory.getLogger(NdjsonFileChunkLog.class);

    static final String FILE_SUFFIX = ".chunks.ndjson";
    private static final byte NEWLINE = '\n';

    private final Path dataDir;
    private final JsonCodec codec;
    private final boolean fsync;
    private final ConcurrentHashMap<StreamKey, KeyState> states = new ConcurrentHashMap<>();

    /**
     * Creates a new builder.
     *
     * @param dataDir directory holding the log files; created if missing
     */
    public static Builder builder(Path dataDir) {
        return new Builder(dataDir);
    }

    public NdjsonFileChunkLog(Path dataDir) {
        this(builder(dataDir));
    }

    private NdjsonFileChunkLog(Builder builder) {
        this.dataDir = Objects.requireNonNull(builder.dataDir, "dataDir");
        this.codec = builder.codec != null ? builder.codec : JsonCodecs.loadDefault();
        this.fsync = builder.fsync;
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create chunk log directory " + dataDir, e);
        }
    }

    /**
     * Builder for {@link NdjsonFileChunkLog}.
     */
    public static final class Builder {
        private final Path dataDir;
        private JsonCodec codec;
        private boolean fsync = true;

        private Builder(Path dataDir) {
            this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        }

        /** Sets the codec used to parse stored lines. Default: the ServiceLoader codec. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** Whether every append is forced to the storage device before returning. Default: true. */
        public Builder fsync(boolean fsync) {
            this.fsync = fsync;
            return this;
        }

        public NdjsonFileChunkLog build() {
            return new NdjsonFileChunkLog(this);
        }
    }

    /**
     * Path of the log file for a key.
     */
    public Path pathOf(StreamKey key) {
        return dataDir.resolve(key.value() + FILE_SUFFIX);
    }

    @Override
    public long append(StreamKey key, Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");
        KeyState state = state(key);
        byte[] line = (chunk.json() + "\n").getBytes(StandardCharsets.UTF_8);

        state.lock.lock();
        try {
            long committed = state.committedBytes;
            try (FileChannel channel = FileChannel.open(pathOf(key), StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                channel.position(committed);
                try {
                    ByteBuffer buffer = ByteBuffer.wrap(line);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    if (fsync) {
                        channel.force(false);
                    }
                } catch (IOException e) {
                    rollback(channel, committed, e);
                    throw e;
                }
            } catch (IOException e) {
                throw new ChunkLogException(key, "failed to append chunk", e);
            }
            state.lastSeq++;
            state.committedBytes = committed + line.length;
            return state.lastSeq;
        } finally {
            state.lock.unlock();
        }
    }

    @Override
    public List<LogEntry> read(StreamKey key) {
        return readAfter(key, 0);
    }

    @Override
    public List<LogEntry> readAfter(StreamKey key, long afterSeq) {
        KeyState state = state(key);
        long limit = state.committedBytes;
        if (limit == 0) {
            return List.of();
        }

        byte[] bytes;
        try {
            bytes = readPrefix(pathOf(key), limit);
        } catch (IOException e) {
            throw new ChunkLogException(key, "failed to read chunk log", e);
        }

        List<LogEntry> entries = new ArrayList<>();
        long seq = 0;
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] != NEWLINE) continue;
            seq++;
            if (seq > afterSeq) {
                String line = new String(bytes, start, i - start, StandardCharsets.UTF_8);
                try {
                    entries.add(new LogEntry(seq, Chunk.parse(line, codec)));
                } catch (ChunkStreamsException.MalformedChunk e) {
                    log.warn("Skipping malformed chunk line: stream={}, seq={}, line={}", key, seq, abbreviate(line));
                }
            }
            start = i + 1;
        }
        return List.copyOf(entries);
    }

    @Override
    public boolean exists(StreamKey key) {
        return lastSequence(key) > 0;
    }

    @Override
    public long lastSequence(StreamKey key) {
        KeyState state = state(key);
        state.lock.lock();
        try {
            return state.lastSeq;
        } finally {
            state.lock.unlock();
        }
    }

    private KeyState state(StreamKey key) {
        Objects.requireNonNull(key, "key");
        KeyState existing = states.get(key);
        if (existing != null) {
            return existing;
        }
        return states.computeIfAbsent(key, this::recover);
    }

    private KeyState recover(StreamKey key) {
        Path path = pathOf(key);
        if (!Files.exists(path)) {
            return new KeyState(0, 0);
        }
        try {
            long size = Files.size(path);
            byte[] bytes = readPrefix(path, size);
            long lines = 0;
            int lastNewline = -1;
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] == NEWLINE) {
                    lines++;
                    lastNewline = i;
                }
            }
            long committed = lastNewline + 1L;
            if (committed < size) {
                log.warn("Truncating torn trailing line: stream={}, path={}, bytes={}", key, path, size - committed);
                try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
                    channel.truncate(committed);
                }
            }
            log.debug("Recovered chunk log: stream={}, chunks={}, bytes={}", key, lines, committed);
            return new KeyState(lines, committed);
        } catch (IOException e) {
            throw new ChunkLogException(key, "failed to recover chunk log", e);
        }
    }

    private static byte[] readPrefix(Path path, long length) throws IOException {
        if (length > Integer.MAX_VALUE - 8) {
            throw new IOException("chunk log too large to read at once: " + length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) length);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new IOException("chunk log shorter than committed length: " + path);
                }
            }
        }
        return buffer.array();
    }

    private static void rollback(FileChannel channel, long committed, IOException cause) {
        try {
            channel.truncate(committed);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 100 ? s : s.substring(0, 100) + "...";
    }

    private static final class KeyState {
        private final ReentrantLock lock = new ReentrantLock();
        private long lastSeq;
        private volatile long committedBytes;

        KeyState(long lastSeq, long committedBytes) {
            this.lastSeq = lastSeq;
            this.committedBytes = committedBytes;
        }
    }
}

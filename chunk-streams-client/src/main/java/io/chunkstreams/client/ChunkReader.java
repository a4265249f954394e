package io.chunkstreams.client;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.core.Protocol;
import io.chunkstreams.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Objects;

/**
 * Reads chunk events from a {@code text/event-stream} body.
 *
 * <p>Comments are consumed silently. Each {@code data:} line carries one chunk; a line that is not
 * a JSON object is dropped and reading goes on. {@code data: [DONE]} yields {@link StreamEvent.Done}
 * and ends the read.
 */
public final class ChunkReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkReader.class);

    private final InputStream in;
    private final JsonCodec codec;
    private final SseRecordDecoder decoder = new SseRecordDecoder();
    private final ArrayDeque<StreamEvent> ready = new ArrayDeque<>();
    private final byte[] buffer = new byte[8192];
    private boolean eof;
    private boolean done;

    public ChunkReader(InputStream in, JsonCodec codec) {
        this.in = Objects.requireNonNull(in, "in");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @return the next chunk or {@link StreamEvent.Done}, or {@code null} at end of input
     */
    public StreamEvent next() throws IOException {
        while (ready.isEmpty()) {
            if (done || eof) return null;
            int n = in.read(buffer);
            if (n < 0) {
                eof = true;
                accept(decoder.finish());
            } else if (n > 0) {
                accept(decoder.feed(buffer, 0, n));
            }
        }
        return ready.poll();
    }

    private void accept(Iterable<SseRecord> records) {
        for (SseRecord record : records) {
            if (done) return;
            if (record instanceof SseRecord.Data data) {
                for (String line : data.lines()) {
                    if (!acceptLine(line)) return;
                }
            }
        }
    }

    private boolean acceptLine(String line) {
        String text = line.strip();
        if (text.isEmpty()) return true;
        if (Protocol.DONE.equals(text)) {
            ready.add(new StreamEvent.Done());
            done = true;
            return false;
        }
        try {
            ready.add(new StreamEvent.Data(Chunk.parse(text, codec)));
        } catch (ChunkStreamsException.MalformedChunk e) {
            log.debug("Dropping malformed data record: {}", e.getMessage());
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}

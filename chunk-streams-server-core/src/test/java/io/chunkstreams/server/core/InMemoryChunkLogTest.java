package io.chunkstreams.server.core;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.json.jackson.JacksonJsonCodec;
import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.server.spi.LogEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryChunkLogTest {

    private final JsonCodec codec = new JacksonJsonCodec();
    private final InMemoryChunkLog log = new InMemoryChunkLog();
    private final StreamKey key = StreamKey.of("job-1");

    @Test
    void appendAssignsGapFreeSequenceNumbers() {
        assertThat(log.append(key, chunk(1))).isEqualTo(1);
        assertThat(log.append(key, chunk(2))).isEqualTo(2);
        assertThat(log.append(StreamKey.of("job-2"), chunk(1))).isEqualTo(1);

        assertThat(log.lastSequence(key)).isEqualTo(2);
        assertThat(log.read(key)).extracting(LogEntry::seq).containsExactly(1L, 2L);
    }

    @Test
    void unknownKeyHasNoHistory() {
        assertThat(log.exists(key)).isFalse();
        assertThat(log.read(key)).isEmpty();
        assertThat(log.readAfter(key, 3)).isEmpty();
        assertThat(log.lastSequence(key)).isZero();
    }

    @Test
    void readIsASnapshot() {
        log.append(key, chunk(1));
        List<LogEntry> snapshot = log.read(key);
        log.append(key, chunk(2));

        assertThat(snapshot).hasSize(1);
        assertThat(log.read(key)).hasSize(2);
        assertThatThrownBy(() -> snapshot.add(new LogEntry(9, chunk(9))))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void readAfterSkipsDeliveredEntries() {
        for (int i = 1; i <= 5; i++) log.append(key, chunk(i));

        assertThat(log.readAfter(key, 3)).extracting(LogEntry::seq).containsExactly(4L, 5L);
        assertThat(log.readAfter(key, 5)).isEmpty();
        assertThat(log.readAfter(key, 0)).hasSize(5);
    }

    private Chunk chunk(int n) {
        return Chunk.parse("{\"type\":\"progress\",\"n\":" + n + "}", codec);
    }
}

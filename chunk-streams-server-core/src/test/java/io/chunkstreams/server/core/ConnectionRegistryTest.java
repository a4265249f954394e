package io.chunkstreams.server.core;

import io.chunkstreams.core.StreamKey;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final StreamKey key = StreamKey.of("job-1");

    @Test
    void countsConnectionsPerKey() {
        registry.addConnection(key, new RecordingConnection(key));
        registry.addConnection(key, new RecordingConnection(key));
        StreamKey other = StreamKey.of("job-2");
        registry.addConnection(other, new RecordingConnection(other));

        assertThat(registry.connectionCount(key)).isEqualTo(2);
        assertThat(registry.connectionCount(other)).isEqualTo(1);
        assertThat(registry.totalConnections()).isEqualTo(3);
        assertThat(registry.connectionCount(StreamKey.of("unknown"))).isZero();
    }

    @Test
    void removeIsIdempotent() {
        RecordingConnection connection = new RecordingConnection(key);
        registry.addConnection(key, connection);

        assertThat(registry.removeConnection(key, connection)).isTrue();
        assertThat(registry.removeConnection(key, connection)).isFalse();
        assertThat(registry.removeConnection(StreamKey.of("unknown"), connection)).isFalse();
        assertThat(registry.connectionCount(key)).isZero();
    }

    @Test
    void closeConnectionsFinishesOnlyThatKey() {
        RecordingConnection a = new RecordingConnection(key);
        RecordingConnection b = new RecordingConnection(key);
        StreamKey otherKey = StreamKey.of("job-2");
        RecordingConnection other = new RecordingConnection(otherKey);
        registry.addConnection(key, a);
        registry.addConnection(key, b);
        registry.addConnection(otherKey, other);

        registry.closeConnections(key);

        assertThat(a.finished).isTrue();
        assertThat(b.finished).isTrue();
        assertThat(other.finished).isFalse();
    }

    @Test
    void closeAllClosesWithoutSentinel() {
        RecordingConnection a = new RecordingConnection(key);
        registry.addConnection(key, a);

        registry.closeAll();

        assertThat(a.closed).isTrue();
        assertThat(a.finished).isFalse();
    }

    @Test
    void connectionsIsASnapshot() {
        RecordingConnection a = new RecordingConnection(key);
        registry.addConnection(key, a);

        Set<StreamConnection> snapshot = registry.connections(key);
        registry.removeConnection(key, a);

        assertThat(snapshot).containsExactly(a);
        assertThat(registry.connections(key)).isEmpty();
    }

    private final class RecordingConnection implements StreamConnection {
        private final StreamKey key;
        volatile boolean finished;
        volatile boolean closed;

        RecordingConnection(StreamKey key) {
            this.key = key;
        }

        @Override
        public StreamKey key() {
            return key;
        }

        @Override
        public void finish() {
            finished = true;
            close();
        }

        @Override
        public void close() {
            closed = true;
            registry.removeConnection(key, this);
        }
    }
}

package io.chunkstreams.client;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStreamsClientBuilderTest {

    @Test
    void customTransportReceivesEventStreamRequest() throws Exception {
        RecordingTransport transport = new RecordingTransport(
                "data: {\"type\":\"x\"}\n\n: keep-alive\n\ndata: {\"type\":\"y\"}\n\ndata: [DONE]\n\n");
        ChunkStreamClient client = ChunkStreamClient.builder()
                .transport(transport)
                .codec(new JacksonJsonCodec())
                .build();

        ChunkStateReducer<List<String>> types = new ChunkStateReducer<>(List.of(), ChunkStreamsClientBuilderTest::appendType);
        client.subscribe(StreamRequest.of(URI.create("http://localhost/api/stream"), "my report.pdf")).subscribe(types);

        assertThat(types.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(types.isDone()).isTrue();
        assertThat(types.state()).containsExactly("x", "y");

        TransportRequest sent = transport.lastRequest;
        assertThat(sent.method()).isEqualTo("GET");
        assertThat(sent.url()).hasToString("http://localhost/api/stream?filename=my%20report.pdf");
        assertThat(sent.headers()).containsEntry("Accept", List.of("text/event-stream"))
                .containsEntry("Cache-Control", List.of("no-cache"));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> ChunkStreamClient.builder().maxReconnects(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkStreamClient.builder().reconnectDelay(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<String> appendType(List<String> types, Chunk chunk) {
        List<String> next = new ArrayList<>(types);
        next.add(chunk.type().orElse(""));
        return next;
    }

    private static final class RecordingTransport implements ChunkStreamsTransport {
        private final String body;
        private volatile TransportRequest lastRequest;

        private RecordingTransport(String body) {
            this.body = body;
        }

        @Override
        public TransportResponse<InputStream> sendStream(TransportRequest request) {
            lastRequest = request;
            return new TransportResponse<>(200, Map.of("Content-Type", List.of("text/event-stream")),
                    new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        }
    }
}

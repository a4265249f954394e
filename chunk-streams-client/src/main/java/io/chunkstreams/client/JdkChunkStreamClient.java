package io.chunkstreams.client;

import io.chunkstreams.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Flow;

public final class JdkChunkStreamClient implements ChunkStreamClient {

    private final ChunkStreamsTransport transport;
    private final JsonCodec codec;
    private final Duration reconnectDelay;
    private final int maxReconnects;

    public JdkChunkStreamClient(HttpClient http, JsonCodec codec) {
        this(new JdkHttpTransport(http), codec,
                ChunkStreamsClientBuilder.DEFAULT_RECONNECT_DELAY, ChunkStreamsClientBuilder.DEFAULT_MAX_RECONNECTS);
    }

    JdkChunkStreamClient(ChunkStreamsTransport transport, JsonCodec codec, Duration reconnectDelay, int maxReconnects) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.maxReconnects = maxReconnects;
    }

    @Override
    public Flow.Publisher<StreamEvent> subscribe(StreamRequest request) {
        Objects.requireNonNull(request, "request");
        return new StreamLoop(transport, codec, request, reconnectDelay, maxReconnects).publisher();
    }
}

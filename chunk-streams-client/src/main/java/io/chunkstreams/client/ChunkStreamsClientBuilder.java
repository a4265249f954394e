package io.chunkstreams.client;

import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

public final class ChunkStreamsClientBuilder {
    /** Pause before reconnecting. */
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_RECONNECTS = 10;

    private ChunkStreamsTransport transport;
    private JsonCodec codec;
    private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
    private int maxReconnects = DEFAULT_MAX_RECONNECTS;

    public ChunkStreamsClientBuilder transport(ChunkStreamsTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    public ChunkStreamsClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.transport = new JdkHttpTransport(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    /** Codec for decoding chunks. Default: the codec found by {@link JsonCodecs#loadDefault()}. */
    public ChunkStreamsClientBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return this;
    }

    public ChunkStreamsClientBuilder reconnectDelay(Duration reconnectDelay) {
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        if (reconnectDelay.isNegative()) throw new IllegalArgumentException("reconnectDelay must be >= 0");
        this.reconnectDelay = reconnectDelay;
        return this;
    }

    /**
     * Connections that end without the sentinel are retried this many times in a row; a connection
     * that delivers at least one chunk resets the count. 0 disables reconnecting.
     */
    public ChunkStreamsClientBuilder maxReconnects(int maxReconnects) {
        if (maxReconnects < 0) throw new IllegalArgumentException("maxReconnects must be >= 0");
        this.maxReconnects = maxReconnects;
        return this;
    }

    public ChunkStreamClient build() {
        ChunkStreamsTransport resolved = transport;
        if (resolved == null) {
            resolved = new JdkHttpTransport(HttpClient.newHttpClient());
        }
        JsonCodec resolvedCodec = codec != null ? codec : JsonCodecs.loadDefault();
        return new JdkChunkStreamClient(resolved, resolvedCodec, reconnectDelay, maxReconnects);
    }
}

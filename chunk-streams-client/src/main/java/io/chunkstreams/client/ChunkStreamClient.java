package io.chunkstreams.client;

import java.util.concurrent.Flow;

/**
 * Follows chunk streams served over {@code text/event-stream}.
 */
public interface ChunkStreamClient {

    /**
     * Opens the stream when subscribed to and reconnects whenever the connection ends without the
     * end-of-stream sentinel. Each connection begins with {@link StreamEvent.Connected} followed by
     * the full history.
     *
     * <p>The publisher completes after {@link StreamEvent.Done}. It fails with
     * {@link io.chunkstreams.core.ChunkStreamsException.StreamRejected} when the server answers
     * with a status other than 200, and with {@link java.io.IOException} once the reconnect budget
     * is spent.
     */
    Flow.Publisher<StreamEvent> subscribe(StreamRequest request);

    static ChunkStreamClient create() {
        return builder().build();
    }

    static ChunkStreamClient create(java.net.http.HttpClient httpClient) {
        return builder().jdkHttpClient(httpClient).build();
    }

    static ChunkStreamsClientBuilder builder() {
        return new ChunkStreamsClientBuilder();
    }
}

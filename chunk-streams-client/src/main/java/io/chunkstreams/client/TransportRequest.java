package io.chunkstreams.client;

import io.chunkstreams.core.Protocol;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A streaming request handed to a {@link ChunkStreamsTransport}.
 *
 * @param timeout time allowed until the response headers arrive, or {@code null} for none
 */
public record TransportRequest(String method, URI url, Map<String, List<String>> headers, Duration timeout) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** An event-stream GET without a timeout. */
    public static TransportRequest eventStream(URI url) {
        return new TransportRequest("GET", url, Map.of(
                Protocol.H_ACCEPT, List.of(Protocol.CT_EVENT_STREAM),
                Protocol.H_CACHE_CONTROL, List.of("no-cache")), null);
    }
}

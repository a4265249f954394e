package io.chunkstreams.server.core;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An HTTP request as seen by {@link ChunkStreamsHandler}, independent of the hosting server.
 */
public record ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** First value of the query parameter, if present. */
    public Optional<String> queryParam(String name) {
        return Optional.ofNullable(QueryString.parse(uri).get(name));
    }
}

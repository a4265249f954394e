package io.chunkstreams.server.core;

import java.util.Locale;

/**
 * HTTP request methods a host can hand to {@link ChunkStreamsHandler}.
 */
public enum HttpMethod {
    GET, HEAD, POST, PUT, DELETE, PATCH, OPTIONS;

    /**
     * Maps a method name as sent on the wire.
     *
     * @throws IllegalArgumentException for unknown methods
     */
    public static HttpMethod of(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}

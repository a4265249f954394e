package io.chunkstreams.client;

import io.chunkstreams.core.StreamKey;
import io.chunkstreams.core.Urls;

import java.net.URI;
import java.util.Objects;

/**
 * Request to follow one stream.
 *
 * @param streamUrl the absolute URL of the stream route, for example {@code http://host/api/stream}
 * @param key the stream to follow
 */
public record StreamRequest(URI streamUrl, StreamKey key) {
    public StreamRequest {
        Objects.requireNonNull(streamUrl, "streamUrl");
        Objects.requireNonNull(key, "key");
    }

    public static StreamRequest of(URI streamUrl, String filename) {
        return new StreamRequest(streamUrl, StreamKey.of(filename));
    }

    /** The URL actually requested, with the key as query parameter. */
    public URI uri() {
        return Urls.streamUri(streamUrl, key);
    }
}

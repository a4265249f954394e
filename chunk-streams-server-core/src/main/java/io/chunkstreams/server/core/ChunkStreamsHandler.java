package io.chunkstreams.server.core;

import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.core.Protocol;
import io.chunkstreams.core.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Framework-neutral HTTP handler for the stream route.
 *
 * <p>{@code GET ?filename=<key>} answers {@code 200 text/event-stream} with a body that replays the
 * key's history and then follows it live. A missing or invalid key is answered with {@code 400} and
 * a plain-text reason; other methods with {@code 405}.
 */
public final class ChunkStreamsHandler {

    private static final Logger log = LoggerFactory.getLogger(ChunkStreamsHandler.class);

    static final String MISSING_FILENAME = "Missing filename parameter";

    private final StreamEndpoint endpoint;

    public ChunkStreamsHandler(StreamEndpoint endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public ServerResponse handle(ServerRequest req) {
        if (req.method() != HttpMethod.GET) {
            return ServerResponse.empty(405)
                    .header("Allow", "GET")
                    .header(Protocol.H_CACHE_CONTROL, "no-store");
        }
        String filename = req.queryParam(Protocol.Q_FILENAME).orElse("");
        if (filename.isEmpty()) {
            return badRequest(MISSING_FILENAME);
        }
        StreamKey key;
        try {
            key = StreamKey.of(filename);
        } catch (ChunkStreamsException.InvalidStreamKey e) {
            log.debug("Rejected stream request: {}", e.getMessage());
            return badRequest(e.getMessage());
        }
        return ServerResponse.eventStream(endpoint.open(key))
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive")
                .header(Protocol.H_ALLOW_ORIGIN, "*")
                .header(Protocol.H_ALLOW_METHODS, "GET")
                .header(Protocol.H_ALLOW_HEADERS, Protocol.H_CACHE_CONTROL);
    }

    private static ServerResponse badRequest(String message) {
        return ServerResponse.text(400, message)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }
}

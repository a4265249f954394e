package io.chunkstreams.server.core;

import io.chunkstreams.core.Protocol;
import io.chunkstreams.core.SseFrame;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Flow;

/**
 * Status, headers and body produced by {@link ChunkStreamsHandler}; the host copies them onto its
 * own response. Header names keep their insertion order and are matched case-insensitively.
 */
public final class ServerResponse {

    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = Objects.requireNonNull(body, "body");
    }

    static ServerResponse empty(int status) {
        return new ServerResponse(status, new ResponseBody.Empty());
    }

    static ServerResponse text(int status, String message) {
        return new ServerResponse(status, new ResponseBody.Bytes(message.getBytes(StandardCharsets.UTF_8)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT_PLAIN);
    }

    static ServerResponse eventStream(Flow.Publisher<SseFrame> frames) {
        return new ServerResponse(200, new ResponseBody.Sse(frames))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM);
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> firstHeader(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }
}

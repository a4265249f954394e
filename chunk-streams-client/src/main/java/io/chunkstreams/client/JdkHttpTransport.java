package io.chunkstreams.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * {@link ChunkStreamsTransport} over {@link HttpClient}. The body is returned unread so chunks
 * can be consumed as they arrive.
 */
public final class JdkHttpTransport implements ChunkStreamsTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient http;

    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), HttpRequest.BodyPublishers.noBody());
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        request.headers().forEach((name, values) -> values.forEach(value -> builder.header(name, value)));

        log.debug("Opening stream: {} {}", request.method(), request.url());
        HttpResponse<InputStream> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        return new TransportResponse<>(response.statusCode(), response.headers().map(), response.body());
    }
}

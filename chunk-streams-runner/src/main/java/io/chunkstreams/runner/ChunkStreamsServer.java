package io.chunkstreams.runner;

import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.core.Protocol;
import io.chunkstreams.core.SseFrame;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.json.spi.JsonCodecs;
import io.chunkstreams.json.spi.JsonException;
import io.chunkstreams.server.core.ChunkStreamsHandler;
import io.chunkstreams.server.core.HttpMethod;
import io.chunkstreams.server.core.NdjsonFileChunkLog;
import io.chunkstreams.server.core.ResponseBody;
import io.chunkstreams.server.core.ServerRequest;
import io.chunkstreams.server.core.ServerResponse;
import io.chunkstreams.server.core.StreamEndpoint;
import io.chunkstreams.server.spi.ChunkLog;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Javalin host for chunk streams.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code GET /api/stream?filename=<key>}: replay, then live chunks as {@code text/event-stream}</li>
 *   <li>{@code POST /api/process?filename=<key>[&reprocess=true]}: start a simulated job</li>
 *   <li>{@code GET /api/jobs[?filename=<key>]}: job and stream status</li>
 * </ul>
 */
public final class ChunkStreamsServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkStreamsServer.class);

    static final String PROCESS_PATH = "/api/process";
    static final String JOBS_PATH = "/api/jobs";
    static final String Q_REPROCESS = "reprocess";

    private final RunnerConfig config;
    private final JsonCodec codec;
    private final ChunkLog chunkLog;
    private final StreamEndpoint endpoint;
    private final ChunkStreamsHandler handler;
    private final JobManager jobs;
    private final Javalin app;
    private final AtomicBoolean closed = new AtomicBoolean();

    public ChunkStreamsServer(RunnerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = JsonCodecs.loadDefault();
        this.chunkLog = NdjsonFileChunkLog.builder(Path.of(config.dataDir()))
                .codec(codec)
                .fsync(config.fsync())
                .build();
        this.endpoint = StreamEndpoint.builder(chunkLog)
                .keepAliveInterval(Duration.ofSeconds(config.keepAliveSeconds()))
                .maxPendingChunks(config.maxPendingChunks())
                .build();
        this.handler = new ChunkStreamsHandler(endpoint);
        this.jobs = new JobManager(endpoint.publisher(), chunkLog, codec,
                config.job().steps(), Duration.ofMillis(config.job().stepDelayMillis()), config.job().workers());

        this.app = Javalin.create(javalin -> javalin.showJavalinBanner = false);
        app.get(Protocol.STREAM_PATH, this::handleStream);
        app.post(Protocol.STREAM_PATH, this::handleStream);
        app.delete(Protocol.STREAM_PATH, this::handleStream);
        app.post(PROCESS_PATH, this::handleProcess);
        app.get(JOBS_PATH, this::handleJobs);
    }

    public static void main(String[] args) {
        ChunkStreamsServer server = new ChunkStreamsServer(loadConfig());
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "chunk-streams-shutdown"));
        server.start();
    }

    /**
     * Reads {@link RunnerConfig} from system properties, environment and
     * {@code META-INF/microprofile-config.properties}.
     */
    static RunnerConfig loadConfig() {
        SmallRyeConfig smallRyeConfig = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(RunnerConfig.class)
                .build();
        return smallRyeConfig.getConfigMapping(RunnerConfig.class);
    }

    public ChunkStreamsServer start() {
        app.start(config.port());
        log.info("Chunk streams server listening on http://localhost:{} (data dir {})", app.port(), config.dataDir());
        return this;
    }

    public int port() {
        return app.port();
    }

    StreamEndpoint endpoint() {
        return endpoint;
    }

    JobManager jobs() {
        return jobs;
    }

    /**
     * Stops jobs, closes every stream without the end-of-stream sentinel so clients reconnect, then
     * stops the HTTP server.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down chunk streams server");
        jobs.shutdown();
        endpoint.shutdown();
        app.stop();
    }

    private void handleStream(Context ctx) throws IOException {
        ServerRequest request = new ServerRequest(
                HttpMethod.of(ctx.method().name()),
                URI.create(ctx.fullUrl()),
                toHeaders(ctx));

        ServerResponse response = handler.handle(request);
        ctx.status(response.status());
        for (Map.Entry<String, List<String>> e : response.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }

        if (response.body() instanceof ResponseBody.Bytes bytes) {
            ctx.result(bytes.bytes());
        } else if (response.body() instanceof ResponseBody.Sse sse) {
            writeSse(ctx, sse.publisher());
        }
    }

    private void handleProcess(Context ctx) throws JsonException {
        String filename = ctx.queryParam(Protocol.Q_FILENAME);
        if (filename == null || filename.isEmpty()) {
            filename = filenameFromBody(ctx);
        }
        if (filename == null || filename.isEmpty()) {
            json(ctx, 400, Map.of("error", "Filename is required"));
            return;
        }
        StreamKey key;
        try {
            key = StreamKey.of(filename);
        } catch (ChunkStreamsException.InvalidStreamKey e) {
            json(ctx, 400, Map.of("error", e.getMessage()));
            return;
        }
        boolean reprocess = Boolean.parseBoolean(ctx.queryParam(Q_REPROCESS));

        switch (jobs.start(key, reprocess)) {
            case STARTED -> json(ctx, 202, Map.of("filename", key.value(), "status", "started"));
            case RUNNING -> json(ctx, 409, Map.of("filename", key.value(), "error", "File is already being processed"));
            case HAS_HISTORY -> json(ctx, 409, Map.of("filename", key.value(),
                    "error", "File was already processed; pass reprocess=true to run it again"));
        }
    }

    private String filenameFromBody(Context ctx) throws JsonException {
        String body = ctx.body();
        if (body.isBlank()) return null;
        Object value = codec.readObject(body).get(Protocol.Q_FILENAME);
        return value instanceof String s ? s : null;
    }

    private void handleJobs(Context ctx) throws JsonException {
        String filename = ctx.queryParam(Protocol.Q_FILENAME);
        if (filename == null || filename.isEmpty()) {
            List<Map<String, Object>> running = new ArrayList<>();
            for (StreamKey key : jobs.runningJobs()) {
                running.add(status(key));
            }
            json(ctx, 200, Map.of("jobs", running, "count", running.size()));
            return;
        }
        StreamKey key;
        try {
            key = StreamKey.of(filename);
        } catch (ChunkStreamsException.InvalidStreamKey e) {
            json(ctx, 400, Map.of("error", e.getMessage()));
            return;
        }
        json(ctx, 200, status(key));
    }

    private Map<String, Object> status(StreamKey key) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("filename", key.value());
        status.put("running", jobs.isRunning(key));
        status.put("chunks", chunkLog.lastSequence(key));
        status.put("connections", endpoint.registry().connectionCount(key));
        return status;
    }

    private void json(Context ctx, int status, Map<String, ?> body) throws JsonException {
        ctx.status(status)
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .contentType(Protocol.CT_JSON)
                .result(codec.writeString(body));
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }

    /**
     * Writes frames to the response as they arrive and holds the request thread until the stream
     * ends. A failed write cancels the subscription, which tears the session down.
     */
    private static void writeSse(Context ctx, Flow.Publisher<SseFrame> publisher) throws IOException {
        OutputStream out = ctx.res().getOutputStream();
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<Flow.Subscription> subscriptionRef = new AtomicReference<>();

        publisher.subscribe(new Flow.Subscriber<>() {
            private Flow.Subscription subscription;

            @Override
            public void onSubscribe(Flow.Subscription subscription) {
                this.subscription = subscription;
                subscriptionRef.set(subscription);
                subscription.request(Long.MAX_VALUE);
            }

            @Override
            public void onNext(SseFrame item) {
                try {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    log.debug("Observer went away: {}", e.getMessage());
                    subscription.cancel();
                    done.countDown();
                }
            }

            @Override
            public void onError(Throwable throwable) {
                log.warn("Stream ended with error: {}", ctx.fullUrl(), throwable);
                done.countDown();
            }

            @Override
            public void onComplete() {
                done.countDown();
            }
        });

        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while streaming: {}", ctx.fullUrl());
            Flow.Subscription subscription = subscriptionRef.get();
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }
}

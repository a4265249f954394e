package io.chunkstreams.server.core;

import io.chunkstreams.core.SseFrame;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.server.spi.ChunkLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Serves observer connections for stream keys: history replay followed by live delivery.
 *
 * <p>{@link #open(StreamKey)} returns a cold {@link Flow.Publisher}; every subscription is one
 * connection served by its own task. A host adapts the publisher to its transport:
 * <ul>
 *   <li>start: {@code subscribe}</li>
 *   <li>write: {@code onNext}, rendering each {@link SseFrame} to the observer</li>
 *   <li>abort: {@code Subscription.cancel()} when the observer goes away or a write fails</li>
 *   <li>close: {@code onComplete}/{@code onError}, signalled exactly once</li>
 * </ul>
 *
 * <p>Use {@link #builder(ChunkLog)} to create instances with custom configuration:
 * <pre>{@code
 * StreamEndpoint endpoint = StreamEndpoint.builder(new NdjsonFileChunkLog(dataDir))
 *     .keepAliveInterval(Duration.ofSeconds(30))
 *     .maxPendingChunks(1024)
 *     .build();
 * endpoint.publisher().publish(key, chunk);
 * }</pre>
 */
public final class StreamEndpoint implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StreamEndpoint.class);

    public static final Duration DEFAULT_KEEP_ALIVE_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_PENDING_CHUNKS = 1024;

    private final ChunkLog chunkLog;
    private final ChunkBus bus;
    private final ConnectionRegistry registry;
    private final ChunkPublisher publisher;
    private final Duration keepAliveInterval;
    private final int maxPendingChunks;
    private final ExecutorService sessionExecutor;
    private final ScheduledExecutorService keepAliveScheduler;
    private final boolean ownsSessionExecutor;
    private final boolean ownsKeepAliveScheduler;

    /**
     * Creates a new builder.
     *
     * @param chunkLog the durable log (required)
     */
    public static Builder builder(ChunkLog chunkLog) {
        return new Builder(chunkLog);
    }

    public StreamEndpoint(ChunkLog chunkLog) {
        this(builder(chunkLog));
    }

    private StreamEndpoint(Builder builder) {
        this.chunkLog = Objects.requireNonNull(builder.chunkLog, "chunkLog");
        this.bus = builder.bus != null ? builder.bus : new ChunkBus();
        this.registry = builder.registry != null ? builder.registry : new ConnectionRegistry();
        this.keepAliveInterval = builder.keepAliveInterval != null ? builder.keepAliveInterval : DEFAULT_KEEP_ALIVE_INTERVAL;
        this.maxPendingChunks = builder.maxPendingChunks > 0 ? builder.maxPendingChunks : DEFAULT_MAX_PENDING_CHUNKS;
        if (keepAliveInterval.isNegative() || keepAliveInterval.isZero()) {
            throw new IllegalArgumentException("keep-alive interval must be > 0");
        }
        this.ownsSessionExecutor = builder.sessionExecutor == null;
        this.ownsKeepAliveScheduler = builder.keepAliveScheduler == null;
        this.sessionExecutor = builder.sessionExecutor != null
                ? builder.sessionExecutor
                : Executors.newCachedThreadPool(new DaemonThreadFactory("chunk-streams-session-"));
        this.keepAliveScheduler = builder.keepAliveScheduler != null
                ? builder.keepAliveScheduler
                : Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("chunk-streams-keep-alive-"));
        this.publisher = new ChunkPublisher(chunkLog, bus, registry);
    }

    /**
     * Builder for {@link StreamEndpoint}.
     */
    public static final class Builder {
        private final ChunkLog chunkLog;
        private ChunkBus bus;
        private ConnectionRegistry registry;
        private Duration keepAliveInterval;
        private int maxPendingChunks;
        private ExecutorService sessionExecutor;
        private ScheduledExecutorService keepAliveScheduler;

        private Builder(ChunkLog chunkLog) {
            this.chunkLog = Objects.requireNonNull(chunkLog, "chunkLog");
        }

        /** Shares an existing bus. Default: a new bus owned by this endpoint. */
        public Builder bus(ChunkBus bus) {
            this.bus = bus;
            return this;
        }

        /** Shares an existing registry. Default: a new registry owned by this endpoint. */
        public Builder registry(ConnectionRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Sets the keep-alive comment interval. Default: 30 seconds. */
        public Builder keepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
            return this;
        }

        /** Sets how many live chunks a session buffers before it resyncs from the log. Default: 1024. */
        public Builder maxPendingChunks(int maxPendingChunks) {
            this.maxPendingChunks = maxPendingChunks;
            return this;
        }

        /**
         * Sets the executor running one task per connection. Default: a cached pool of daemon threads.
         *
         * <p>Executors passed to the builder are not shut down by {@link StreamEndpoint#shutdown()}.
         */
        public Builder sessionExecutor(ExecutorService sessionExecutor) {
            this.sessionExecutor = sessionExecutor;
            return this;
        }

        /** Sets the scheduler firing keep-alives. Default: a single daemon thread. */
        public Builder keepAliveScheduler(ScheduledExecutorService keepAliveScheduler) {
            this.keepAliveScheduler = keepAliveScheduler;
            return this;
        }

        /** Builds the endpoint with the configured settings. */
        public StreamEndpoint build() {
            return new StreamEndpoint(this);
        }
    }

    /**
     * Stream for one key. Each subscription replays the full history, then follows live entries until
     * it is cancelled, the stream is closed, or the endpoint shuts down.
     */
    public Flow.Publisher<SseFrame> open(StreamKey key) {
        Objects.requireNonNull(key, "key");
        return subscriber -> start(key, subscriber);
    }

    private void start(StreamKey key, Flow.Subscriber<? super SseFrame> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        StreamSession session = new StreamSession(key, chunkLog, bus, registry, subscriber, maxPendingChunks);
        subscriber.onSubscribe(session);
        try {
            long period = Math.max(1, keepAliveInterval.toMillis());
            ScheduledFuture<?> task = keepAliveScheduler.scheduleAtFixedRate(
                    session::markKeepAliveDue, period, period, TimeUnit.MILLISECONDS);
            session.keepAliveTask(task);
            sessionExecutor.execute(session);
        } catch (RejectedExecutionException e) {
            log.warn("Rejected stream session, endpoint is shut down: stream={}", key);
            session.teardown(new IllegalStateException("stream endpoint is shut down", e));
            session.signalTerminal();
        }
    }

    /**
     * Producer side of this endpoint: appends to the log, then emits live.
     */
    public ChunkPublisher publisher() {
        return publisher;
    }

    public ChunkLog chunkLog() {
        return chunkLog;
    }

    public ChunkBus bus() {
        return bus;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    /**
     * Closes every open connection and stops the executors this endpoint created.
     */
    public void shutdown() {
        registry.closeAll();
        if (ownsKeepAliveScheduler) {
            keepAliveScheduler.shutdownNow();
        }
        if (ownsSessionExecutor) {
            sessionExecutor.shutdown();
            try {
                if (!sessionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    sessionExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                sessionExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Stream endpoint shut down");
    }

    @Override
    public void close() {
        shutdown();
    }
}

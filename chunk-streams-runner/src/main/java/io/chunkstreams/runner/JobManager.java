package io.chunkstreams.runner;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.json.spi.JsonCodec;
import io.chunkstreams.server.core.ChunkPublisher;
import io.chunkstreams.server.core.DaemonThreadFactory;
import io.chunkstreams.server.spi.ChunkLog;
import io.chunkstreams.server.spi.ChunkLogException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs simulated processing jobs that report progress as chunks.
 *
 * <p>A job publishes {@code job-started}, one {@code progress} chunk per step and
 * {@code job-completed}, then ends the stream for every connected observer. At most one job runs
 * per key.
 */
public final class JobManager {

    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    /** Outcome of {@link #start}. */
    public enum StartResult { STARTED, RUNNING, HAS_HISTORY }

    private final ChunkPublisher publisher;
    private final ChunkLog chunkLog;
    private final JsonCodec codec;
    private final int steps;
    private final Duration stepDelay;
    private final ExecutorService workers;
    private final Set<StreamKey> running = ConcurrentHashMap.newKeySet();

    public JobManager(ChunkPublisher publisher, ChunkLog chunkLog, JsonCodec codec,
                      int steps, Duration stepDelay, int workers) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.chunkLog = Objects.requireNonNull(chunkLog, "chunkLog");
        this.codec = Objects.requireNonNull(codec, "codec");
        if (steps < 0) throw new IllegalArgumentException("steps must be >= 0");
        this.steps = steps;
        this.stepDelay = Objects.requireNonNull(stepDelay, "stepDelay");
        this.workers = Executors.newFixedThreadPool(workers, new DaemonThreadFactory("chunk-streams-job-"));
    }

    /**
     * Start a job for the key unless one is running, or the key already has history and
     * {@code reprocess} is false. A reprocessed job appends to the existing history.
     */
    public StartResult start(StreamKey key, boolean reprocess) {
        Objects.requireNonNull(key, "key");
        if (!running.add(key)) {
            return StartResult.RUNNING;
        }
        if (!reprocess && chunkLog.exists(key)) {
            running.remove(key);
            return StartResult.HAS_HISTORY;
        }
        try {
            workers.execute(() -> run(key));
        } catch (RejectedExecutionException e) {
            running.remove(key);
            throw new IllegalStateException("job manager is shut down", e);
        }
        log.info("Job started: stream={}, steps={}, reprocess={}", key, steps, reprocess);
        return StartResult.STARTED;
    }

    public boolean isRunning(StreamKey key) {
        return running.contains(key);
    }

    public Set<StreamKey> runningJobs() {
        return Set.copyOf(running);
    }

    private void run(StreamKey key) {
        try {
            publish(key, chunk("job-started", "filename", key.value(), "steps", steps,
                    "startedAt", Instant.now().toString()));
            for (int step = 1; step <= steps; step++) {
                Thread.sleep(stepDelay.toMillis());
                publish(key, chunk("progress", "step", step, "total", steps,
                        "percent", step * 100 / steps));
            }
            publish(key, chunk("job-completed", "filename", key.value(), "steps", steps));
            publisher.complete(key);
            log.info("Job completed: stream={}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Job interrupted: stream={}", key);
        } catch (ChunkLogException e) {
            // nothing more can be recorded for this stream
            log.error("Job aborted, chunk could not be recorded: stream={}", key, e);
            publisher.complete(key);
        } catch (RuntimeException e) {
            log.error("Job failed: stream={}", key, e);
            reportFailure(key, e);
        } finally {
            running.remove(key);
        }
    }

    private void reportFailure(StreamKey key, RuntimeException cause) {
        try {
            publish(key, chunk("job-failed", "filename", key.value(), "error", String.valueOf(cause.getMessage())));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Could not record job failure: stream={}", key, e);
        }
        publisher.complete(key);
    }

    private void publish(StreamKey key, Chunk chunk) {
        publisher.publish(key, chunk);
    }

    private Chunk chunk(String type, Object... fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Chunk.TYPE_FIELD, type);
        for (int i = 0; i + 1 < fields.length; i += 2) {
            payload.put((String) fields[i], fields[i + 1]);
        }
        return Chunk.of(payload, codec);
    }

    /**
     * Interrupts running jobs and waits briefly for them to stop.
     */
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after shutdown: {}", running);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

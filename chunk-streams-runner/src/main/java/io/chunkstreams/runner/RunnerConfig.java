package io.chunkstreams.runner;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration properties of the chunk streams server.
 *
 * <p>Configure via {@code META-INF/microprofile-config.properties}, system properties or
 * environment variables:
 * <pre>
 * chunk-streams.port=8080
 * chunk-streams.data-dir=data
 * chunk-streams.keep-alive-seconds=15
 * chunk-streams.job.steps=5
 * </pre>
 */
@ConfigMapping(prefix = "chunk-streams")
public interface RunnerConfig {

    /**
     * HTTP port; 0 picks a free one.
     */
    @WithDefault("8080")
    int port();

    /**
     * Directory holding one {@code <key>.chunks.ndjson} file per stream.
     */
    @WithDefault("data")
    String dataDir();

    /**
     * Whether every chunk is forced to disk before it is emitted.
     */
    @WithDefault("true")
    boolean fsync();

    /**
     * Interval of keep-alive comments on idle streams. Keep it below the idle timeout of any proxy
     * in front of the server.
     */
    @WithDefault("15")
    long keepAliveSeconds();

    @WithDefault("1024")
    int maxPendingChunks();

    Job job();

    /**
     * Simulated processing jobs started by {@code POST /api/process}.
     */
    interface Job {

        /** Number of progress chunks per job. */
        @WithDefault("5")
        int steps();

        @WithDefault("500")
        long stepDelayMillis();

        /** Jobs running at the same time. */
        @WithDefault("4")
        int workers();
    }
}

package io.chunkstreams.runner;

import io.chunkstreams.core.Chunk;
import io.chunkstreams.core.StreamKey;
import io.chunkstreams.json.jackson.JacksonJsonCodec;
import io.chunkstreams.server.core.InMemoryChunkLog;
import io.chunkstreams.server.core.StreamEndpoint;
import io.chunkstreams.server.spi.LogEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JobManagerTest {

    private final InMemoryChunkLog chunkLog = new InMemoryChunkLog();
    private final StreamEndpoint endpoint = new StreamEndpoint(chunkLog);
    private final StreamKey key = StreamKey.of("novel1.txt");
    private JobManager jobs;

    @AfterEach
    void tearDown() {
        if (jobs != null) jobs.shutdown();
        endpoint.shutdown();
    }

    @Test
    void jobPublishesStartProgressAndCompletion() throws Exception {
        jobs = newJobs(3, Duration.ZERO);

        assertThat(jobs.start(key, false)).isEqualTo(JobManager.StartResult.STARTED);
        awaitIdle();

        assertThat(chunkLog.read(key))
                .extracting(LogEntry::chunk)
                .extracting(Chunk::type)
                .containsExactly(Optional.of("job-started"), Optional.of("progress"), Optional.of("progress"),
                        Optional.of("progress"), Optional.of("job-completed"));
        assertThat(chunkLog.read(key).get(3).chunk().json())
                .isEqualTo("{\"type\":\"progress\",\"step\":3,\"total\":3,\"percent\":100}");
    }

    @Test
    void existingHistoryNeedsReprocess() throws Exception {
        jobs = newJobs(1, Duration.ZERO);
        jobs.start(key, false);
        awaitIdle();

        assertThat(jobs.start(key, false)).isEqualTo(JobManager.StartResult.HAS_HISTORY);
        assertThat(jobs.start(key, true)).isEqualTo(JobManager.StartResult.STARTED);
        awaitIdle();

        assertThat(chunkLog.lastSequence(key)).isEqualTo(6);
    }

    @Test
    void secondStartWhileRunningIsRefused() {
        jobs = newJobs(1, Duration.ofSeconds(30));

        assertThat(jobs.start(key, false)).isEqualTo(JobManager.StartResult.STARTED);
        assertThat(jobs.start(key, true)).isEqualTo(JobManager.StartResult.RUNNING);
        assertThat(jobs.runningJobs()).containsExactly(key);
        awaitSequence(1);

        jobs.shutdown();
        assertThat(jobs.isRunning(key)).isFalse();
        assertThat(chunkLog.lastSequence(key)).isEqualTo(1);
    }

    private JobManager newJobs(int steps, Duration delay) {
        return new JobManager(endpoint.publisher(), chunkLog, new JacksonJsonCodec(), steps, delay, 2);
    }

    private void awaitSequence(long seq) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (chunkLog.lastSequence(key) < seq) {
            if (System.nanoTime() > deadline) throw new AssertionError("no chunk recorded");
            Thread.onSpinWait();
        }
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (jobs.isRunning(key)) {
            if (System.nanoTime() > deadline) throw new AssertionError("job did not finish");
            Thread.sleep(5);
        }
    }
}

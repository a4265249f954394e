package io.chunkstreams.runner;

import io.chunkstreams.client.ChunkStateReducer;
import io.chunkstreams.client.ChunkStreamClient;
import io.chunkstreams.client.StreamRequest;
import io.chunkstreams.json.jackson.JacksonJsonCodec;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the server on a free port and follows streams with the client.
 */
class ChunkStreamsServerTest {

    @TempDir
    Path dataDir;

    private ChunkStreamsServer server;
    private final HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @BeforeEach
    void setUp() {
        server = new ChunkStreamsServer(config(Map.of(
                "chunk-streams.port", "0",
                "chunk-streams.data-dir", dataDir.toString(),
                "chunk-streams.fsync", "false",
                "chunk-streams.keep-alive-seconds", "1",
                "chunk-streams.job.steps", "3",
                "chunk-streams.job.step-delay-millis", "20")));
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void streamWithoutFilenameIsRejected() throws Exception {
        HttpResponse<String> resp = get("/api/stream");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.body()).isEqualTo("Missing filename parameter");
    }

    @Test
    void observerFollowsAJobToTheEnd() throws Exception {
        ChunkStateReducer<List<String>> types = typesReducer();
        client().subscribe(streamRequest("novel1.txt")).subscribe(types);
        awaitConnections("novel1.txt", 1);

        HttpResponse<String> started = post("/api/process?filename=novel1.txt");
        assertThat(started.statusCode()).isEqualTo(202);

        assertThat(types.awaitTermination(Duration.ofSeconds(10))).isTrue();
        assertThat(types.error()).isNull();
        assertThat(types.isDone()).isTrue();
        assertThat(types.state()).containsExactly("job-started", "progress", "progress", "progress", "job-completed");
        assertThat(Files.readAllLines(dataDir.resolve("novel1.txt.chunks.ndjson"))).hasSize(5);
    }

    @Test
    void lateObserverGetsTheFullReplay() throws Exception {
        assertThat(post("/api/process?filename=late.txt").statusCode()).isEqualTo(202);
        awaitJobIdle("late.txt");

        ChunkStateReducer<List<String>> types = typesReducer();
        client().subscribe(streamRequest("late.txt")).subscribe(types);

        awaitState(types, 5);
        assertThat(types.state()).containsExactly("job-started", "progress", "progress", "progress", "job-completed");
        assertThat(types.connections()).isEqualTo(1);
        types.cancel();
    }

    @Test
    void processRefusesDuplicatesUnlessReprocessing() throws Exception {
        assertThat(post("/api/process").statusCode()).isEqualTo(400);

        assertThat(post("/api/process?filename=dup.txt").statusCode()).isEqualTo(202);
        awaitJobIdle("dup.txt");

        HttpResponse<String> again = post("/api/process?filename=dup.txt");
        assertThat(again.statusCode()).isEqualTo(409);
        assertThat(codec.readObject(again.body())).containsKey("error");

        assertThat(post("/api/process?filename=dup.txt&reprocess=true").statusCode()).isEqualTo(202);
        awaitJobIdle("dup.txt");

        Map<String, Object> status = codec.readObject(get("/api/jobs?filename=dup.txt").body());
        assertThat(status).containsEntry("filename", "dup.txt")
                .containsEntry("running", false)
                .containsEntry("chunks", 10);
    }

    @Test
    void shutdownEndsOpenStreamsWithoutSentinel() throws Exception {
        ChunkStateReducer<List<String>> types = typesReducer();
        ChunkStreamClient noRetry = ChunkStreamClient.builder().codec(codec).maxReconnects(0).build();
        noRetry.subscribe(streamRequest("idle.txt")).subscribe(types);
        awaitConnections("idle.txt", 1);

        server.close();

        assertThat(types.awaitTermination(Duration.ofSeconds(10))).isTrue();
        assertThat(types.isDone()).isFalse();
    }

    private ChunkStreamClient client() {
        return ChunkStreamClient.builder()
                .codec(codec)
                .reconnectDelay(Duration.ofMillis(50))
                .build();
    }

    private StreamRequest streamRequest(String filename) {
        return StreamRequest.of(uri("/api/stream"), filename);
    }

    private static ChunkStateReducer<List<String>> typesReducer() {
        return new ChunkStateReducer<>(List.of(), (list, chunk) -> {
            List<String> next = new ArrayList<>(list);
            next.add(chunk.type().orElse("?"));
            return next;
        });
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        return http.send(HttpRequest.newBuilder(uri(pathAndQuery)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String pathAndQuery) throws Exception {
        return http.send(HttpRequest.newBuilder(uri(pathAndQuery)).POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://localhost:" + server.port() + pathAndQuery);
    }

    private void awaitJobIdle(String filename) throws Exception {
        await(() -> !Boolean.TRUE.equals(codec.readObject(get("/api/jobs?filename=" + filename).body()).get("running")));
    }

    private void awaitConnections(String filename, int count) throws Exception {
        await(() -> ((Number) codec.readObject(get("/api/jobs?filename=" + filename).body()).get("connections")).intValue() == count);
    }

    private static void awaitState(ChunkStateReducer<List<String>> reducer, int size) throws Exception {
        await(() -> reducer.state().size() >= size);
    }

    private static void await(Condition condition) throws Exception {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.holds()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met in time");
            Thread.sleep(20);
        }
    }

    @FunctionalInterface
    private interface Condition {
        boolean holds() throws Exception;
    }

    private static RunnerConfig config(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .withMapping(RunnerConfig.class)
                .build()
                .getConfigMapping(RunnerConfig.class);
    }
}

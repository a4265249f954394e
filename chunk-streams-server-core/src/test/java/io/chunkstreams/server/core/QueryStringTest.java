package io.chunkstreams.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void parseDecodesKeysAndValues() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/api/stream?filename=my%20report.pdf&x=1"));
        assertThat(parsed).containsEntry("filename", "my report.pdf");
        assertThat(parsed).containsEntry("x", "1");
    }

    @Test
    void parseHandlesMissingValueAsEmpty() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/api/stream?filename"));
        assertThat(parsed).containsEntry("filename", "");
    }

    @Test
    void firstOccurrenceWins() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/api/stream?filename=a&filename=b"));
        assertThat(parsed).containsEntry("filename", "a");
    }

    @Test
    void noQueryYieldsEmptyMap() {
        assertThat(QueryString.parse(URI.create("http://localhost/api/stream"))).isEmpty();
    }
}

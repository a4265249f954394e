package io.chunkstreams.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlsTest {

    @Test
    void encodesKeyIntoFilenameParameter() {
        URI uri = Urls.streamUri(URI.create("http://localhost:8080/api/stream"), StreamKey.of("my report+v2.pdf"));

        assertThat(uri.toString()).isEqualTo("http://localhost:8080/api/stream?filename=my%20report%2Bv2.pdf");
    }

    @Test
    void appendsToAnExistingQueryInSortedOrder() {
        URI uri = Urls.withQuery(URI.create("http://localhost/api/process?x=1"), Map.of("reprocess", "true", "filename", "a"));

        assertThat(uri.toString()).isEqualTo("http://localhost/api/process?x=1&filename=a&reprocess=true");
    }

    @Test
    void noParamsLeavesBaseUntouched() {
        URI base = URI.create("http://localhost/api/stream");
        assertThat(Urls.withQuery(base, Map.of())).isSameAs(base);
    }
}

package io.chunkstreams.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Query-string helpers for stream URLs.
 */
public final class Urls {

    private Urls() {}

    /**
     * Appends the parameters to {@code base} in key order, after any query it already has.
     * Parameters with a null value are skipped.
     */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) {
            return base;
        }
        StringJoiner query = new StringJoiner("&");
        new TreeMap<>(params).forEach((name, value) -> {
            if (value != null) {
                query.add(encode(name) + "=" + encode(value));
            }
        });
        String separator = base.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + query);
    }

    /**
     * Stream endpoint URL for a key: {@code base?filename=<key>}.
     */
    public static URI streamUri(URI base, StreamKey key) {
        return withQuery(base, Map.of(Protocol.Q_FILENAME, key.value()));
    }

    private static String encode(String s) {
        // form encoding turns spaces into '+', which not every server decodes in a query
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

package io.chunkstreams.core;

/**
 * Wire constants shared by the server endpoint and the client reconstructor.
 *
 * <p>The stream is a {@code text/event-stream} of records separated by a blank line. A record is a
 * comment ({@code ": text"}), one chunk ({@code "data: <json>"}) or the end sentinel
 * ({@code "data: [DONE]"}).
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_FILENAME = "filename";

    // Default route of the stream endpoint
    public static final String STREAM_PATH = "/api/stream";

    // Field prefixes
    public static final String FIELD_DATA = "data:";
    public static final String FIELD_COMMENT = ":";

    /** Payload of the data record that ends a stream. */
    public static final String DONE = "[DONE]";

    public static final String KEEP_ALIVE_COMMENT = "keep-alive";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ACCEPT = "Accept";
    public static final String H_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String H_ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String H_ALLOW_HEADERS = "Access-Control-Allow-Headers";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String CT_JSON = "application/json";
}

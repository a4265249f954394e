package io.chunkstreams.core;

import java.util.Objects;

/**
 * One Server-Sent Events record, rendered without HTTP headers.
 */
public sealed interface SseFrame permits SseFrame.Data, SseFrame.Comment, SseFrame.Done {

    /**
     * Render as an SSE record terminated by a blank line.
     */
    String render();

    static SseFrame data(Chunk chunk) {
        return new Data(chunk.json());
    }

    static SseFrame comment(String text) {
        return new Comment(text);
    }

    static SseFrame keepAlive() {
        return new Comment(Protocol.KEEP_ALIVE_COMMENT);
    }

    static SseFrame done() {
        return new Done();
    }

    /** A chunk. */
    record Data(String data) implements SseFrame {
        public Data {
            Objects.requireNonNull(data, "data");
        }

        @Override
        public String render() {
            return prefixLines("data: ", data);
        }
    }

    /** Ignored by readers except as a liveness signal. */
    record Comment(String text) implements SseFrame {
        public Comment {
            text = text == null ? "" : text;
        }

        @Override
        public String render() {
            return prefixLines(": ", text);
        }
    }

    /** End-of-stream sentinel. */
    record Done() implements SseFrame {
        @Override
        public String render() {
            return "data: " + Protocol.DONE + "\n\n";
        }
    }

    private static String prefixLines(String prefix, String value) {
        StringBuilder sb = new StringBuilder(value.length() + 16);
        // each line of a multi-line value needs its own field prefix
        for (String line : value.split("\r?\n", -1)) {
            sb.append(prefix).append(line).append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }
}

package io.chunkstreams.client;

import java.util.List;
import java.util.Objects;

/**
 * One record of a {@code text/event-stream}, as produced by {@link SseRecordDecoder}.
 */
public sealed interface SseRecord permits SseRecord.Comment, SseRecord.Data {

    /**
     * A line starting with {@code ':'}; a liveness signal only.
     *
     * @param text the comment without its colon and the single space after it
     */
    record Comment(String text) implements SseRecord {
        public Comment {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * The {@code data:} lines of one record, in order.
     *
     * @param lines field values without the prefix and the single space after it
     */
    record Data(List<String> lines) implements SseRecord {
        public Data {
            lines = List.copyOf(lines);
        }

        /** The record's data as an event-stream reader sees it: lines joined with {@code '\n'}. */
        public String data() {
            return String.join("\n", lines);
        }
    }
}

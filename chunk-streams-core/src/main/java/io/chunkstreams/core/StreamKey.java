package io.chunkstreams.core;

/**
 * Identifies one job's stream: its chunk history, its live listeners and its observer connections.
 *
 * <p>The value doubles as a file name for durable logs, so separators, parent references and
 * control characters are rejected.
 */
public record StreamKey(String value) implements Comparable<StreamKey> {

    private static final int MAX_LENGTH = 255;

    public StreamKey {
        if (value == null || value.isBlank()) {
            throw new ChunkStreamsException.InvalidStreamKey("stream key must not be blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new ChunkStreamsException.InvalidStreamKey("stream key longer than " + MAX_LENGTH + " characters");
        }
        if (value.equals(".") || value.equals("..")) {
            throw new ChunkStreamsException.InvalidStreamKey("stream key must not be a relative path: " + value);
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '/' || c == '\\') {
                throw new ChunkStreamsException.InvalidStreamKey("stream key must not contain path separators: " + value);
            }
            if (Character.isISOControl(c)) {
                throw new ChunkStreamsException.InvalidStreamKey("stream key must not contain control characters");
            }
        }
    }

    public static StreamKey of(String value) {
        return new StreamKey(value);
    }

    @Override
    public int compareTo(StreamKey other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package io.chunkstreams.core;

/**
 * Base class for chunk stream related exceptions.
 *
 * <p>Subclasses are specific to the error condition and keep the original cause when there is one.
 */
public abstract class ChunkStreamsException extends RuntimeException {

    protected ChunkStreamsException(String message) {
        super(message);
    }

    protected ChunkStreamsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a stream key is missing or cannot name a stream.
     */
    public static class InvalidStreamKey extends ChunkStreamsException {
        public InvalidStreamKey(String message) {
            super(message);
        }
    }

    /**
     * Raised when text cannot be turned into a chunk (not JSON, or not a JSON object).
     */
    public static class MalformedChunk extends ChunkStreamsException {
        public MalformedChunk(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised on the client when the server refuses to open a stream.
     */
    public static class StreamRejected extends ChunkStreamsException {
        private final int status;

        public StreamRejected(int status, String message) {
            super(message);
            this.status = status;
        }

        public int status() {
            return status;
        }
    }
}

package io.chunkstreams.server.core;

import io.chunkstreams.core.StreamKey;

/**
 * An open observer channel as seen by the {@link ConnectionRegistry}.
 */
public interface StreamConnection {

    StreamKey key();

    /**
     * Send the end-of-stream sentinel after anything already queued, then close.
     */
    void finish();

    /**
     * Close without a sentinel. Idempotent.
     */
    void close();
}

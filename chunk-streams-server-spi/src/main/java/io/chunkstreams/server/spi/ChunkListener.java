package io.chunkstreams.server.spi;

/**
 * Receives live entries for one stream key.
 *
 * <p>Called on the producer's thread; implementations must hand the entry off without blocking.
 */
@FunctionalInterface
public interface ChunkListener {

    void onEntry(LogEntry entry);

    /**
     * The registration was dropped from outside, so no further entries will arrive. A listener
     * that feeds an open connection should close it.
     */
    default void onRemoved() {
    }
}

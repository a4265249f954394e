package io.chunkstreams.server.spi;

/**
 * Cancellation handle for one listener registration.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Remove the registration. Calling this more than once has no further effect.
     */
    void cancel();
}

/**
 * Framework-neutral server core for chunk streams.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.chunkstreams.server.core.StreamEndpoint} (replay-then-live stream sessions)</li>
 *   <li>{@link io.chunkstreams.server.core.ChunkPublisher} (producer side: append, then emit)</li>
 *   <li>{@link io.chunkstreams.server.core.InMemoryChunkLog} and
 *       {@link io.chunkstreams.server.core.NdjsonFileChunkLog} (log implementations)</li>
 *   <li>{@link io.chunkstreams.server.core.ChunkBus} and
 *       {@link io.chunkstreams.server.core.ConnectionRegistry} (shared process-wide state)</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.chunkstreams.server.core.ServerRequest} and
 * {@link io.chunkstreams.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.chunkstreams.server.core;

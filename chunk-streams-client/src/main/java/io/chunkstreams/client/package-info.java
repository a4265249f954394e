/**
 * Client side of chunk streams.
 *
 * <p>{@link io.chunkstreams.client.SseRecordDecoder} and {@link io.chunkstreams.client.ChunkReader}
 * turn event-stream bytes into chunks; {@link io.chunkstreams.client.ChunkStreamClient} follows a
 * stream across reconnects and {@link io.chunkstreams.client.ChunkStateReducer} rebuilds state from it.
 */
package io.chunkstreams.client;

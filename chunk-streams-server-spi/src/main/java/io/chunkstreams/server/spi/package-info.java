/**
 * Server-side SPI for chunk streams.
 *
 * <p>The SPI is blocking and minimal: a durable {@link io.chunkstreams.server.spi.ChunkLog} plus the
 * listener types used by the in-process bus. Hosts adapt it to their preferred execution model.
 */
package io.chunkstreams.server.spi;

/**
 * JSON abstraction for chunk streams.
 *
 * <p>Keeps the core and server modules free of a hard dependency on a particular JSON library.
 */
package io.chunkstreams.json.spi;

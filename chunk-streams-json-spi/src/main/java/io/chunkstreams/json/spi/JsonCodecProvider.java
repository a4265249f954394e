package io.chunkstreams.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.chunkstreams.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();
}

package io.chunkstreams.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Returns the first codec registered on the context class loader.
     *
     * @throws IllegalStateException if no JSON module is on the class path
     */
    public static JsonCodec loadDefault() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (it.hasNext()) {
            JsonCodec codec = it.next().codec();
            if (codec != null) {
                return codec;
            }
        }
        throw new IllegalStateException("no JsonCodecProvider installed; add chunk-streams-json-jackson to the class path");
    }
}

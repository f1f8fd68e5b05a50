package io.providerbridge.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates the {@link JsonCodec} installed on the class path.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Load the first codec registered through {@link JsonCodecProvider}, using the context class loader.
     *
     * @return the codec
     * @throws IllegalStateException if no provider is installed
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("no JsonCodecProvider found; add provider-bridge-json-jackson to the class path");
        }
        return it.next().codec();
    }
}

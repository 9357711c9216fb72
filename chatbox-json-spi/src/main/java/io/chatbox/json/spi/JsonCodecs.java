package io.chatbox.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException(
                    "No JsonCodecProvider found. Add chatbox-json-jackson (or another codec module) to the classpath.");
        }
        return it.next().codec();
    }
}

package io.tokenrelay.server.core;

import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonCodecProvider;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves the installed {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>When several providers are installed the one with the highest
 * {@link JsonCodecProvider#priority()} wins.
 */
public final class ServiceLoaderJsonCodecs {
    private ServiceLoaderJsonCodecs() {
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() > best.priority()) {
                best = p;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No JsonCodecProvider found; add token-relay-json-jackson to the classpath");
        }
        return best.codec();
    }

    public static JsonCodec defaultCodec() {
        return load(Thread.currentThread().getContextClassLoader());
    }
}

package io.tokenrelay.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Modules such as {@code token-relay-json-jackson} register implementations
 * via {@code META-INF/services}.
 */
public interface JsonCodecProvider {

    /**
     * Provider priority; the highest wins when several are installed.
     */
    default int priority() {
        return 0;
    }

    JsonCodec codec();
}

package io.tokenrelay.json.jackson;

import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public int priority() {
        return 100;
    }

    @Override
    public JsonCodec codec() {
        return new JacksonJsonCodec();
    }
}

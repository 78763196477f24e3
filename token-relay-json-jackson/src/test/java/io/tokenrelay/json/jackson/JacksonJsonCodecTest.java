package io.tokenrelay.json.jackson;

import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonCodecProvider;
import io.tokenrelay.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    record Sample(String name, long count, Instant at) {}

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void jacksonModulesResolveToOneRelease() {
        String core = com.fasterxml.jackson.core.json.PackageVersion.VERSION.toString();

        assertThat(com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION.toString()).isEqualTo(core);
        assertThat(com.fasterxml.jackson.datatype.jsr310.PackageVersion.VERSION.toString()).isEqualTo(core);
    }

    @Test
    void writesMapAsBytes() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("delta", "a".repeat(10_000));
        body.put("sequence", 3);

        byte[] out = codec.writeBytes(body);

        assertThat(codec.readMap(out)).containsEntry("sequence", 3).containsKey("delta");
    }

    @Test
    void writesInstantsAsIsoStrings() throws Exception {
        String json = codec.writeString(new Sample("a", 2, Instant.parse("2025-01-01T00:00:00Z")));

        assertThat(json).contains("\"at\":\"2025-01-01T00:00:00Z\"").contains("\"count\":2");
    }

    @Test
    void readMapDecodesNestedValues() throws Exception {
        byte[] body = "{\"id\":\"req-1\",\"maxTokens\":256,\"temperature\":0.5,\"messages\":[{\"role\":\"user\"}]}"
                .getBytes(StandardCharsets.UTF_8);

        Map<String, Object> out = codec.readMap(body);

        assertThat(out).containsEntry("id", "req-1").containsEntry("maxTokens", 256).containsEntry("temperature", 0.5);
        assertThat(out.get("messages")).isInstanceOf(List.class);
    }

    @Test
    void readMapPreservesFieldOrder() throws Exception {
        Map<String, Object> in = new LinkedHashMap<>();
        in.put("content", "Hello");
        in.put("delta", "lo");
        in.put("finishReason", null);

        Map<String, Object> out = codec.readMap(codec.writeBytes(in));

        assertThat(out).containsExactly(
                Map.entry("content", "Hello"),
                Map.entry("delta", "lo"),
                Map.entry("finishReason", null));
    }

    @Test
    void readMapRejectsEmptyAndNonObjectData() {
        assertThatThrownBy(() -> codec.readMap(new byte[0])).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readMap("[1,2]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readMap("{\"a\":1} {".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void providerIsRegisteredWithServiceLoader() {
        JsonCodecProvider provider = ServiceLoader.load(JsonCodecProvider.class).findFirst().orElseThrow();

        assertThat(provider).isInstanceOf(JacksonJsonCodecProvider.class);
        assertThat(provider.codec()).isInstanceOf(JacksonJsonCodec.class);
    }
}

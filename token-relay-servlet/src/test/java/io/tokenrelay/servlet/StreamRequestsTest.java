package io.tokenrelay.servlet;

import io.tokenrelay.json.jackson.JacksonJsonCodec;
import io.tokenrelay.server.spi.Message;
import io.tokenrelay.server.spi.StreamRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamRequestsTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void mapsAllFields() throws Exception {
        StreamRequest request = StreamRequests.fromJson(read("{"
                + "\"id\":\"req-1\",\"clientId\":\"client-1\",\"userId\":\"u\",\"sessionId\":\"s\","
                + "\"provider\":\"openai\",\"model\":\"gpt-4\",\"temperature\":0.7,\"maxTokens\":256,"
                + "\"bufferSize\":4096,\"flushInterval\":50,\"purpose\":\"summary\",\"priority\":\"high\","
                + "\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}"), null);

        assertThat(request.id()).isEqualTo("req-1");
        assertThat(request.clientId()).isEqualTo("client-1");
        assertThat(request.userId()).contains("u");
        assertThat(request.sessionId()).contains("s");
        assertThat(request.provider()).isEqualTo("openai");
        assertThat(request.model()).isEqualTo("gpt-4");
        assertThat(request.temperature()).contains(0.7);
        assertThat(request.maxTokens()).contains(256);
        assertThat(request.bufferSize()).contains(4096);
        assertThat(request.flushInterval()).contains(Duration.ofMillis(50));
        assertThat(request.purpose()).isEqualTo("summary");
        assertThat(request.priority()).isEqualTo(StreamRequest.Priority.HIGH);
        assertThat(request.messages()).containsExactly(new Message("user", "hi"));
    }

    @Test
    void clientIdFallsBackToHeaderValue() throws Exception {
        StreamRequest request = StreamRequests.fromJson(read("{\"requestId\":\"req-2\"}"), "from-header");

        assertThat(request.id()).isEqualTo("req-2");
        assertThat(request.clientId()).isEqualTo("from-header");
        assertThat(request.provider()).isEqualTo("default");
        assertThat(request.messages()).isEmpty();
    }

    @Test
    void rejectsMalformedRequests() throws Exception {
        Map<String, Object> missingId = read("{\"clientId\":\"c\"}");
        Map<String, Object> missingClient = read("{\"id\":\"r\"}");
        Map<String, Object> badBuffer = read("{\"id\":\"r\",\"clientId\":\"c\",\"bufferSize\":0}");
        Map<String, Object> badPriority = read("{\"id\":\"r\",\"clientId\":\"c\",\"priority\":\"urgent\"}");
        Map<String, Object> badMessages = read("{\"id\":\"r\",\"clientId\":\"c\",\"messages\":\"hi\"}");

        assertThatThrownBy(() -> StreamRequests.fromJson(missingId, null)).hasMessageContaining("id");
        assertThatThrownBy(() -> StreamRequests.fromJson(missingClient, null)).hasMessageContaining("clientId");
        assertThatThrownBy(() -> StreamRequests.fromJson(badBuffer, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamRequests.fromJson(badPriority, null)).hasMessageContaining("urgent");
        assertThatThrownBy(() -> StreamRequests.fromJson(badMessages, null)).hasMessageContaining("messages");
    }

    @Test
    void rejectsIntegersThatWouldBeTruncated() throws Exception {
        Map<String, Object> hugeBuffer = read("{\"id\":\"r\",\"clientId\":\"c\",\"bufferSize\":5000000000}");
        Map<String, Object> fractionalTokens = read("{\"id\":\"r\",\"clientId\":\"c\",\"maxTokens\":12.5}");
        Map<String, Object> fractionalFlush = read("{\"id\":\"r\",\"clientId\":\"c\",\"flushInterval\":0.5}");

        assertThatThrownBy(() -> StreamRequests.fromJson(hugeBuffer, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bufferSize");
        assertThatThrownBy(() -> StreamRequests.fromJson(fractionalTokens, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTokens");
        assertThatThrownBy(() -> StreamRequests.fromJson(fractionalFlush, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("flushInterval");
    }

    @Test
    void acceptsWholeNumbersWrittenWithFraction() throws Exception {
        StreamRequest request = StreamRequests.fromJson(
                read("{\"id\":\"r\",\"clientId\":\"c\",\"bufferSize\":2048.0}"), null);

        assertThat(request.bufferSize()).contains(2048);
    }

    private Map<String, Object> read(String body) throws Exception {
        return json.readMap(body.getBytes(StandardCharsets.UTF_8));
    }
}

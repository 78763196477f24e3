package io.tokenrelay.server.spi;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamRequestTest {

    @Test
    void appliesDefaults() {
        StreamRequest request = StreamRequest.builder("req-1", "client-1").build();

        assertThat(request.provider()).isEqualTo("default");
        assertThat(request.model()).isEqualTo("default");
        assertThat(request.purpose()).isEqualTo("chat");
        assertThat(request.userId()).isEmpty();
        assertThat(request.bufferSize()).isEmpty();
        assertThat(request.messages()).isEmpty();
    }

    @Test
    void rejectsNonPositiveBufferSize() {
        assertThatThrownBy(() -> StreamRequest.builder("req-1", "client-1").bufferSize(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void keepsMessagesInOrder() {
        StreamRequest request = StreamRequest.builder("req-1", "client-1")
                .message(new Message("system", "be brief"))
                .message(new Message("user", "hi"))
                .build();

        assertThat(request.messages()).extracting(Message::role).containsExactly("system", "user");
    }
}

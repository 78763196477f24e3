package io.tokenrelay.server.spi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Client request for one generation stream.
 *
 * <p>Use {@link #builder(String, String)} to create instances:
 * <pre>{@code
 * StreamRequest request = StreamRequest.builder("req-1", "client-a")
 *     .provider("openai")
 *     .model("gpt-4o-mini")
 *     .message(new Message("user", "Hello"))
 *     .bufferSize(16 * 1024)
 *     .build();
 * }</pre>
 */
public final class StreamRequest {

    /** Scheduling hint carried through to the upstream provider. */
    public enum Priority { LOW, NORMAL, HIGH }

    private final String id;
    private final String clientId;
    private final String userId;
    private final String sessionId;
    private final String provider;
    private final String model;
    private final List<Message> messages;
    private final Double temperature;
    private final Integer maxTokens;
    private final Integer bufferSize;
    private final Duration flushInterval;
    private final String purpose;
    private final Priority priority;

    private StreamRequest(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.clientId = Objects.requireNonNull(builder.clientId, "clientId");
        this.userId = builder.userId;
        this.sessionId = builder.sessionId;
        this.provider = builder.provider != null ? builder.provider : "default";
        this.model = builder.model != null ? builder.model : "default";
        this.messages = List.copyOf(builder.messages);
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.bufferSize = builder.bufferSize;
        this.flushInterval = builder.flushInterval;
        this.purpose = builder.purpose != null ? builder.purpose : "chat";
        this.priority = builder.priority != null ? builder.priority : Priority.NORMAL;
    }

    public static Builder builder(String id, String clientId) {
        return new Builder(id, clientId);
    }

    /** Originating request id; reconnecting clients reuse it. */
    public String id() {
        return id;
    }

    public String clientId() {
        return clientId;
    }

    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Optional<String> sessionId() {
        return Optional.ofNullable(sessionId);
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }

    public List<Message> messages() {
        return messages;
    }

    public Optional<Double> temperature() {
        return Optional.ofNullable(temperature);
    }

    public Optional<Integer> maxTokens() {
        return Optional.ofNullable(maxTokens);
    }

    /** Per-request override of the buffer byte capacity. */
    public Optional<Integer> bufferSize() {
        return Optional.ofNullable(bufferSize);
    }

    /** Per-request override of the idle flush interval. */
    public Optional<Duration> flushInterval() {
        return Optional.ofNullable(flushInterval);
    }

    public String purpose() {
        return purpose;
    }

    public Priority priority() {
        return priority;
    }

    /**
     * Builder for {@link StreamRequest}.
     */
    public static final class Builder {
        private final String id;
        private final String clientId;
        private String userId;
        private String sessionId;
        private String provider;
        private String model;
        private final List<Message> messages = new ArrayList<>();
        private Double temperature;
        private Integer maxTokens;
        private Integer bufferSize;
        private Duration flushInterval;
        private String purpose;
        private Priority priority;

        private Builder(String id, String clientId) {
            this.id = id;
            this.clientId = clientId;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder message(Message message) {
            this.messages.add(Objects.requireNonNull(message, "message"));
            return this;
        }

        public Builder messages(List<Message> messages) {
            this.messages.clear();
            this.messages.addAll(messages);
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder bufferSize(Integer bufferSize) {
            if (bufferSize != null && bufferSize <= 0) {
                throw new IllegalArgumentException("bufferSize must be positive");
            }
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder purpose(String purpose) {
            this.purpose = purpose;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public StreamRequest build() {
            return new StreamRequest(this);
        }
    }
}

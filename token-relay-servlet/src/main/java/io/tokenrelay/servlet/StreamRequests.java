package io.tokenrelay.servlet;

import io.tokenrelay.server.spi.Message;
import io.tokenrelay.server.spi.StreamRequest;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a decoded JSON request body onto a {@link StreamRequest}.
 */
final class StreamRequests {
    private StreamRequests() {}

    /**
     * @throws IllegalArgumentException if a required field is missing or a field has the wrong type
     */
    static StreamRequest fromJson(Map<String, Object> body, String fallbackClientId) {
        String id = string(body, "id");
        if (id == null) id = string(body, "requestId");
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        String clientId = string(body, "clientId");
        if (clientId == null) clientId = fallbackClientId;
        if (clientId == null || clientId.isBlank()) throw new IllegalArgumentException("clientId is required");

        Number temperature = number(body, "temperature");
        StreamRequest.Builder builder = StreamRequest.builder(id, clientId)
                .userId(string(body, "userId"))
                .sessionId(string(body, "sessionId"))
                .provider(string(body, "provider"))
                .model(string(body, "model"))
                .purpose(string(body, "purpose"))
                .temperature(temperature == null ? null : temperature.doubleValue())
                .maxTokens(integer(body, "maxTokens"))
                .bufferSize(integer(body, "bufferSize"));

        String priority = string(body, "priority");
        if (priority != null) {
            try {
                builder.priority(StreamRequest.Priority.valueOf(priority.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown priority: " + priority, e);
            }
        }
        Long flushMillis = longInteger(body, "flushInterval");
        if (flushMillis != null) builder.flushInterval(Duration.ofMillis(flushMillis));
        builder.messages(messages(body.get("messages")));
        return builder.build();
    }

    private static List<Message> messages(Object raw) {
        if (raw == null) return List.of();
        if (!(raw instanceof List<?> list)) throw new IllegalArgumentException("messages must be an array");
        List<Message> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) throw new IllegalArgumentException("message must be an object");
            Object role = map.get("role");
            Object content = map.get("content");
            if (!(role instanceof String)) throw new IllegalArgumentException("message role is required");
            out.add(new Message((String) role, content == null ? null : content.toString()));
        }
        return out;
    }

    private static String string(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof String s) return s;
        throw new IllegalArgumentException(field + " must be a string");
    }

    private static Number number(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof Number n) return n;
        throw new IllegalArgumentException(field + " must be a number");
    }

    private static Integer integer(Map<String, Object> body, String field) {
        BigDecimal value = exact(body, field);
        try {
            return value == null ? null : value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(field + " must be a whole number within int range", e);
        }
    }

    private static Long longInteger(Map<String, Object> body, String field) {
        BigDecimal value = exact(body, field);
        try {
            return value == null ? null : value.longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(field + " must be a whole number within long range", e);
        }
    }

    private static BigDecimal exact(Map<String, Object> body, String field) {
        Number value = number(body, field);
        if (value == null) return null;
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a finite number", e);
        }
    }
}

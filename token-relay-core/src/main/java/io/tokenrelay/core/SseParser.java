package io.tokenrelay.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Minimal parser for the relay's SSE wire format.
 *
 * <p>Each block carries {@code event}, {@code id}, one or more {@code data} lines and a
 * {@code timestamp} line, terminated by a blank line. As in the SSE standard, one space after
 * the colon is dropped and the rest of the value is kept verbatim. Comment lines and unknown
 * fields are ignored.
 */
public final class SseParser implements AutoCloseable {

    public record Event(String eventType, String id, String data, Instant timestamp) {}

    private final BufferedReader in;

    /**
     * Creates a new SSE parser reading from the given input stream.
     *
     * @param is the input stream to read from
     */
    public SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * Reads the next SSE event from the stream.
     *
     * @return the next event, or {@code null} if EOF is reached
     * @throws IOException if an I/O error occurs
     */
    public Event next() throws IOException {
        String eventType = "message";
        String id = null;
        Instant timestamp = null;
        StringBuilder data = new StringBuilder();
        boolean seenAny = false;

        String line;
        while ((line = in.readLine()) != null) {
            if (line.isEmpty()) {
                if (seenAny) break;
                continue;
            }
            if (line.startsWith(":")) continue;
            seenAny = true;
            int colon = line.indexOf(':');
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : valueAfter(line, colon);
            switch (field) {
                case Protocol.F_EVENT:
                    eventType = value;
                    break;
                case Protocol.F_ID:
                    id = value;
                    break;
                case Protocol.F_DATA:
                    data.append(value).append('\n');
                    break;
                case Protocol.F_TIMESTAMP:
                    timestamp = parseTimestamp(value.trim());
                    break;
                default:
                    break;
            }
        }

        if (!seenAny) return null;
        int length = data.length();
        if (length > 0) data.setLength(length - 1);
        return new Event(eventType, id, data.toString(), timestamp);
    }

    /** Value after the colon, without the single optional space that follows it. */
    private static String valueAfter(String line, int colon) {
        int start = colon + 1;
        if (start < line.length() && line.charAt(start) == ' ') start++;
        return line.substring(start);
    }

    private static Instant parseTimestamp(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}

package io.tokenrelay.core;

/**
 * Relay wire constants (SSE field names, header names, and well-known values).
 *
 * <p>This class intentionally contains no HTTP client/server bindings. It only models
 * protocol-level concerns that are shared across the transport and the server core.
 */
public final class Protocol {
    private Protocol() {}

    // SSE field names, in the order they are rendered
    public static final String F_EVENT = "event";
    public static final String F_ID = "id";
    public static final String F_DATA = "data";
    public static final String F_TIMESTAMP = "timestamp";

    // Response headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ACCEL_BUFFERING = "X-Accel-Buffering";
    public static final String H_CONNECTION_ID = "X-Relay-Connection-Id";

    // Header values
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";
    public static final String CACHE_NO_CACHE = "no-cache, no-transform";
    public static final String KEEP_ALIVE = "keep-alive";
    public static final String ACCEL_BUFFERING_OFF = "no";

    /** Finish reason recorded when the upstream ends without a terminal fragment. */
    public static final String FINISH_END_OF_STREAM = "end_of_stream";

    /** Cache key under which aggregate metrics are published. */
    public static final String METRICS_CACHE_KEY = "streaming_metrics";
}

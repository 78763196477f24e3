package io.tokenrelay.servlet;

import io.tokenrelay.core.Protocol;
import io.tokenrelay.core.RelayException;
import io.tokenrelay.json.spi.JsonCodec;
import io.tokenrelay.json.spi.JsonException;
import io.tokenrelay.server.core.EventChannel;
import io.tokenrelay.server.core.ServiceLoaderJsonCodecs;
import io.tokenrelay.server.core.StreamHandle;
import io.tokenrelay.server.core.TokenRelay;
import io.tokenrelay.server.core.VirtualThreads;
import io.tokenrelay.server.spi.ConnectionRecord;
import io.tokenrelay.server.spi.StreamRequest;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Accepts {@code POST} requests carrying a JSON stream request, opens a connection and relays
 * its events as server-sent events until the stream completes or fails.
 *
 * <p>The optional header {@code X-Relay-Client-Id} supplies the client id when the body has none.
 */
public final class TokenRelayServlet extends HttpServlet {
    private static final Logger log = LoggerFactory.getLogger(TokenRelayServlet.class);

    static final String H_CLIENT_ID = "X-Relay-Client-Id";
    static final String H_ERROR = "X-Error";

    private final transient TokenRelay relay;
    private final transient JsonCodec json;
    private final transient SseEventPump pump;
    private final transient ExecutorService writers;

    public TokenRelayServlet(TokenRelay relay) {
        this(relay, ServiceLoaderJsonCodecs.defaultCodec());
    }

    public TokenRelayServlet(TokenRelay relay, JsonCodec json) {
        this.relay = relay;
        this.json = json;
        this.pump = new SseEventPump(json, Duration.ofSeconds(1));
        this.writers = VirtualThreads.newExecutor("token-relay-sse");
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        StreamRequest request;
        try {
            request = StreamRequests.fromJson(json.readMap(readBody(req)), req.getHeader(H_CLIENT_ID));
        } catch (JsonException | IllegalArgumentException e) {
            writeError(resp, 400, "invalid_request", e.getMessage());
            return;
        }

        ConnectionRecord connection;
        try {
            connection = relay.createConnection(request);
        } catch (RelayException.CapacityExceeded e) {
            writeError(resp, 503, e.code(), e.getMessage());
            return;
        } catch (RelayException e) {
            log.warn("Failed to open connection for request {}", request.id(), e);
            writeError(resp, 500, e.code(), e.getMessage());
            return;
        }

        resp.setStatus(200);
        resp.setContentType(Protocol.CT_EVENT_STREAM);
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resp.setHeader(Protocol.H_CACHE_CONTROL, Protocol.CACHE_NO_CACHE);
        resp.setHeader(Protocol.H_CONNECTION, Protocol.KEEP_ALIVE);
        resp.setHeader(Protocol.H_ACCEL_BUFFERING, Protocol.ACCEL_BUFFERING_OFF);
        resp.setHeader(Protocol.H_CONNECTION_ID, connection.id());
        resp.flushBuffer();

        EventChannel channel = relay.events(connection.id());
        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        StreamHandle handle = relay.startStreamAsync(connection.id(), request);

        writers.execute(() -> {
            try {
                pump.pump(channel, resp.getOutputStream());
            } catch (IOException e) {
                log.debug("Client of {} went away", connection.id(), e);
                handle.cancel();
                relay.closeConnection(connection.id());
            } catch (JsonException e) {
                log.warn("Failed to encode event for {}", connection.id(), e);
                handle.cancel();
                relay.closeConnection(connection.id());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.cancel();
            } finally {
                async.complete();
            }
        });
    }

    @Override
    public void destroy() {
        writers.shutdownNow();
        super.destroy();
    }

    private void writeError(HttpServletResponse resp, int status, String code, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        resp.setStatus(status);
        resp.setHeader(H_ERROR, code);
        resp.setContentType(Protocol.CT_JSON);
        try {
            resp.getOutputStream().write(json.writeBytes(body));
        } catch (JsonException e) {
            throw new IOException("Failed to encode error body", e);
        }
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        if (req.getContentLengthLong() == 0) {
            return new byte[0];
        }
        try (InputStream in = req.getInputStream()) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) >= 0) {
                out.write(buf, 0, r);
            }
            return out.toByteArray();
        }
    }
}

package com.forkserve.http.server;

import com.forkserve.http.HttpServer.Response;
import com.forkserve.http.cache.ResponseCache;
import com.forkserve.serialization.Codec;
import com.forkserve.serialization.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.forkserve.observe.Log.*;

/**
 * Response handle for one request.
 *
 * Status and headers may be set from any thread until the response is
 * committed. Committing is a single compare-and-set, so a handler's
 * {@link #send(Object)} and the runtime's failure fallback can never both
 * write a response.
 */
public final class ResponseWriter implements Response {

    private static final Codec<Object> BODY_CODEC = JsonCodec.forAny();

    // framing is owned by the runtime
    private static final Set<String> RESERVED = Set.of(
            "content-length", "connection", "keep-alive", "transfer-encoding");

    private final ResponseSink sink;
    private final String cacheKey;
    private final boolean headRequest;
    private final boolean keepAlive;
    private final long keepAliveMillis;
    private final ResponseCache cache;

    private final AtomicBoolean committed = new AtomicBoolean();
    private final Map<String, String> headers = new LinkedHashMap<>();
    private volatile int status = 200;

    ResponseWriter(ResponseSink sink,
                   String cacheKey,
                   boolean headRequest,
                   boolean keepAlive,
                   long keepAliveMillis,
                   ResponseCache cache) {
        this.sink = sink;
        this.cacheKey = cacheKey;
        this.headRequest = headRequest;
        this.keepAlive = keepAlive;
        this.keepAliveMillis = keepAliveMillis;
        this.cache = cache;
    }

    @Override
    public Response status(int code) {
        if (code < 100 || code > 999) {
            throw new IllegalArgumentException("Invalid status code: " + code);
        }
        this.status = code;
        return this;
    }

    @Override
    public int status() {
        return status;
    }

    @Override
    public Response setHeader(String name, String value) {
        synchronized (headers) {
            headers.put(name, value);
        }
        return this;
    }

    @Override
    public void send(Object body) {
        if (!committed.compareAndSet(false, true)) {
            throw new IllegalStateException("Response already sent for " + cacheKey);
        }

        var encoded = BODY_CODEC.encode(body);
        if (encoded.isFailure()) {
            error("Failed to serialize response for " + cacheKey, encoded.error().orElseThrow());
            sink.respond(StaticResponses.plain(500, StaticResponses.INTERNAL_ERROR, keepAlive, headRequest), !keepAlive);
            return;
        }

        byte[] bytes = encoded.getOrThrow();
        int code = status;
        if (code == 200) {
            cache.store(cacheKey, bytes);
        }
        sink.respond(render(code, bytes), !keepAlive);
    }

    @Override
    public boolean isSent() {
        return committed.get();
    }

    /**
     * Commit a plain 500 unless a response was already sent.
     *
     * @return true if this call wrote the response
     */
    boolean sendInternalError() {
        if (!committed.compareAndSet(false, true)) {
            return false;
        }
        sink.respond(StaticResponses.plain(500, StaticResponses.INTERNAL_ERROR, keepAlive, headRequest), !keepAlive);
        return true;
    }

    String cacheKey() {
        return cacheKey;
    }

    private byte[] render(int code, byte[] body) {
        StringBuilder head = new StringBuilder(256);
        head.append("HTTP/1.1 ").append(code).append(' ').append(HttpStatus.reason(code)).append("\r\n");

        Map<String, String> extra;
        synchronized (headers) {
            extra = new LinkedHashMap<>(headers);
        }
        boolean customType = extra.keySet().stream()
                .anyMatch(name -> name.equalsIgnoreCase("content-type"));
        if (!customType) {
            head.append("Content-Type: ").append(JsonCodec.CONTENT_TYPE).append("\r\n");
        }
        head.append("Content-Length: ").append(body.length).append("\r\n");
        if (keepAlive) {
            head.append("Connection: keep-alive\r\n");
            head.append("Keep-Alive: timeout=").append(keepAliveMillis).append("\r\n");
        } else {
            head.append("Connection: close\r\n");
        }
        extra.forEach((name, value) -> {
            if (!RESERVED.contains(name.toLowerCase(Locale.ROOT))) {
                head.append(name).append(": ").append(value).append("\r\n");
            }
        });
        head.append("\r\n");

        byte[] headBytes = head.toString().getBytes(StandardCharsets.ISO_8859_1);
        return StaticResponses.concat(headBytes, headRequest ? new byte[0] : body);
    }
}

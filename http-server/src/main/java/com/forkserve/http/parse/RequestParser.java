package com.forkserve.http.parse;

import com.forkserve.http.HttpServer.Request;
import com.forkserve.http.buffer.BufferPool;
import com.forkserve.serialization.Codec;
import com.forkserve.serialization.JsonCodec;

import java.util.Map;

/**
 * Builds the normalized {@link Request} handed to handlers.
 */
public final class RequestParser {

    /**
     * Body of requests without one, with an empty or undecodable payload,
     * and of GET/HEAD requests.
     */
    public static final Map<String, Object> EMPTY_BODY = Map.of();

    private static final Codec<Object> BODY_CODEC = JsonCodec.forAny();

    private RequestParser() {}

    /**
     * GET and HEAD bodies are never read into a buffer or decoded.
     */
    public static boolean skipsBody(String method) {
        return "GET".equals(method) || "HEAD".equals(method);
    }

    public static Request toRequest(RequestHead head, Object body) {
        String url = head.url();
        int q = url.indexOf('?');
        String path = q < 0 ? url : url.substring(0, q);
        Map<String, String> query = q < 0 ? Map.of() : QueryString.parse(url.substring(q + 1));
        return new Request(head.method(), path, head.headers(), query, Map.of(), body, url);
    }

    /**
     * Decode the leased bytes as UTF-8 JSON. No bytes, or bytes that are not
     * a JSON value, give {@link #EMPTY_BODY}.
     */
    public static Object decodeBody(BufferPool.Lease lease) {
        if (lease == null || lease.size() == 0) {
            return EMPTY_BODY;
        }
        return BODY_CODEC.decode(lease.array(), 0, lease.size()).getOrElse(EMPTY_BODY);
    }
}

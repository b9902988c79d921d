package com.forkserve.http.parse;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Request line and headers of one request, parsed once.
 *
 * @param method  request method token, case preserved
 * @param url     request target as received (path plus query)
 * @param version "HTTP/1.1" or "HTTP/1.0"
 * @param headers lower-cased names to values
 */
public record RequestHead(String method, String url, String version, Map<String, String> headers) {

    public static final String HTTP_1_0 = "HTTP/1.0";
    public static final String HTTP_1_1 = "HTTP/1.1";

    public RequestHead {
        headers = Map.copyOf(headers);
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Whether the client expects the connection to stay open after the response.
     */
    public boolean keepAlive() {
        String connection = header("connection");
        if (HTTP_1_0.equals(version)) {
            return connection != null && hasToken(connection, "keep-alive");
        }
        return connection == null || !hasToken(connection, "close");
    }

    public boolean chunked() {
        String te = header("transfer-encoding");
        return te != null && hasToken(te, "chunked");
    }

    /**
     * Declared Content-Length, empty when absent.
     *
     * @throws RequestParseException if the value is not a non-negative integer
     */
    public OptionalLong contentLength() {
        String value = header("content-length");
        if (value == null) {
            return OptionalLong.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.length() > 18) {
            throw RequestParseException.badRequest("Invalid Content-Length: " + value);
        }
        long length = 0;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c < '0' || c > '9') {
                throw RequestParseException.badRequest("Invalid Content-Length: " + value);
            }
            length = length * 10 + (c - '0');
        }
        return OptionalLong.of(length);
    }

    private static boolean hasToken(String headerValue, String token) {
        for (String part : headerValue.split(",")) {
            if (part.trim().equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }
}

package com.forkserve.http.parse;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parses the request line and header block of an HTTP/1.x request.
 *
 * Works directly on the connection's inbound buffer: nothing is copied until
 * the terminating blank line has arrived.
 */
public final class RequestHeadParser {

    // later occurrences of these are dropped rather than joined
    private static final Set<String> SINGLE_VALUED = Set.of(
            "content-type", "content-length", "user-agent", "referer", "host",
            "authorization", "proxy-authorization", "if-modified-since",
            "if-unmodified-since", "from", "location", "max-forwards",
            "retry-after", "etag", "last-modified", "server", "age", "expires");

    private RequestHeadParser() {}

    /**
     * Parse one request head starting at the buffer's position.
     *
     * On success the position is advanced past the blank line that ends the
     * head. Leading empty lines are skipped. When the head is incomplete the
     * result is empty and only skipped empty lines are consumed.
     *
     * @param buf           buffer in read mode
     * @param maxHeaderSize upper bound for request line plus headers, in bytes
     * @throws RequestParseException 431 when the head exceeds {@code maxHeaderSize},
     *                               505 for unsupported versions, 400 otherwise
     */
    public static Optional<RequestHead> parse(ByteBuffer buf, int maxHeaderSize) {
        int start = buf.position();
        int limit = buf.limit();
        while (start + 1 < limit && buf.get(start) == '\r' && buf.get(start + 1) == '\n') {
            start += 2;
        }
        buf.position(start);

        int end = findHeaderEnd(buf, start, limit);
        if (end < 0) {
            if (limit - start >= maxHeaderSize) {
                throw new RequestParseException(431, "Request head exceeds " + maxHeaderSize + " bytes");
            }
            return Optional.empty();
        }
        if (end - start > maxHeaderSize) {
            throw new RequestParseException(431, "Request head exceeds " + maxHeaderSize + " bytes");
        }

        byte[] raw = new byte[end - start - 4];
        buf.get(start, raw);
        buf.position(end);

        return Optional.of(parseHead(new String(raw, StandardCharsets.ISO_8859_1)));
    }

    static RequestHead parseHead(String text) {
        String[] lines = text.split("\r\n", -1);

        String[] requestLine = lines[0].split(" ", -1);
        if (requestLine.length != 3) {
            throw RequestParseException.badRequest("Malformed request line");
        }
        String method = requestLine[0];
        String url = requestLine[1];
        String version = requestLine[2];

        if (!isToken(method)) {
            throw RequestParseException.badRequest("Invalid method");
        }
        if (url.isEmpty() || hasControlChars(url)) {
            throw RequestParseException.badRequest("Invalid request target");
        }
        checkVersion(version);

        Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            addHeader(headers, lines[i]);
        }
        return new RequestHead(method, url, version, headers);
    }

    private static void checkVersion(String version) {
        if (RequestHead.HTTP_1_1.equals(version) || RequestHead.HTTP_1_0.equals(version)) {
            return;
        }
        if (version.length() == 8 && version.startsWith("HTTP/")
                && Character.isDigit(version.charAt(5))
                && version.charAt(6) == '.'
                && Character.isDigit(version.charAt(7))) {
            throw new RequestParseException(505, "Unsupported version " + version);
        }
        throw RequestParseException.badRequest("Invalid version");
    }

    private static void addHeader(Map<String, String> headers, String line) {
        if (line.isEmpty() || line.charAt(0) == ' ' || line.charAt(0) == '\t') {
            throw RequestParseException.badRequest("Folded or empty header line");
        }
        int colon = line.indexOf(':');
        if (colon <= 0) {
            throw RequestParseException.badRequest("Header without name");
        }
        String name = line.substring(0, colon);
        if (!isToken(name)) {
            throw RequestParseException.badRequest("Invalid header name");
        }
        String value = trimOws(line.substring(colon + 1));
        if (hasControlChars(value)) {
            throw RequestParseException.badRequest("Invalid header value");
        }

        String key = name.toLowerCase(Locale.ROOT);
        String existing = headers.get(key);
        if (existing == null) {
            headers.put(key, value);
        } else if (key.equals("content-length")) {
            if (!existing.equals(value)) {
                throw RequestParseException.badRequest("Conflicting Content-Length");
            }
        } else if (key.equals("cookie")) {
            headers.put(key, existing + "; " + value);
        } else if (!SINGLE_VALUED.contains(key)) {
            headers.put(key, existing + ", " + value);
        }
    }

    /**
     * Position just after the first CRLFCRLF at or after {@code start}, or -1.
     */
    static int findHeaderEnd(ByteBuffer buf, int start, int limit) {
        for (int i = start; i < limit - 3; i++) {
            if (buf.get(i) == '\r' && buf.get(i + 1) == '\n' &&
                buf.get(i + 2) == '\r' && buf.get(i + 3) == '\n') {
                return i + 4;
            }
        }
        return -1;
    }

    private static String trimOws(String s) {
        int from = 0;
        int to = s.length();
        while (from < to && (s.charAt(from) == ' ' || s.charAt(from) == '\t')) from++;
        while (to > from && (s.charAt(to - 1) == ' ' || s.charAt(to - 1) == '\t')) to--;
        return s.substring(from, to);
    }

    private static boolean isToken(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean tchar = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || "!#$%&'*+-.^_`|~".indexOf(c) >= 0;
            if (!tchar) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasControlChars(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7f) {
                return true;
            }
        }
        return false;
    }
}

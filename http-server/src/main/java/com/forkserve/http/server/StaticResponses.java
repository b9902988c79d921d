package com.forkserve.http.server;

import java.nio.charset.StandardCharsets;

/**
 * Plain-text responses the runtime writes on its own behalf: routing misses,
 * shutdown refusals, handler failures and protocol errors.
 */
final class StaticResponses {

    static final String NOT_FOUND = "Not Found";
    static final String SHUTTING_DOWN = "Server is shutting down";
    static final String BUSY = "Server is busy";
    static final String INTERNAL_ERROR = "Internal Server Error";

    private StaticResponses() {}

    /**
     * @param omitBody true for HEAD requests; Content-Length still announces the text
     */
    static byte[] plain(int status, String text, boolean keepAlive, boolean omitBody) {
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        String head = "HTTP/1.1 " + status + " " + HttpStatus.reason(status) + "\r\n" +
                "Content-Type: text/plain; charset=utf-8\r\n" +
                "Content-Length: " + body.length + "\r\n" +
                "Connection: " + (keepAlive ? "keep-alive" : "close") + "\r\n" +
                "\r\n";
        return concat(head.getBytes(StandardCharsets.ISO_8859_1), omitBody ? new byte[0] : body);
    }

    static byte[] concat(byte[] head, byte[] body) {
        byte[] out = new byte[head.length + body.length];
        System.arraycopy(head, 0, out, 0, head.length);
        System.arraycopy(body, 0, out, head.length, body.length);
        return out;
    }
}

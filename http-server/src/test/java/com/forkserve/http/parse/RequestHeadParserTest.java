package com.forkserve.http.parse;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestHeadParserTest {

    private static ByteBuffer bytes(String s) {
        return ByteBuffer.wrap(s.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void parsesRequestLineAndHeaders() {
        ByteBuffer buf = bytes("GET /health?x=1 HTTP/1.1\r\nHost: localhost\r\nX-Debug:  true \r\n\r\n");

        RequestHead head = RequestHeadParser.parse(buf, 8192).orElseThrow();

        assertThat(head.method()).isEqualTo("GET");
        assertThat(head.url()).isEqualTo("/health?x=1");
        assertThat(head.version()).isEqualTo("HTTP/1.1");
        assertThat(head.headers()).containsEntry("host", "localhost").containsEntry("x-debug", "true");
        assertThat(head.header("X-DEBUG")).isEqualTo("true");
        assertThat(buf.hasRemaining()).isFalse();
    }

    @Test
    void incompleteHeadConsumesNothing() {
        ByteBuffer buf = bytes("GET / HTTP/1.1\r\nHost: a\r\n");
        assertThat(RequestHeadParser.parse(buf, 8192)).isEmpty();
        assertThat(buf.position()).isZero();
    }

    @Test
    void stopsAtTheEndOfTheHead() {
        ByteBuffer buf = bytes("POST /a HTTP/1.1\r\nContent-Length: 2\r\n\r\n{}GET /b HTTP/1.1\r\n\r\n");
        RequestHeadParser.parse(buf, 8192).orElseThrow();
        assertThat(buf.remaining()).isEqualTo("{}GET /b HTTP/1.1\r\n\r\n".length());
    }

    @Test
    void skipsLeadingEmptyLines() {
        Optional<RequestHead> head = RequestHeadParser.parse(bytes("\r\n\r\nGET / HTTP/1.1\r\n\r\n"), 8192);
        assertThat(head).map(RequestHead::url).contains("/");
    }

    @Test
    void joinsRepeatedHeaders() {
        RequestHead head = RequestHeadParser.parse(bytes(
                "GET / HTTP/1.1\r\nAccept: a\r\naccept: b\r\nCookie: x=1\r\nCookie: y=2\r\nHost: one\r\nHost: two\r\n\r\n"),
                8192).orElseThrow();

        assertThat(head.header("accept")).isEqualTo("a, b");
        assertThat(head.header("cookie")).isEqualTo("x=1; y=2");
        assertThat(head.header("host")).isEqualTo("one");
    }

    @Test
    void conflictingContentLengthIsRejected() {
        assertThatThrownBy(() -> RequestHeadParser.parse(bytes(
                "POST / HTTP/1.1\r\nContent-Length: 1\r\nContent-Length: 2\r\n\r\n"), 8192))
                .isInstanceOf(RequestParseException.class)
                .extracting(e -> ((RequestParseException) e).status())
                .isEqualTo(400);
    }

    @Test
    void oversizedHeadIs431() {
        String big = "GET / HTTP/1.1\r\nX-Pad: " + "a".repeat(200) + "\r\n\r\n";
        assertThatThrownBy(() -> RequestHeadParser.parse(bytes(big), 64))
                .isInstanceOfSatisfying(RequestParseException.class, e -> assertThat(e.status()).isEqualTo(431));

        String incomplete = "GET / HTTP/1.1\r\nX-Pad: " + "a".repeat(200);
        assertThatThrownBy(() -> RequestHeadParser.parse(bytes(incomplete), 64))
                .isInstanceOfSatisfying(RequestParseException.class, e -> assertThat(e.status()).isEqualTo(431));
    }

    @Test
    void unknownVersionIs505() {
        assertThatThrownBy(() -> RequestHeadParser.parse(bytes("GET / HTTP/2.0\r\n\r\n"), 8192))
                .isInstanceOfSatisfying(RequestParseException.class, e -> assertThat(e.status()).isEqualTo(505));
    }

    @Test
    void malformedInputIs400() {
        for (String raw : new String[]{
                "GET /\r\n\r\n",
                "GET  / HTTP/1.1\r\n\r\n",
                "G(T / HTTP/1.1\r\n\r\n",
                "GET / HTTP/1.1\r\nNoColon\r\n\r\n",
                "GET / HTTP/1.1\r\nBad Name: x\r\n\r\n",
                "GET / HTTP/1.1\r\nA: b\r\n folded\r\n\r\n",
                "GET / FTP/1.0\r\n\r\n"}) {
            assertThatThrownBy(() -> RequestHeadParser.parse(bytes(raw), 8192))
                    .as(raw)
                    .isInstanceOfSatisfying(RequestParseException.class, e -> assertThat(e.status()).isEqualTo(400));
        }
    }

    @Test
    void keepAliveFollowsVersionAndConnectionHeader() {
        assertThat(head("GET / HTTP/1.1\r\n\r\n").keepAlive()).isTrue();
        assertThat(head("GET / HTTP/1.1\r\nConnection: close\r\n\r\n").keepAlive()).isFalse();
        assertThat(head("GET / HTTP/1.0\r\n\r\n").keepAlive()).isFalse();
        assertThat(head("GET / HTTP/1.0\r\nConnection: Keep-Alive\r\n\r\n").keepAlive()).isTrue();
    }

    private static RequestHead head(String raw) {
        return RequestHeadParser.parse(bytes(raw), 8192).orElseThrow();
    }
}

package com.forkserve.http.server;

import com.forkserve.http.cache.ResponseCache;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseWriterTest {

    private final List<String> written = new ArrayList<>();
    private final List<Boolean> closes = new ArrayList<>();
    private final ResponseSink sink = (bytes, close) -> {
        written.add(new String(bytes, StandardCharsets.UTF_8));
        closes.add(close);
    };
    private final ResponseCache cache = new ResponseCache(10);

    private ResponseWriter writer(boolean head, boolean keepAlive) {
        return new ResponseWriter(sink, "GET:/health?x=1", head, keepAlive, 5000, cache);
    }

    @Test
    void sendsJsonWithFramingHeaders() {
        writer(false, true).status(200).send(Map.of("status", "healthy"));

        assertThat(written).hasSize(1);
        String response = written.get(0);
        assertThat(response).startsWith("HTTP/1.1 200 OK\r\n");
        assertThat(response).contains("Content-Type: application/json\r\n");
        assertThat(response).contains("Content-Length: 20\r\n");
        assertThat(response).contains("Connection: keep-alive\r\n");
        assertThat(response).contains("Keep-Alive: timeout=5000\r\n");
        assertThat(response).endsWith("\r\n\r\n{\"status\":\"healthy\"}");
        assertThat(closes).containsExactly(false);
    }

    @Test
    void okBodiesAreCachedUnderTheObservedUrl() {
        writer(false, true).send(List.of(1, 2));
        assertThat(cache.lookup("GET:/health?x=1")).hasValueSatisfying(
                bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("[1,2]"));
    }

    @Test
    void nonOkBodiesAreNotCached() {
        writer(false, true).status(201).send(Map.of("id", 1));
        assertThat(written.get(0)).startsWith("HTTP/1.1 201 Created\r\n");
        assertThat(cache.size()).isZero();
    }

    @Test
    void secondSendFails() {
        ResponseWriter writer = writer(false, true);
        writer.send("once");

        assertThatThrownBy(() -> writer.send("twice")).isInstanceOf(IllegalStateException.class);
        assertThat(writer.sendInternalError()).isFalse();
        assertThat(written).hasSize(1);
    }

    @Test
    void handlerHeadersAreAddedButFramingStaysOurs() {
        writer(false, true)
                .setHeader("Content-Type", "application/vnd.api+json")
                .setHeader("X-Request-Id", "abc")
                .setHeader("Content-Length", "999")
                .send(Map.of());

        String response = written.get(0);
        assertThat(response).contains("Content-Type: application/vnd.api+json\r\n");
        assertThat(response).doesNotContain("application/json\r\n");
        assertThat(response).contains("X-Request-Id: abc\r\n");
        assertThat(response).contains("Content-Length: 2\r\n").doesNotContain("999");
    }

    @Test
    void closeRequestedByClient() {
        writer(false, false).send(Map.of());
        assertThat(written.get(0)).contains("Connection: close\r\n").doesNotContain("Keep-Alive");
        assertThat(closes).containsExactly(true);
    }

    @Test
    void headResponsesOmitTheBody() {
        writer(true, true).send(Map.of("status", "healthy"));
        assertThat(written.get(0)).contains("Content-Length: 20\r\n").endsWith("\r\n\r\n");
    }

    @Test
    void internalErrorIsPlainText() {
        ResponseWriter writer = writer(false, true);
        assertThat(writer.sendInternalError()).isTrue();
        assertThat(writer.isSent()).isTrue();
        assertThat(written.get(0))
                .startsWith("HTTP/1.1 500 Internal Server Error\r\n")
                .contains("Content-Type: text/plain; charset=utf-8\r\n")
                .endsWith("Internal Server Error");
        assertThatThrownBy(() -> writer.send("late")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void invalidStatusRejected() {
        assertThatThrownBy(() -> writer(false, true).status(42)).isInstanceOf(IllegalArgumentException.class);
    }
}

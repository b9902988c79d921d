package com.forkserve.http;

import com.forkserve.http.server.ServerRuntime;
import com.forkserve.serialization.JsonCodec;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;

/**
 * Minimal HTTP/1.1 server.
 *
 * Design principles:
 * - Exact method + path routing, registered before {@link #listen(int)}
 * - Handlers are async-first: they return a CompletableFuture and answer
 *   through the {@link Response} handle, from any thread
 * - One reactor per worker process; workers share the port through SO_REUSEPORT
 *
 * Example usage:
 * <pre>
 * HttpServer server = HttpServer.create();
 * server.get("/health", Handler.sync((req, res) -> res.status(200).send(Map.of("status", "healthy"))));
 * server.listen(3000).join();
 * Runtime.getRuntime().addShutdownHook(new Thread(() -> server.stop().join()));
 * </pre>
 */
public interface HttpServer {

    // ========================================================================
    // Route Registration
    // ========================================================================

    /**
     * Register a handler for an exact method and path. Re-registering the
     * same pair replaces the previous handler.
     */
    HttpServer route(Method method, String path, Handler handler);

    default HttpServer get(String path, Handler handler) {
        return route(Method.GET, path, handler);
    }

    default HttpServer post(String path, Handler handler) {
        return route(Method.POST, path, handler);
    }

    default HttpServer put(String path, Handler handler) {
        return route(Method.PUT, path, handler);
    }

    default HttpServer delete(String path, Handler handler) {
        return route(Method.DELETE, path, handler);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Start serving on the given port (0 picks an ephemeral port).
     *
     * In the primary process of a multi-process topology this spawns the
     * workers and completes immediately without binding anything. Completes
     * exceptionally with {@link ServerException} if the port cannot be bound.
     */
    CompletableFuture<Void> listen(int port);

    /**
     * Refuse new work, drain open connections and release the port.
     * Completes once every connection has closed or the shutdown timeout
     * has force-closed the rest.
     */
    CompletableFuture<Void> stop();

    /**
     * Block until the server has stopped.
     */
    void awaitTermination() throws InterruptedException;

    /**
     * The bound port, or -1 when this process is not listening.
     */
    int port();

    // ========================================================================
    // Types
    // ========================================================================

    enum Method { GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS }

    /**
     * Normalized request.
     *
     * @param method      request method as received
     * @param path        URL up to the first '?'
     * @param headers     header names lower-cased
     * @param query       decoded query parameters, last occurrence wins
     * @param params      path parameters; always empty
     * @param body        decoded JSON body, or an empty map
     * @param originalUrl path and query exactly as received
     */
    record Request(
            String method,
            String path,
            Map<String, String> headers,
            Map<String, String> query,
            Map<String, String> params,
            Object body,
            String originalUrl
    ) {
        public Request {
            headers = Map.copyOf(headers);
            query = Map.copyOf(query);
            params = Map.copyOf(params);
        }

        public String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }

        public String queryParam(String name) {
            return query.get(name);
        }

        /**
         * Convert the decoded body into a typed value.
         */
        public <T> T bodyAs(Class<T> type) {
            return JsonCodec.mapper().convertValue(body, type);
        }
    }

    /**
     * Response handle. Setters are chainable; {@link #send(Object)} is terminal.
     */
    interface Response {
        Response status(int code);

        int status();

        Response setHeader(String name, String value);

        /**
         * Serialize {@code body} as JSON and write the response.
         *
         * @throws IllegalStateException if a response was already sent
         */
        void send(Object body);

        boolean isSent();
    }

    /**
     * Handler: (Request, Response) -> completion.
     */
    @FunctionalInterface
    interface Handler {
        CompletableFuture<Void> handle(Request request, Response response);

        /**
         * Handler that finishes before returning.
         */
        static Handler sync(BiConsumer<Request, Response> fn) {
            return (request, response) -> {
                fn.accept(request, response);
                return CompletableFuture.completedFuture(null);
            };
        }
    }

    // ========================================================================
    // Factory
    // ========================================================================

    static HttpServer create() {
        return ServerRuntime.create(ServerConfig.load());
    }

    static HttpServer create(ServerConfig config) {
        return ServerRuntime.create(config);
    }
}

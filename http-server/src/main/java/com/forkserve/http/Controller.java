package com.forkserve.http;

import com.forkserve.base.Result;
import com.forkserve.http.HttpServer.Handler;
import com.forkserve.http.HttpServer.Request;
import com.forkserve.http.HttpServer.Response;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.forkserve.observe.Log.*;

/**
 * Base class for handlers that answer failures with a JSON 500.
 *
 * Subclasses implement {@link #execute(Request, Response)} and may throw or
 * return a failed future; either way the client receives
 * {@code 500 {"error":"Internal Server Error"}} unless a response was
 * already sent, and the returned future completes normally.
 *
 * <pre>{@code
 * server.post("/counter", new Controller() {
 *     protected CompletableFuture<Void> execute(Request req, Response res) {
 *         Counter c = req.bodyAs(Counter.class);
 *         return store.save(c).thenAccept(saved -> res.status(201).send(saved));
 *     }
 * });
 * }</pre>
 */
public abstract class Controller implements Handler {

    static final Map<String, String> INTERNAL_ERROR = Map.of("error", "Internal Server Error");

    protected abstract CompletableFuture<Void> execute(Request request, Response response) throws Exception;

    @Override
    public final CompletableFuture<Void> handle(Request request, Response response) {
        CompletableFuture<Void> result;
        try {
            result = execute(request, response);
        } catch (Exception e) {
            fail(request, response, e);
            return CompletableFuture.completedFuture(null);
        }
        if (result == null) {
            return CompletableFuture.completedFuture(null);
        }
        return result.handle((v, err) -> {
            if (err != null) {
                fail(request, response, err);
            }
            return null;
        });
    }

    private void fail(Request request, Response response, Throwable t) {
        error(getClass().getSimpleName() + " failed for " + request.method() + " " + request.path(), t);
        if (response.isSent()) {
            return;
        }
        Result.run(() -> response.status(500).send(INTERNAL_ERROR))
                .onFailure(e -> debug("Error response not sent: {}", e.getMessage()));
    }
}

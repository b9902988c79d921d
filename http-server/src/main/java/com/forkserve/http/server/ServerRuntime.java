package com.forkserve.http.server;

import com.forkserve.http.HttpServer;
import com.forkserve.http.ServerConfig;
import com.forkserve.http.ServerConfig.Mode;
import com.forkserve.http.ServerException;
import com.forkserve.http.cache.ResponseCache;
import com.forkserve.http.routing.RouteRegistry;
import com.forkserve.http.topology.ProcessWorkerSpawner;
import com.forkserve.http.topology.WorkerRole;
import com.forkserve.http.topology.WorkerSpawner;
import com.forkserve.http.topology.WorkerTopology;
import com.forkserve.observe.Log;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.forkserve.observe.Log.*;

/**
 * Composition root of a serving process.
 *
 * <pre>
 *   CREATED ──listen──▶ LISTENING ──stop──▶ SHUTTING_DOWN ──drained──▶ STOPPED
 *                           ▲                                              │
 *                           └──────────────────listen──────────────────────┘
 * </pre>
 *
 * In the primary of a {@code processes} topology {@link #listen(int)} starts
 * the worker supervisor instead of binding; every other process binds one
 * reactor per configured slot on the shared port.
 */
public final class ServerRuntime implements HttpServer {

    public enum State { CREATED, LISTENING, SHUTTING_DOWN, STOPPED }

    private static final String DEBUG_HEADER = "x-debug";

    private final ServerConfig config;
    private final WorkerRole role;
    private final WorkerSpawner spawner;
    private final RouteRegistry routes;
    private final ResponseCache responseCache;
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    private volatile State state = State.CREATED;
    private volatile int port = -1;
    private volatile List<Reactor> reactors = List.of();
    private WorkerTopology topology;
    private CompletableFuture<Void> stopping;
    private CompletableFuture<Void> terminated = new CompletableFuture<>();

    public ServerRuntime(ServerConfig config, WorkerRole role, WorkerSpawner spawner) {
        this.config = Objects.requireNonNull(config, "config");
        this.role = role;
        this.spawner = spawner;
        this.routes = new RouteRegistry(config.cache().routes());
        this.responseCache = new ResponseCache(config.cache().responses());
    }

    public static ServerRuntime create(ServerConfig config) {
        return new ServerRuntime(config, WorkerRole.current(), new ProcessWorkerSpawner());
    }

    // ========================================================================
    // Registration
    // ========================================================================

    @Override
    public HttpServer route(Method method, String path, Handler handler) {
        routes.register(method.name(), path, handler);
        return this;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public synchronized CompletableFuture<Void> listen(int port) {
        if (state == State.LISTENING || state == State.SHUTTING_DOWN) {
            return CompletableFuture.failedFuture(new ServerException("Server is already " + state));
        }
        if (state == State.STOPPED) {
            terminated = new CompletableFuture<>();
            stopping = null;
        }

        if (role == WorkerRole.PRIMARY && config.topology().mode() == Mode.PROCESSES) {
            return startSupervisor();
        }

        int count = config.topology().reactorsPerProcess();
        List<Reactor> bound = new ArrayList<>(count);
        try {
            Reactor first = new Reactor(0, port, this, config);
            bound.add(first);
            int actual = first.localPort();
            for (int i = 1; i < count; i++) {
                bound.add(new Reactor(i, actual, this, config));
            }
            this.port = actual;
        } catch (IOException e) {
            bound.forEach(Reactor::abandon);
            error("Failed to bind port " + port, e);
            return CompletableFuture.failedFuture(new ServerException("Failed to bind port " + port, e));
        }

        reactors = List.copyOf(bound);
        reactors.forEach(Thread::start);
        state = State.LISTENING;
        info("Worker {} listening on port {} with {} reactor(s)",
                WorkerRole.workerId().isPresent() ? WorkerRole.workerId().getAsInt() : ProcessHandle.current().pid(),
                this.port, count);
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> startSupervisor() {
        topology = new WorkerTopology(config.topology(), spawner);
        topology.start();
        state = State.LISTENING;
        CompletableFuture<Void> done = terminated;
        topology.terminated().whenComplete((v, err) -> {
            synchronized (this) {
                state = State.STOPPED;
                topology = null;
            }
            done.complete(null);
        });
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> stop() {
        if (stopping != null) {
            return stopping;
        }
        if (state != State.LISTENING) {
            return CompletableFuture.completedFuture(null);
        }

        shuttingDown.set(true);
        state = State.SHUTTING_DOWN;
        info("Shutting down, draining {} connection(s)", activeConnections());

        CompletableFuture<Void> drained;
        if (topology != null) {
            drained = topology.stop(config.shutdownTimeout());
        } else {
            long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
            drained = CompletableFuture.allOf(reactors.stream()
                    .map(r -> r.shutdown(deadline))
                    .toArray(CompletableFuture<?>[]::new));
        }

        CompletableFuture<Void> done = terminated;
        stopping = drained.handle((v, err) -> {
            synchronized (this) {
                reactors = List.of();
                topology = null;
                port = -1;
                state = State.STOPPED;
                shuttingDown.set(false);
            }
            info("Server stopped");
            done.complete(null);
            return null;
        });
        return stopping;
    }

    @Override
    public void awaitTermination() throws InterruptedException {
        CompletableFuture<Void> done;
        synchronized (this) {
            done = terminated;
        }
        try {
            done.get();
        } catch (ExecutionException e) {
            throw new ServerException("Server terminated abnormally", e.getCause());
        }
    }

    @Override
    public int port() {
        return port;
    }

    public State state() {
        return state;
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public RouteRegistry routes() {
        return routes;
    }

    public ResponseCache responseCache() {
        return responseCache;
    }

    public ServerConfig config() {
        return config;
    }

    /**
     * Open connections across all reactors of this process.
     */
    public int activeConnections() {
        return reactors.stream().mapToInt(r -> r.connections().size()).sum();
    }

    /**
     * Body buffers leased so far across all reactors.
     */
    long totalLeases() {
        return reactors.stream().mapToLong(r -> r.pool().totalLeases()).sum();
    }

    // ========================================================================
    // Dispatch (reactor thread)
    // ========================================================================

    void dispatch(Handler handler, Request request, ResponseWriter response) {
        Runnable work = () -> invoke(handler, request, response);
        if ("true".equalsIgnoreCase(request.header(DEBUG_HEADER))) {
            Log.enableInvestigation();
            try {
                Log.traced("dispatch " + response.cacheKey(), work);
            } finally {
                Log.disableInvestigation();
            }
        } else {
            work.run();
        }
    }

    private void invoke(Handler handler, Request request, ResponseWriter response) {
        CompletableFuture<Void> result;
        try {
            result = handler.handle(request, response);
        } catch (Throwable t) {
            // Errors too: a handler's StackOverflowError must not take the reactor down
            handlerFailed(response, t);
            return;
        }
        if (result == null) {
            result = CompletableFuture.completedFuture(null);
        }
        result.whenComplete((v, err) -> {
            if (err != null) {
                handlerFailed(response, err);
            } else if (!response.isSent()) {
                warn("Handler for {} completed without sending a response", response.cacheKey());
                response.sendInternalError();
            }
        });
    }

    private void handlerFailed(ResponseWriter response, Throwable t) {
        error("Handler failed for " + response.cacheKey(), t);
        response.sendInternalError();
    }
}

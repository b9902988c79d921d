package com.forkserve.http.server;

import com.forkserve.base.Result;
import com.forkserve.http.ServerConfig;
import com.forkserve.http.buffer.BufferPool;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Iterator;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;

import static com.forkserve.observe.Log.*;

/**
 * Independent accept + I/O loop.
 *
 * Each reactor owns its listening socket, selector, buffer pool and
 * connections; reactors of one JVM share nothing but the route table and
 * caches. Several reactors (or worker processes) bind the same port through
 * SO_REUSEPORT and the kernel spreads connections between them.
 *
 * Other threads talk to a reactor only through {@link #execute(Runnable)}.
 */
final class Reactor extends Thread {

    private static final long SELECT_TIMEOUT_MS = 250;
    private static final long SWEEP_INTERVAL_NANOS = TimeUnit.MILLISECONDS.toNanos(250);

    private final int id;
    private final Selector selector;
    private final ServerSocketChannel serverChannel;
    private final ConnectionManager connections;
    private final BufferPool pool;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private boolean draining;
    private long drainDeadline;

    Reactor(int id, int port, ServerRuntime runtime, ServerConfig config) throws IOException {
        super("forkserve-reactor-" + id);
        this.id = id;
        this.pool = new BufferPool(config.bufferPool().bufferSize(), config.bufferPool().slots());
        this.connections = new ConnectionManager(this, runtime, config.connection());

        this.selector = Selector.open();
        this.serverChannel = ServerSocketChannel.open();
        try {
            serverChannel.configureBlocking(false);
            serverChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            try {
                serverChannel.setOption(StandardSocketOptions.SO_REUSEPORT, true);
            } catch (UnsupportedOperationException e) {
                if (id > 0) {
                    throw new IOException("SO_REUSEPORT not supported, use a single reactor", e);
                }
            }
            serverChannel.bind(new InetSocketAddress(port), config.connection().backlog());
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            Result.run(serverChannel::close)
                    .onFailure(c -> debug("Error closing listener: {}", c.getMessage()));
            Result.run(selector::close)
                    .onFailure(c -> debug("Error closing selector: {}", c.getMessage()));
            throw e;
        }
    }

    int localPort() {
        return serverChannel.socket().getLocalPort();
    }

    BufferPool pool() {
        return pool;
    }

    ConnectionManager connections() {
        return connections;
    }

    boolean inReactorThread() {
        return Thread.currentThread() == this;
    }

    void execute(Runnable task) {
        tasks.add(task);
        selector.wakeup();
    }

    /**
     * Close the listener and drain connections; connections still open at
     * {@code deadlineNanos} are closed forcibly.
     *
     * @return completes when the reactor thread has exited
     */
    CompletableFuture<Void> shutdown(long deadlineNanos) {
        execute(() -> {
            closeListener();
            draining = true;
            drainDeadline = deadlineNanos;
            connections.drain();
        });
        return terminated;
    }

    CompletableFuture<Void> terminated() {
        return terminated;
    }

    @Override
    public void run() {
        long nextSweep = System.nanoTime() + SWEEP_INTERVAL_NANOS;
        try {
            while (true) {
                selector.select(SELECT_TIMEOUT_MS);
                runTasks();
                handleSelected();

                long now = System.nanoTime();
                if (now - nextSweep >= 0) {
                    connections.sweep(now);
                    nextSweep = now + SWEEP_INTERVAL_NANOS;
                }
                if (draining) {
                    if (connections.isEmpty()) {
                        break;
                    }
                    if (now - drainDeadline >= 0) {
                        warn("Reactor {} shutdown deadline reached, closing {} connections", id, connections.size());
                        connections.closeAll();
                        break;
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            error("Reactor " + id + " failed", e);
        } finally {
            cleanup();
            terminated.complete(null);
        }
    }

    private void runTasks() {
        Runnable task;
        while ((task = tasks.poll()) != null) {
            try {
                task.run();
            } catch (RuntimeException | Error e) {
                error("Reactor task failed", e);
            }
        }
    }

    private void handleSelected() {
        Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
        while (keys.hasNext()) {
            SelectionKey key = keys.next();
            keys.remove();

            if (!key.isValid()) continue;

            if (key.isAcceptable()) {
                acceptAll();
                continue;
            }

            Connection connection = (Connection) key.attachment();
            try {
                if (key.isWritable()) {
                    connection.onWritable();
                }
                if (key.isValid() && key.isReadable()) {
                    connection.onReadable();
                }
            } catch (RuntimeException | Error e) {
                error("Unexpected failure on " + connection, e);
                connection.close();
            }
        }
    }

    private void acceptAll() {
        while (serverChannel.isOpen()) {
            SocketChannel client;
            try {
                client = serverChannel.accept();
            } catch (IOException e) {
                warn("Accept failed on reactor {}: {}", id, e.getMessage());
                return;
            }
            if (client == null) {
                return;
            }
            try {
                connections.accept(client, selector);
            } catch (IOException e) {
                debug("Could not set up connection: {}", e.getMessage());
                Result.run(client::close)
                        .onFailure(c -> debug("Error closing socket: {}", c.getMessage()));
            }
        }
    }

    private void closeListener() {
        SelectionKey key = serverChannel.keyFor(selector);
        if (key != null) {
            key.cancel();
        }
        Result.run(serverChannel::close)
                .onFailure(e -> debug("Error closing listener: {}", e.getMessage()));
    }

    private void cleanup() {
        closeListener();
        connections.closeAll();
        Result.run(selector::close)
                .onFailure(e -> debug("Error closing selector: {}", e.getMessage()));
    }

    /**
     * Close the listener of a reactor that was bound but never started.
     */
    void abandon() {
        cleanup();
        terminated.complete(null);
    }
}

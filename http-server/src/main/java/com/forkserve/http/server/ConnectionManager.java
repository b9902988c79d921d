package com.forkserve.http.server;

import com.forkserve.http.ServerConfig.ConnectionConfig;

import java.io.IOException;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

import jdk.net.ExtendedSocketOptions;

import static com.forkserve.observe.Log.*;

/**
 * Active connections of one reactor.
 *
 * Every accepted socket is tuned (no Nagle, TCP keep-alive), registered with
 * the reactor's selector and tracked here until it closes. The set itself is
 * reactor-confined; {@link #size()} may be read from any thread.
 */
final class ConnectionManager {

    private final Reactor reactor;
    private final ServerRuntime runtime;
    private final ConnectionConfig config;
    private final Set<Connection> active = new LinkedHashSet<>();

    private volatile int size;
    private boolean draining;

    ConnectionManager(Reactor reactor, ServerRuntime runtime, ConnectionConfig config) {
        this.reactor = reactor;
        this.runtime = runtime;
        this.config = config;
    }

    Connection accept(SocketChannel channel, Selector selector) throws IOException {
        channel.configureBlocking(false);
        tune(channel);

        Connection connection = new Connection(channel, reactor, runtime, config);
        SelectionKey key = channel.register(selector, SelectionKey.OP_READ, connection);
        connection.attach(key);
        active.add(connection);
        size = active.size();

        if (draining) {
            connection.drain();
        }
        return connection;
    }

    private void tune(SocketChannel channel) throws IOException {
        channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
        channel.setOption(StandardSocketOptions.SO_KEEPALIVE, true);
        try {
            int idleSeconds = (int) Math.max(1, config.keepAliveTimeout().toSeconds());
            channel.setOption(ExtendedSocketOptions.TCP_KEEPIDLE, idleSeconds);
        } catch (UnsupportedOperationException e) {
            // platform without per-socket keep-alive tuning
            debug("TCP_KEEPIDLE not supported: {}", e.getMessage());
        }
    }

    void remove(Connection connection) {
        if (active.remove(connection)) {
            size = active.size();
        }
    }

    void sweep(long now) {
        for (Connection connection : new ArrayList<>(active)) {
            connection.sweep(now);
        }
    }

    /**
     * Ask every connection to finish its current request and shut down.
     */
    void drain() {
        draining = true;
        for (Connection connection : new ArrayList<>(active)) {
            connection.drain();
        }
    }

    void closeAll() {
        for (Connection connection : new ArrayList<>(active)) {
            connection.close();
        }
    }

    boolean isEmpty() {
        return active.isEmpty();
    }

    int size() {
        return size;
    }
}

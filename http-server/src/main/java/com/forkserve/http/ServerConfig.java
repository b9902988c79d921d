package com.forkserve.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Locale;

import static com.forkserve.config.ConfigAccessor.*;

/**
 * Immutable server configuration.
 *
 * All nested configs are records with static from(Config) factories, read
 * from the {@code forkserve} block of the HOCON configuration.
 *
 * Example:
 * <pre>
 *   var config = ServerConfig.load();
 *   var test = ServerConfig.defaults()
 *       .withTopology(TopologyConfig.reactors(2))
 *       .withShutdownTimeout(Duration.ofSeconds(2));
 * </pre>
 */
public record ServerConfig(
        int port,
        TopologyConfig topology,
        ConnectionConfig connection,
        PoolConfig bufferPool,
        CacheConfig cache,
        Duration shutdownTimeout
) {

    private static final String ROOT = "forkserve";

    public ServerConfig {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdown timeout must not be negative");
        }
    }

    public static ServerConfig load() {
        return from(ConfigFactory.load().getConfig(ROOT));
    }

    public static ServerConfig from(Config c) {
        return new ServerConfig(
            intVal(c, "port", 3000),
            nested(c, "topology").map(TopologyConfig::from).orElseGet(TopologyConfig::defaults),
            nested(c, "connection").map(ConnectionConfig::from).orElseGet(ConnectionConfig::defaults),
            nested(c, "buffer-pool").map(PoolConfig::from).orElseGet(PoolConfig::defaults),
            nested(c, "cache").map(CacheConfig::from).orElseGet(CacheConfig::defaults),
            duration(c, "shutdown.timeout", Duration.ofSeconds(30))
        );
    }

    /**
     * Built-in defaults, identical to {@code reference.conf}.
     */
    public static ServerConfig defaults() {
        return new ServerConfig(
            3000,
            TopologyConfig.defaults(),
            ConnectionConfig.defaults(),
            PoolConfig.defaults(),
            CacheConfig.defaults(),
            Duration.ofSeconds(30)
        );
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    public ServerConfig withTopology(TopologyConfig topology) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    public ServerConfig withConnection(ConnectionConfig connection) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    public ServerConfig withBufferPool(PoolConfig bufferPool) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    public ServerConfig withCache(CacheConfig cache) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    public ServerConfig withShutdownTimeout(Duration shutdownTimeout) {
        return new ServerConfig(port, topology, connection, bufferPool, cache, shutdownTimeout);
    }

    // =========================================================================
    // Record: TopologyConfig
    // =========================================================================

    public enum Mode {
        PROCESSES,
        REACTORS;

        static Mode parse(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public record TopologyConfig(
        Mode mode,
        int workers,
        Duration initialBackoff,
        Duration maxBackoff,
        int maxRestarts,
        Duration restartWindow
    ) {
        public static TopologyConfig from(Config c) {
            return new TopologyConfig(
                Mode.parse(string(c, "mode", "processes")),
                intVal(c, "workers", 0),
                duration(c, "respawn.initial-backoff", Duration.ofMillis(100)),
                duration(c, "respawn.max-backoff", Duration.ofSeconds(10)),
                intVal(c, "respawn.max-restarts", 5),
                duration(c, "respawn.window", Duration.ofSeconds(60))
            );
        }

        public static TopologyConfig defaults() {
            return new TopologyConfig(Mode.PROCESSES, 0,
                Duration.ofMillis(100), Duration.ofSeconds(10), 5, Duration.ofSeconds(60));
        }

        /**
         * Single JVM with {@code count} reactor threads sharing the port.
         */
        public static TopologyConfig reactors(int count) {
            return defaults().withMode(Mode.REACTORS).withWorkers(count);
        }

        /**
         * Worker slots; 0 means one per available processor.
         */
        public int effectiveWorkers() {
            return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
        }

        /**
         * Reactor threads a serving JVM runs: one per worker process, or all
         * slots when the topology is in-process.
         */
        public int reactorsPerProcess() {
            return mode == Mode.REACTORS ? effectiveWorkers() : 1;
        }

        public TopologyConfig withMode(Mode mode) {
            return new TopologyConfig(mode, workers, initialBackoff, maxBackoff, maxRestarts, restartWindow);
        }

        public TopologyConfig withWorkers(int workers) {
            return new TopologyConfig(mode, workers, initialBackoff, maxBackoff, maxRestarts, restartWindow);
        }
    }

    // =========================================================================
    // Record: ConnectionConfig
    // =========================================================================

    public record ConnectionConfig(
        Duration keepAliveTimeout,
        Duration requestTimeout,
        int maxHeaderSize,
        int backlog
    ) {
        public static ConnectionConfig from(Config c) {
            return new ConnectionConfig(
                duration(c, "keep-alive-timeout", Duration.ofSeconds(5)),
                duration(c, "request-timeout", Duration.ofSeconds(5)),
                intVal(c, "max-header-size", 8192),
                intVal(c, "backlog", 4096)
            );
        }

        public static ConnectionConfig defaults() {
            return new ConnectionConfig(Duration.ofSeconds(5), Duration.ofSeconds(5), 8192, 4096);
        }

        /**
         * Value advertised in the {@code Keep-Alive: timeout=} response header,
         * in milliseconds.
         */
        public long keepAliveMillis() {
            return keepAliveTimeout.toMillis();
        }

        public ConnectionConfig withKeepAliveTimeout(Duration keepAliveTimeout) {
            return new ConnectionConfig(keepAliveTimeout, requestTimeout, maxHeaderSize, backlog);
        }

        public ConnectionConfig withRequestTimeout(Duration requestTimeout) {
            return new ConnectionConfig(keepAliveTimeout, requestTimeout, maxHeaderSize, backlog);
        }
    }

    // =========================================================================
    // Record: PoolConfig
    // =========================================================================

    public record PoolConfig(int bufferSize, int slots) {
        public PoolConfig {
            if (bufferSize <= 0 || slots <= 0) {
                throw new IllegalArgumentException("buffer pool needs positive size and slots");
            }
        }

        public static PoolConfig from(Config c) {
            return new PoolConfig(
                bytes(c, "buffer-size", 16 * 1024),
                intVal(c, "slots", 1000)
            );
        }

        public static PoolConfig defaults() {
            return new PoolConfig(16 * 1024, 1000);
        }
    }

    // =========================================================================
    // Record: CacheConfig
    // =========================================================================

    public record CacheConfig(int routes, int responses) {
        public static CacheConfig from(Config c) {
            return new CacheConfig(
                intVal(c, "routes", 10_000),
                intVal(c, "responses", 1000)
            );
        }

        public static CacheConfig defaults() {
            return new CacheConfig(10_000, 1000);
        }
    }
}

package com.forkserve.config;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Optional;

/**
 * Reads HOCON values with a fallback for missing paths, so that a partial
 * {@code forkserve} block still yields a complete configuration.
 *
 * <pre>
 *   int slots = intVal(c, "slots", 1000);
 *   Duration idle = duration(c, "keep-alive-timeout", Duration.ofSeconds(5));
 * </pre>
 */
public final class ConfigAccessor {

    private ConfigAccessor() {}

    public static String string(Config c, String path, String fallback) {
        return c.hasPath(path) ? c.getString(path) : fallback;
    }

    public static int intVal(Config c, String path, int fallback) {
        return c.hasPath(path) ? c.getInt(path) : fallback;
    }

    public static Duration duration(Config c, String path, Duration fallback) {
        return c.hasPath(path) ? c.getDuration(path) : fallback;
    }

    /**
     * Memory size such as {@code 16KiB}, in bytes.
     *
     * @throws ArithmeticException if the size does not fit an int
     */
    public static int bytes(Config c, String path, int fallback) {
        return c.hasPath(path) ? Math.toIntExact(c.getMemorySize(path).toBytes()) : fallback;
    }

    public static Optional<Config> nested(Config c, String path) {
        return c.hasPath(path) ? Optional.of(c.getConfig(path)) : Optional.empty();
    }
}

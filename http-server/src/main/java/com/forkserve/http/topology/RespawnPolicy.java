package com.forkserve.http.topology;

import com.forkserve.http.ServerConfig.TopologyConfig;

import java.time.Duration;

/**
 * Backoff and give-up rules for crashed workers.
 *
 * @param initialBackoff delay before the first respawn
 * @param maxBackoff     cap for the doubling delay
 * @param maxRestarts    exits tolerated within {@code window} before a slot is abandoned
 * @param window         sliding window for counting exits
 */
public record RespawnPolicy(Duration initialBackoff, Duration maxBackoff, int maxRestarts, Duration window) {

    public RespawnPolicy {
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative");
        }
    }

    public static RespawnPolicy from(TopologyConfig config) {
        return new RespawnPolicy(config.initialBackoff(), config.maxBackoff(),
                config.maxRestarts(), config.restartWindow());
    }

    /**
     * Delay before respawning after the {@code exits}-th exit within the window.
     */
    public Duration backoff(int exits) {
        Duration delay = initialBackoff;
        for (int i = 1; i < exits && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public boolean exhausted(int exitsInWindow) {
        return exitsInWindow > maxRestarts;
    }
}

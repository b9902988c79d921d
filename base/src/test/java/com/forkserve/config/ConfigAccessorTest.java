package com.forkserve.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigAccessorTest {

    private final Config config = ConfigFactory.parseString("""
            port = 8080
            name = worker
            idle = 5s
            buffer = 16KiB
            nested { slots = 3 }
            """);

    @Test
    void readsPresentValues() {
        assertThat(ConfigAccessor.intVal(config, "port", 0)).isEqualTo(8080);
        assertThat(ConfigAccessor.string(config, "name", "x")).isEqualTo("worker");
        assertThat(ConfigAccessor.duration(config, "idle", Duration.ZERO)).isEqualTo(Duration.ofSeconds(5));
        assertThat(ConfigAccessor.bytes(config, "buffer", 0)).isEqualTo(16 * 1024);
    }

    @Test
    void fallsBackToDefaultsForMissingPaths() {
        assertThat(ConfigAccessor.intVal(config, "missing", 7)).isEqualTo(7);
        assertThat(ConfigAccessor.string(config, "missing", "fallback")).isEqualTo("fallback");
        assertThat(ConfigAccessor.duration(config, "missing", Duration.ofMillis(1))).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void nestedReturnsSubConfig() {
        assertThat(ConfigAccessor.nested(config, "nested").orElseThrow().getInt("slots")).isEqualTo(3);
        assertThat(ConfigAccessor.nested(config, "absent")).isEmpty();
    }
}

package com.forkserve.http;

import com.forkserve.http.ServerConfig.Mode;
import com.forkserve.http.ServerConfig.TopologyConfig;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

    @Test
    void referenceConfMatchesDefaults() {
        ServerConfig loaded = ServerConfig.from(ConfigFactory.defaultReference().getConfig("forkserve"));
        assertThat(loaded).isEqualTo(ServerConfig.defaults());
    }

    @Test
    void defaultsMatchTheDocumentedValues() {
        ServerConfig config = ServerConfig.defaults();
        assertThat(config.port()).isEqualTo(3000);
        assertThat(config.bufferPool().bufferSize()).isEqualTo(16 * 1024);
        assertThat(config.bufferPool().slots()).isEqualTo(1000);
        assertThat(config.connection().keepAliveTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.connection().keepAliveMillis()).isEqualTo(5000);
        assertThat(config.shutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.topology().mode()).isEqualTo(Mode.PROCESSES);
        assertThat(config.topology().reactorsPerProcess()).isEqualTo(1);
    }

    @Test
    void overridesFromHocon() {
        ServerConfig config = ServerConfig.from(ConfigFactory.parseString("""
                port = 8080
                topology { mode = reactors, workers = 3 }
                buffer-pool { buffer-size = 1KiB }
                connection { keep-alive-timeout = 1500ms }
                """));

        assertThat(config.port()).isEqualTo(8080);
        assertThat(config.topology().mode()).isEqualTo(Mode.REACTORS);
        assertThat(config.topology().reactorsPerProcess()).isEqualTo(3);
        assertThat(config.bufferPool().bufferSize()).isEqualTo(1024);
        assertThat(config.bufferPool().slots()).isEqualTo(1000);
        assertThat(config.connection().keepAliveMillis()).isEqualTo(1500);
    }

    @Test
    void zeroWorkersMeansOnePerProcessor() {
        assertThat(TopologyConfig.defaults().effectiveWorkers())
                .isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(TopologyConfig.reactors(2).effectiveWorkers()).isEqualTo(2);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> ServerConfig.defaults().withPort(70_000))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ServerConfig.PoolConfig(0, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

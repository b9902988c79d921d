package com.forkserve.http;

import com.forkserve.http.HttpServer.Handler;

import java.util.Map;

import static com.forkserve.observe.Log.*;

/**
 * Entry point: health endpoint, multi-process topology, graceful shutdown.
 *
 * The same main runs in the primary and in every worker; the
 * {@code FORKSERVE_WORKER_ID} environment variable decides the role.
 */
public final class ForkServeApplication {

    static final Map<String, String> HEALTHY = Map.of("status", "healthy");

    private ForkServeApplication() {}

    public static void main(String[] args) throws Exception {
        ServerConfig config = ServerConfig.load();
        if (args.length > 0) {
            config = config.withPort(Integer.parseInt(args[0]));
        }

        HttpServer server = routes(HttpServer.create(config));
        server.listen(config.port()).join();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            info("Termination requested, draining connections");
            server.stop().join();
        }, "forkserve-shutdown"));

        server.awaitTermination();
    }

    static HttpServer routes(HttpServer server) {
        return server.get("/health", Handler.sync((req, res) -> res.status(200).send(HEALTHY)));
    }
}

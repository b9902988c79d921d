package com.forkserve.http.topology;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Starts worker processes for the supervisor.
 */
@FunctionalInterface
public interface WorkerSpawner {

    WorkerProcess spawn(int workerId) throws IOException;

    /**
     * Handle on a running worker.
     */
    interface WorkerProcess {
        long pid();

        /**
         * Completes with the exit code once the worker has terminated.
         */
        CompletableFuture<Integer> onExit();

        /**
         * Ask the worker to shut down gracefully (SIGTERM).
         */
        void terminate();

        void kill();

        boolean isAlive();
    }
}

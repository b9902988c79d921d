package com.forkserve.http.topology;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Role of this JVM in a multi-process topology, decided by the presence of
 * {@link WorkerTopology#WORKER_ID_ENV}.
 */
public enum WorkerRole {
    PRIMARY,
    WORKER;

    public static WorkerRole current() {
        return fromEnv(System.getenv());
    }

    static WorkerRole fromEnv(Map<String, String> env) {
        return env.containsKey(WorkerTopology.WORKER_ID_ENV) ? WORKER : PRIMARY;
    }

    /**
     * Slot number of this worker, empty in the primary or when unparseable.
     */
    public static OptionalInt workerId() {
        String raw = System.getenv(WorkerTopology.WORKER_ID_ENV);
        if (raw == null) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}

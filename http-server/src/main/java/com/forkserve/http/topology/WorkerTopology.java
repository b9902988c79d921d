package com.forkserve.http.topology;

import com.forkserve.http.ServerConfig.TopologyConfig;
import com.forkserve.http.topology.WorkerSpawner.WorkerProcess;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.forkserve.observe.Log.*;

/**
 * Supervisor run by the primary process: one worker per slot, respawned with
 * exponential backoff when it exits.
 *
 * A slot whose worker exits more than {@code maxRestarts} times inside the
 * restart window is abandoned. The supervisor terminates when it is stopped
 * or when every slot has been abandoned.
 */
public final class WorkerTopology {

    public static final String WORKER_ID_ENV = "FORKSERVE_WORKER_ID";

    private final int workers;
    private final WorkerSpawner spawner;
    private final RespawnPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final List<Slot> slots = new ArrayList<>();
    private final AtomicInteger restarts = new AtomicInteger();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private boolean started;
    private boolean stopping;

    public WorkerTopology(TopologyConfig config, WorkerSpawner spawner) {
        this(config.effectiveWorkers(), spawner, RespawnPolicy.from(config));
    }

    public WorkerTopology(int workers, WorkerSpawner spawner, RespawnPolicy policy) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.workers = workers;
        this.spawner = spawner;
        this.policy = policy;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "forkserve-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("topology already started");
        }
        started = true;
        info("Primary {} starting {} workers", ProcessHandle.current().pid(), workers);
        for (int i = 0; i < workers; i++) {
            Slot slot = new Slot(i);
            slots.add(slot);
            spawn(slot);
        }
    }

    private synchronized void spawn(Slot slot) {
        if (stopping) {
            return;
        }
        WorkerProcess process;
        try {
            process = spawner.spawn(slot.id);
        } catch (IOException e) {
            error("Failed to spawn worker " + slot.id, e);
            exited(slot, null, -1);
            return;
        }
        slot.process = process;
        debug("Worker {} started with pid {}", slot.id, process.pid());
        process.onExit().whenComplete((code, err) -> exited(slot, process, code == null ? -1 : code));
    }

    private synchronized void exited(Slot slot, WorkerProcess process, int code) {
        if (process != null && slot.process != process) {
            return;
        }
        slot.process = null;
        if (stopping) {
            return;
        }

        long now = System.nanoTime();
        slot.exits.addLast(now);
        long window = policy.window().toNanos();
        while (!slot.exits.isEmpty() && now - slot.exits.peekFirst() > window) {
            slot.exits.removeFirst();
        }

        int recent = slot.exits.size();
        if (policy.exhausted(recent)) {
            slot.abandoned = true;
            error("Worker {} exited {} times within {}, giving up on it", slot.id, recent, policy.window());
            if (slots.stream().allMatch(s -> s.abandoned)) {
                error("All workers abandoned, supervisor terminating");
                scheduler.shutdownNow();
                terminated.complete(null);
            }
            return;
        }

        Duration delay = policy.backoff(recent);
        warn("Worker {} exited with code {}, respawning in {} ms", slot.id, code, delay.toMillis());
        restarts.incrementAndGet();
        scheduler.schedule(() -> spawn(slot), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop respawning and terminate every worker. Workers still alive after
     * {@code timeout} are killed.
     */
    public CompletableFuture<Void> stop(Duration timeout) {
        List<WorkerProcess> running = new ArrayList<>();
        synchronized (this) {
            if (stopping) {
                return terminated;
            }
            stopping = true;
            for (Slot slot : slots) {
                if (slot.process != null) {
                    running.add(slot.process);
                }
            }
        }
        scheduler.shutdownNow();
        info("Stopping {} workers", running.size());

        List<CompletableFuture<Integer>> exits = new ArrayList<>();
        for (WorkerProcess process : running) {
            process.terminate();
            exits.add(process.onExit());
        }

        CompletableFuture.allOf(exits.toArray(new CompletableFuture<?>[0]))
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, err) -> {
                    if (err != null) {
                        warn("Workers did not exit within {}, killing the rest", timeout);
                        running.stream().filter(WorkerProcess::isAlive).forEach(WorkerProcess::kill);
                    }
                    info("All workers stopped");
                    terminated.complete(null);
                });
        return terminated;
    }

    public synchronized int liveWorkers() {
        return (int) slots.stream().filter(s -> s.process != null).count();
    }

    public int restarts() {
        return restarts.get();
    }

    public synchronized int abandoned() {
        return (int) slots.stream().filter(s -> s.abandoned).count();
    }

    public int workers() {
        return workers;
    }

    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    private static final class Slot {
        final int id;
        final Deque<Long> exits = new ArrayDeque<>();
        WorkerProcess process;
        boolean abandoned;

        Slot(int id) {
            this.id = id;
        }
    }
}

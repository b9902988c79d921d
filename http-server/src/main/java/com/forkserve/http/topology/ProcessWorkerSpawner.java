package com.forkserve.http.topology;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Spawns workers by re-running this JVM's own command line with
 * {@link WorkerTopology#WORKER_ID_ENV} set. Worker output is inherited.
 */
public final class ProcessWorkerSpawner implements WorkerSpawner {

    private final List<String> command;

    public ProcessWorkerSpawner() {
        this(currentCommand());
    }

    public ProcessWorkerSpawner(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("empty worker command");
        }
        this.command = List.copyOf(command);
    }

    @Override
    public WorkerProcess spawn(int workerId) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
        builder.environment().put(WorkerTopology.WORKER_ID_ENV, Integer.toString(workerId));
        return new OsProcess(builder.start());
    }

    public List<String> command() {
        return command;
    }

    /**
     * Command line of the running JVM. Falls back to java.home, the class
     * path and sun.java.command where the OS does not report arguments.
     */
    static List<String> currentCommand() {
        ProcessHandle.Info info = ProcessHandle.current().info();
        Optional<String> executable = info.command();
        Optional<String[]> arguments = info.arguments();
        if (executable.isPresent() && arguments.isPresent()) {
            List<String> cmd = new ArrayList<>();
            cmd.add(executable.get());
            cmd.addAll(Arrays.asList(arguments.get()));
            return cmd;
        }

        List<String> cmd = new ArrayList<>();
        cmd.add(System.getProperty("java.home") + File.separator + "bin" + File.separator + "java");
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        String main = System.getProperty("sun.java.command", "");
        cmd.addAll(Arrays.asList(main.trim().split("\\s+")));
        return cmd;
    }

    private static final class OsProcess implements WorkerProcess {
        private final Process process;
        private final CompletableFuture<Integer> exit;

        OsProcess(Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            process.destroy();
        }

        @Override
        public void kill() {
            process.destroyForcibly();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }
    }
}

package io.sessioncast.exec;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs a child process from an argument vector with a hard timeout. Both output streams are drained
 * concurrently so a chatty child cannot block on a full pipe.
 */
public final class CommandRunner {
    private static final long REAP_WAIT_MS = 1_000L;
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "sessioncast-proc-io");
        thread.setDaemon(true);
        return thread;
    });

    private final Map<String, String> extraEnv;

    public CommandRunner() {
        this(Map.of());
    }

    public CommandRunner(Map<String, String> extraEnv) {
        this.extraEnv = Map.copyOf(extraEnv);
    }

    public CommandOutput run(List<String> command, Path workingDir, long timeoutMs) throws IOException, InterruptedException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.environment().putAll(extraEnv);
        Process process = pb.start();
        process.getOutputStream().close();

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            boolean finished = process.waitFor(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(REAP_WAIT_MS, TimeUnit.MILLISECONDS);
                return new CommandOutput(-1, "", "", true);
            }
            return new CommandOutput(process.exitValue(), stdout.join(), stderr.join(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }
}

package io.sessioncast.runtime;

import io.sessioncast.config.AgentConfig;
import io.sessioncast.control.ControlChannelClient;
import io.sessioncast.exec.CommandExecutionService;
import io.sessioncast.llm.LlmService;
import io.sessioncast.relay.JdkWebSocketTransport;
import io.sessioncast.relay.RelayTransport;
import io.sessioncast.tmux.TmuxCapabilities;
import io.sessioncast.tmux.TmuxCapability;
import io.sessioncast.util.ScheduledEventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the agent from its configuration and runs it until a signal or a terminal relay error.
 */
public final class AgentDaemon {
    private static final Logger LOGGER = LoggerFactory.getLogger(AgentDaemon.class);
    private static final int WORKER_THREADS = 4;
    private static final long SHUTDOWN_TIMEOUT_MS = 10_000L;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final AgentConfig config;
    private final TmuxCapability tmux;
    private final RelayTransport transport;
    private final PrintStream out;
    private final PrintStream err;

    public AgentDaemon(AgentConfig config, PrintStream out, PrintStream err) {
        this(config, TmuxCapabilities.forCurrentPlatform(), new JdkWebSocketTransport(CONNECT_TIMEOUT), out, err);
    }

    public AgentDaemon(AgentConfig config, TmuxCapability tmux, RelayTransport transport, PrintStream out, PrintStream err) {
        this.config = config;
        this.tmux = tmux;
        this.transport = transport;
        this.out = out;
        this.err = err;
    }

    /**
     * Blocks until shutdown completes.
     *
     * @return process exit code
     */
    public int run() throws InterruptedException {
        out.println("Starting SessionCast Agent...");
        out.println("Platform: " + TmuxCapabilities.platformName());
        out.println("Machine ID: " + config.machineId());
        out.println("Relay: " + config.relayUrl());
        out.println("Token: " + (config.authToken() == null ? "none" : "present"));
        if (!tmux.isAvailable()) {
            LOGGER.warn("tmux does not respond to 'tmux -V'; sessions will appear once it does");
        }

        ScheduledEventLoop loop = new ScheduledEventLoop("sessioncast-loop");
        ExecutorService workers = Executors.newFixedThreadPool(WORKER_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "sessioncast-worker");
            thread.setDaemon(true);
            return thread;
        });
        Random random = new SecureRandom();
        AtomicInteger exitCode = new AtomicInteger(SessionOrchestrator.EXIT_OK);
        CountDownLatch done = new CountDownLatch(1);

        ControlChannelClient control = null;
        if (config.control().active()) {
            control = new ControlChannelClient(
                    config,
                    transport,
                    loop,
                    random,
                    tmux,
                    new CommandExecutionService(config.control().exec(), tmux),
                    new LlmService(config.control().llm()),
                    workers
            );
        }
        SessionOrchestrator orchestrator = new SessionOrchestrator(
                config.machineId(),
                tmux,
                loop,
                SessionHandler.factory(config, transport, loop, random, tmux),
                control,
                code -> {
                    exitCode.set(code);
                    done.countDown();
                },
                err
        );

        Thread hook = new Thread(() -> {
            if (orchestrator.isShutdown()) {
                return;
            }
            try {
                loop.call(() -> {
                    orchestrator.shutdown(SessionOrchestrator.EXIT_OK);
                    return null;
                }, SHUTDOWN_TIMEOUT_MS);
            } catch (Exception e) {
                LOGGER.warn("Shutdown did not complete cleanly: {}", e.toString());
            }
        }, "sessioncast-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        loop.execute(orchestrator::start);
        try {
            done.await();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignored) {
                // JVM already shutting down; the hook is running.
            }
            workers.shutdownNow();
            loop.close();
        }
        return exitCode.get();
    }
}

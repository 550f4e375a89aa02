package io.sessioncast.exec;

import io.sessioncast.config.ExecConfig;
import io.sessioncast.tmux.TmuxCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Runs commands requested over the control channel, either as a shell child process bounded by a
 * timeout or by typing them into a tmux session.
 */
public final class CommandExecutionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CommandExecutionService.class);
    static final String DISABLED = "Command execution is disabled on this agent";
    static final String NOT_ALLOWED = "Command not in allowed list";
    static final String SENT_TO_TMUX = "Command sent to tmux session";

    private final ExecConfig config;
    private final CommandPolicy policy;
    private final TmuxCapability tmux;
    private final CommandRunner runner;
    private final LongSupplier clock;

    public CommandExecutionService(ExecConfig config, TmuxCapability tmux) {
        this(config, tmux, new CommandRunner(), System::currentTimeMillis);
    }

    public CommandExecutionService(ExecConfig config, TmuxCapability tmux, CommandRunner runner, LongSupplier clock) {
        this.config = config == null ? ExecConfig.disabled() : config;
        this.policy = new CommandPolicy(this.config.allowedCommands());
        this.tmux = tmux;
        this.runner = runner;
        this.clock = clock;
    }

    /**
     * Never throws; every failure becomes a result with exit code {@code -1}.
     */
    public ExecResult execute(String command, String cwd, Long timeoutMs, String sessionId) {
        long start = clock.getAsLong();
        if (!config.enabled()) {
            return ExecResult.failure(DISABLED, 0L);
        }
        if (command == null || command.isBlank()) {
            return ExecResult.failure("Error: command is required", 0L);
        }
        if (!policy.allows(command)) {
            LOGGER.warn("Rejected command outside the allow list");
            return ExecResult.failure(NOT_ALLOWED, 0L);
        }
        long timeout = timeoutMs == null || timeoutMs <= 0L ? config.defaultTimeout() : timeoutMs;

        if (sessionId != null && !sessionId.isBlank()) {
            return sendToSession(command, sessionId, start);
        }

        String dir = cwd == null || cwd.isBlank() ? config.workingDir() : cwd;
        Path workingDir = dir == null ? null : Paths.get(dir);
        try {
            CommandOutput out = runner.run(List.of(config.shell(), "-c", command), workingDir, timeout);
            long duration = clock.getAsLong() - start;
            if (out.timedOut()) {
                LOGGER.warn("Command timed out after {}ms", timeout);
                return ExecResult.failure("Command timed out after " + timeout + "ms", duration);
            }
            return new ExecResult(out.exitCode(), out.stdout(), out.stderr(), duration);
        } catch (IOException | RuntimeException e) {
            return ExecResult.failure("Execution error: " + e.getMessage(), clock.getAsLong() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecResult.failure("Execution error: interrupted", clock.getAsLong() - start);
        }
    }

    private ExecResult sendToSession(String command, String sessionId, long start) {
        boolean typed = tmux.sendKeys(sessionId, command) && tmux.sendSpecialKey(sessionId, "Enter");
        long duration = clock.getAsLong() - start;
        if (!typed) {
            return ExecResult.failure("Failed to send to tmux", duration);
        }
        return new ExecResult(0, SENT_TO_TMUX, "", duration);
    }
}

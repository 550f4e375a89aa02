package io.sessioncast.tmux;

import io.sessioncast.exec.CommandOutput;
import io.sessioncast.exec.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Linux and macOS: {@code tmux} from {@code PATH}, invoked without a shell.
 */
public final class UnixTmuxExecutor extends AbstractTmuxExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(UnixTmuxExecutor.class);

    private final String tmuxBinary;
    private final CommandRunner runner;

    public UnixTmuxExecutor() {
        this("tmux", new CommandRunner());
    }

    public UnixTmuxExecutor(String tmuxBinary, CommandRunner runner) {
        this.tmuxBinary = tmuxBinary;
        this.runner = runner;
    }

    @Override
    protected Optional<CommandOutput> tmux(List<String> args) {
        List<String> command = new ArrayList<>(args.size() + 1);
        command.add(tmuxBinary);
        command.addAll(args);
        try {
            return Optional.of(runner.run(command, null, COMMAND_TIMEOUT_MS));
        } catch (IOException e) {
            LOGGER.debug("tmux could not be started: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}

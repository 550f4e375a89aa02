package io.sessioncast.tmux;

import io.sessioncast.exec.CommandOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tmux operations expressed as argument vectors; subclasses decide how a vector reaches tmux.
 */
abstract class AbstractTmuxExecutor implements TmuxCapability {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractTmuxExecutor.class);
    static final long COMMAND_TIMEOUT_MS = 5_000L;

    /**
     * Runs {@code tmux args...}; empty when the process could not be started or timed out.
     */
    protected abstract Optional<CommandOutput> tmux(List<String> args);

    protected String workingDirArgument(String workingDir) {
        return workingDir;
    }

    @Override
    public List<String> listSessions() {
        Optional<CommandOutput> out = tmux(List.of("ls", "-F", "#{session_name}"));
        if (out.isEmpty() || !out.get().succeeded()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String line : out.get().stdout().split("\n")) {
            String name = line.strip();
            if (!name.isEmpty() && !name.startsWith("no server")) {
                names.add(name);
            }
        }
        return names;
    }

    @Override
    public List<TmuxSessionInfo> listSessionDetails() {
        Optional<CommandOutput> out = tmux(List.of(
                "list-sessions", "-F",
                "#{session_name}|#{session_windows}|#{session_created}|#{session_attached}"
        ));
        if (out.isEmpty() || !out.get().succeeded()) {
            return List.of();
        }
        return parseSessionDetails(out.get().stdout());
    }

    @Override
    public Optional<String> captureSnapshot(String session) {
        Optional<CommandOutput> out = tmux(List.of("capture-pane", "-t", session, "-p", "-e", "-N"));
        if (out.isEmpty() || !out.get().succeeded()) {
            return Optional.empty();
        }
        return Optional.of(out.get().stdout().replace("\n", "\r\n"));
    }

    @Override
    public boolean sendKeys(String session, String text) {
        return succeeded(tmux(List.of("send-keys", "-t", session, "-l", text)));
    }

    @Override
    public boolean sendSpecialKey(String session, String keyName) {
        return succeeded(tmux(List.of("send-keys", "-t", session, keyName)));
    }

    @Override
    public boolean resize(String session, int cols, int rows) {
        return succeeded(tmux(List.of(
                "resize-window", "-t", session, "-x", Integer.toString(cols), "-y", Integer.toString(rows)
        )));
    }

    @Override
    public boolean create(String session, String workingDir) {
        Optional<String> sanitized = SessionNames.sanitize(session);
        if (sanitized.isEmpty()) {
            return false;
        }
        List<String> args = new ArrayList<>(List.of("new-session", "-d", "-s", sanitized.get()));
        if (workingDir != null && !workingDir.isBlank()) {
            args.add("-c");
            args.add(workingDirArgument(workingDir));
        }
        return succeeded(tmux(args));
    }

    @Override
    public boolean kill(String session) {
        return succeeded(tmux(List.of("kill-session", "-t", session)));
    }

    @Override
    public boolean isAvailable() {
        return version().map(v -> v.contains("tmux")).orElse(false);
    }

    @Override
    public Optional<String> version() {
        Optional<CommandOutput> out = tmux(List.of("-V"));
        if (out.isEmpty() || !out.get().succeeded()) {
            return Optional.empty();
        }
        String version = out.get().stdout().strip();
        return version.isEmpty() ? Optional.empty() : Optional.of(version);
    }

    /**
     * Parses {@code name|windows|created|attached} lines. A missing or non-numeric window count
     * reads as 1.
     */
    static List<TmuxSessionInfo> parseSessionDetails(String raw) {
        List<TmuxSessionInfo> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String line : raw.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("\\|", -1);
            int windows = 1;
            if (parts.length > 1) {
                try {
                    windows = Integer.parseInt(parts[1].trim());
                } catch (NumberFormatException ignored) {
                    windows = 1;
                }
                if (windows == 0) {
                    windows = 1;
                }
            }
            String created = parts.length > 2 && !parts[2].isBlank() ? parts[2].trim() : null;
            boolean attached = parts.length > 3 && "1".equals(parts[3].trim());
            out.add(new TmuxSessionInfo(parts[0], windows, created, attached));
        }
        return out;
    }

    private static boolean succeeded(Optional<CommandOutput> out) {
        if (out.isEmpty()) {
            return false;
        }
        if (!out.get().succeeded()) {
            LOGGER.debug("tmux exited with {}: {}", out.get().exitCode(), out.get().stderr().strip());
            return false;
        }
        return true;
    }
}

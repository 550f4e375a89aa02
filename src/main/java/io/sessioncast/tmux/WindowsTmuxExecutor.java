package io.sessioncast.tmux;

import io.sessioncast.exec.CommandOutput;
import io.sessioncast.exec.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Windows: tmux from an itmux (Cygwin) bundle, driven through its login bash.
 */
public final class WindowsTmuxExecutor extends AbstractTmuxExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowsTmuxExecutor.class);

    private final Path itmuxHome;
    private final Path bash;
    private final CommandRunner runner;

    public WindowsTmuxExecutor(Path itmuxHome) {
        this.itmuxHome = itmuxHome;
        this.bash = bashOf(itmuxHome);
        if (!Files.isRegularFile(bash)) {
            throw new IllegalStateException("itmux bash not found at: " + bash);
        }
        this.runner = new CommandRunner(Map.of(
                "CYGWIN", "nodosfilewarning",
                "HOME", "/home/" + System.getProperty("user.name", "user"),
                "TERM", "xterm-256color"
        ));
        LOGGER.info("[Windows] Using itmux at: {}", itmuxHome);
    }

    @Override
    protected Optional<CommandOutput> tmux(List<String> args) {
        StringBuilder script = new StringBuilder("tmux");
        for (String arg : args) {
            script.append(' ').append(quote(arg));
        }
        try {
            return Optional.of(runner.run(List.of(bash.toString(), "-l", "-c", script.toString()), itmuxHome, COMMAND_TIMEOUT_MS));
        } catch (IOException e) {
            LOGGER.debug("[itmux] Command failed: {}: {}", script, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    protected String workingDirArgument(String workingDir) {
        return windowsToCygwinPath(workingDir);
    }

    static String quote(String arg) {
        return "'" + arg.replace("'", "'\\''") + "'";
    }

    /**
     * {@code C:\work\x} becomes {@code /cygdrive/c/work/x}; UNC paths are kept as they are.
     */
    static String windowsToCygwinPath(String windowsPath) {
        if (windowsPath == null || windowsPath.isEmpty()) {
            return windowsPath;
        }
        if (windowsPath.startsWith("\\\\")) {
            return windowsPath;
        }
        if (windowsPath.length() >= 2 && windowsPath.charAt(1) == ':') {
            char drive = Character.toLowerCase(windowsPath.charAt(0));
            String rest = windowsPath.substring(2).replace('\\', '/');
            return "/cygdrive/" + drive + rest;
        }
        return windowsPath.replace('\\', '/');
    }

    /**
     * {@code ITMUX_HOME} first, then the usual install locations.
     */
    public static Optional<Path> findItmuxPath(Map<String, String> env) {
        List<Path> candidates = new ArrayList<>();
        String home = env.get("ITMUX_HOME");
        if (home != null && !home.isBlank()) {
            candidates.add(Paths.get(home));
        }
        candidates.add(Paths.get(System.getProperty("user.home"), "itmux"));
        candidates.add(Paths.get("C:\\itmux"));
        candidates.add(Paths.get("D:\\itmux"));
        candidates.add(Paths.get(System.getProperty("user.dir"), "itmux"));
        String localAppData = env.get("LOCALAPPDATA");
        if (localAppData != null && !localAppData.isBlank()) {
            candidates.add(Paths.get(localAppData, "itmux"));
        }
        String programFiles = env.get("ProgramFiles");
        if (programFiles != null && !programFiles.isBlank()) {
            candidates.add(Paths.get(programFiles, "itmux"));
        }
        for (Path candidate : candidates) {
            if (Files.isRegularFile(bashOf(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Path bashOf(Path itmuxHome) {
        return itmuxHome.resolve("bin").resolve("bash.exe");
    }
}

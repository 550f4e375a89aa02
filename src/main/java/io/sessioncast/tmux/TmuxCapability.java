package io.sessioncast.tmux;

import java.util.List;
import java.util.Optional;

/**
 * Operations the agent performs against the local terminal multiplexer.
 *
 * <p>Failures are reported through return values: {@code false}, an empty list or
 * {@link Optional#empty()}. Implementations never throw for a session that vanished.
 */
public interface TmuxCapability {
    List<String> listSessions();

    List<TmuxSessionInfo> listSessionDetails();

    /**
     * Visible pane content with escape sequences, lines joined by {@code \r\n}.
     */
    Optional<String> captureSnapshot(String session);

    /**
     * Types {@code text} literally.
     */
    boolean sendKeys(String session, String text);

    /**
     * Sends a tmux key name such as {@code Enter} or {@code C-c}.
     */
    boolean sendSpecialKey(String session, String keyName);

    boolean resize(String session, int cols, int rows);

    boolean create(String session, String workingDir);

    boolean kill(String session);

    boolean isAvailable();

    Optional<String> version();
}

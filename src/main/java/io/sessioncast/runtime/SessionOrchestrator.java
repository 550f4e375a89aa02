package io.sessioncast.runtime;

import io.sessioncast.control.ControlChannelClient;
import io.sessioncast.model.LimitExceededNotice;
import io.sessioncast.tmux.SessionNames;
import io.sessioncast.tmux.TmuxCapability;
import io.sessioncast.util.EventLoop;
import io.sessioncast.util.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntConsumer;

/**
 * Keeps one {@link SessionHandle} per live tmux session.
 *
 * <p>Scans every five seconds with a fixed delay, so a scan never overlaps the previous one. The
 * tracking map is only touched from the event loop.
 */
public final class SessionOrchestrator implements SessionCallbacks {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionOrchestrator.class);
    public static final long SCAN_INTERVAL_MS = 5_000L;
    public static final int EXIT_OK = 0;
    public static final int EXIT_LIMIT_EXCEEDED = 1;

    private final String machineId;
    private final TmuxCapability tmux;
    private final EventLoop loop;
    private final SessionHandleFactory handles;
    private final ControlChannelClient control;
    private final IntConsumer terminator;
    private final PrintStream noticeOut;
    private final Map<String, SessionHandle> tracked = new LinkedHashMap<>();

    private boolean started;
    private volatile boolean shutdown;
    private TimerHandle scanTimer = TimerHandle.NONE;

    /**
     * @param control    {@code null} when the control channel is not configured
     * @param terminator receives the process exit code once shutdown completes
     */
    public SessionOrchestrator(
            String machineId,
            TmuxCapability tmux,
            EventLoop loop,
            SessionHandleFactory handles,
            ControlChannelClient control,
            IntConsumer terminator,
            PrintStream noticeOut
    ) {
        this.machineId = machineId;
        this.tmux = tmux;
        this.loop = loop;
        this.handles = handles;
        this.control = control;
        this.terminator = terminator;
        this.noticeOut = noticeOut;
    }

    public void start() {
        if (started || shutdown) {
            return;
        }
        started = true;
        if (control != null) {
            control.start();
        }
        scan();
        scheduleNextScan();
        LOGGER.info("Agent started with auto-discovery (scanning every {}s)", SCAN_INTERVAL_MS / 1000L);
    }

    /**
     * Reconciles tracked handles with the sessions tmux reports right now.
     */
    public void scan() {
        if (shutdown) {
            return;
        }
        try {
            Set<String> current = new LinkedHashSet<>(tmux.listSessions());
            for (String name : current) {
                if (!tracked.containsKey(name)) {
                    startHandle(name);
                }
            }
            for (String name : new ArrayList<>(tracked.keySet())) {
                if (!current.contains(name)) {
                    LOGGER.info("Tmux session removed: {}", name);
                    stopHandle(name);
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("Error during session scan", e);
        }
    }

    @Override
    public void onCreateSessionRequested(String requestedName) {
        if (shutdown) {
            return;
        }
        Optional<String> sanitized = SessionNames.sanitize(requestedName);
        if (sanitized.isEmpty()) {
            LOGGER.warn("Invalid session name: {}", requestedName);
            return;
        }
        String name = sanitized.get();
        if (tracked.containsKey(name)) {
            LOGGER.warn("Session already exists: {}", name);
            return;
        }
        LOGGER.info("Creating new tmux session: {}", name);
        if (tmux.create(name, null)) {
            LOGGER.info("Successfully created tmux session: {}", name);
            scan();
        } else {
            LOGGER.error("Failed to create tmux session: {}", name);
        }
    }

    @Override
    public void onKillRequested(String sessionName) {
        if (!tmux.kill(sessionName)) {
            LOGGER.warn("tmux kill-session failed for {}", sessionName);
        }
        stopHandle(sessionName);
    }

    @Override
    public void onLimitExceeded(String sessionName, LimitExceededNotice notice) {
        for (String line : notice.renderLines()) {
            noticeOut.println(line);
        }
        noticeOut.flush();
        shutdown(EXIT_LIMIT_EXCEEDED);
    }

    /**
     * Stops scanning, the control channel and every handle, then hands {@code exitCode} to the
     * terminator. Only the first call has any effect.
     */
    public void shutdown(int exitCode) {
        if (shutdown) {
            return;
        }
        shutdown = true;
        LOGGER.info("Shutting down Agent...");
        scanTimer.cancel();
        scanTimer = TimerHandle.NONE;
        if (control != null) {
            control.stop();
        }
        for (SessionHandle handle : tracked.values()) {
            handle.stop();
        }
        tracked.clear();
        LOGGER.info("Agent shutdown complete");
        terminator.accept(exitCode);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public Set<String> trackedSessions() {
        return Set.copyOf(tracked.keySet());
    }

    private void scheduleNextScan() {
        scanTimer = loop.schedule(() -> {
            scan();
            if (!shutdown) {
                scheduleNextScan();
            }
        }, SCAN_INTERVAL_MS);
    }

    private void startHandle(String name) {
        LOGGER.info("Discovered new tmux session: {}", name);
        SessionHandle handle = handles.create(name, this);
        tracked.put(name, handle);
        handle.start();
        LOGGER.info("Started handler for session: {}/{}", machineId, name);
    }

    private void stopHandle(String name) {
        SessionHandle handle = tracked.remove(name);
        if (handle != null) {
            handle.stop();
            LOGGER.info("Stopped handler for session: {}/{}", machineId, name);
        }
    }
}

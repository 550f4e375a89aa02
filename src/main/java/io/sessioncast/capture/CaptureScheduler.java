package io.sessioncast.capture;

import io.sessioncast.model.RelayMessage;
import io.sessioncast.tmux.TmuxCapability;
import io.sessioncast.util.EventLoop;
import io.sessioncast.util.LogThrottle;
import io.sessioncast.util.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pulls pane snapshots for one session and pushes changed ones through its relay link.
 *
 * <p>Polls every 50 ms while the pane changed within the last two seconds, every 200 ms
 * otherwise, and resends an unchanged screen once ten seconds have passed since the last send.
 * Runs on the event loop, so at most one frame per session is produced per tick.
 */
public final class CaptureScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptureScheduler.class);
    static final long NOT_CONNECTED_RETRY_MS = 500L;
    static final long ERROR_RETRY_MS = 500L;
    private static final long ERROR_LOG_INTERVAL_MS = 5_000L;

    private final String sessionName;
    private final String sessionId;
    private final TmuxCapability tmux;
    private final ScreenSink sink;
    private final EventLoop loop;
    private final CaptureState state = new CaptureState();
    private final LogThrottle errorLog;

    private boolean running;
    private TimerHandle timer = TimerHandle.NONE;
    private long framesSent;

    public CaptureScheduler(String sessionName, String sessionId, TmuxCapability tmux, ScreenSink sink, EventLoop loop) {
        this.sessionName = sessionName;
        this.sessionId = sessionId;
        this.tmux = tmux;
        this.sink = sink;
        this.loop = loop;
        this.errorLog = new LogThrottle(ERROR_LOG_INTERVAL_MS, loop::nowMs);
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        LOGGER.info("[{}] Screen capture started", sessionName);
        tick();
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        timer.cancel();
        timer = TimerHandle.NONE;
    }

    public boolean isRunning() {
        return running;
    }

    public long framesSent() {
        return framesSent;
    }

    private void tick() {
        timer = TimerHandle.NONE;
        if (!running) {
            return;
        }
        if (!sink.isConnected()) {
            reschedule(NOT_CONNECTED_RETRY_MS);
            return;
        }
        long delay;
        try {
            delay = captureOnce();
        } catch (RuntimeException e) {
            long count = errorLog.tryAcquire();
            if (count > 0L) {
                LOGGER.error("[{}] Screen capture error ({} occurrence(s)): {}", sessionName, count, e.toString());
            }
            delay = ERROR_RETRY_MS;
        }
        reschedule(delay);
    }

    private long captureOnce() {
        Optional<String> snapshot = tmux.captureSnapshot(sessionName);
        if (snapshot.isEmpty()) {
            return CaptureState.IDLE_INTERVAL_MS;
        }
        String screen = snapshot.get();
        long now = loop.nowMs();
        if (state.shouldSend(screen, now)) {
            state.recordSend(screen, now);
            RelayMessage frame = ScreenFrames.frame(sessionId, screen);
            if (sink.send(frame)) {
                framesSent++;
            }
        }
        return state.nextDelayMs(now);
    }

    private void reschedule(long delayMs) {
        if (running) {
            timer = loop.schedule(this::tick, delayMs);
        }
    }
}

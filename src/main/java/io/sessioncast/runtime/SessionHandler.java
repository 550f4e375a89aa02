package io.sessioncast.runtime;

import io.sessioncast.capture.CaptureScheduler;
import io.sessioncast.capture.ScreenSink;
import io.sessioncast.config.AgentConfig;
import io.sessioncast.model.LimitExceededNotice;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.model.SessionIdentity;
import io.sessioncast.relay.RelayLink;
import io.sessioncast.relay.RelayLinkListener;
import io.sessioncast.relay.RelayTransport;
import io.sessioncast.tmux.TmuxCapability;
import io.sessioncast.tmux.TmuxKeys;
import io.sessioncast.util.EventLoop;
import io.sessioncast.util.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * One tmux session mirrored to the relay: a {@link RelayLink} plus its {@link CaptureScheduler}.
 *
 * <p>The link is opened after a random startup delay of up to five seconds. Capture runs while
 * the link is connected.
 */
public final class SessionHandler implements SessionHandle, RelayLinkListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionHandler.class);
    static final int START_JITTER_MS = 5_000;

    private final SessionIdentity identity;
    private final AgentConfig config;
    private final RelayTransport transport;
    private final EventLoop loop;
    private final Random random;
    private final TmuxCapability tmux;
    private final SessionCallbacks callbacks;

    private boolean running;
    private TimerHandle startTimer = TimerHandle.NONE;
    private RelayLink link;
    private CaptureScheduler capture;

    public SessionHandler(
            SessionIdentity identity,
            AgentConfig config,
            RelayTransport transport,
            EventLoop loop,
            Random random,
            TmuxCapability tmux,
            SessionCallbacks callbacks
    ) {
        this.identity = identity;
        this.config = config;
        this.transport = transport;
        this.loop = loop;
        this.random = random;
        this.tmux = tmux;
        this.callbacks = callbacks;
    }

    public static SessionHandleFactory factory(
            AgentConfig config,
            RelayTransport transport,
            EventLoop loop,
            Random random,
            TmuxCapability tmux
    ) {
        return (name, callbacks) -> new SessionHandler(
                new SessionIdentity(config.machineId(), name), config, transport, loop, random, tmux, callbacks
        );
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        int jitter = random.nextInt(START_JITTER_MS);
        LOGGER.info("[{}] Starting in {}ms", name(), jitter);
        startTimer = loop.schedule(this::connectAndRun, jitter);
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        LOGGER.info("[{}] Stopping", name());
        running = false;
        startTimer.cancel();
        startTimer = TimerHandle.NONE;
        if (capture != null) {
            capture.stop();
        }
        if (link != null) {
            link.destroy();
        }
    }

    public String sessionId() {
        return identity.sessionId();
    }

    public String name() {
        return identity.localSessionName();
    }

    RelayLink link() {
        return link;
    }

    CaptureScheduler capture() {
        return capture;
    }

    private void connectAndRun() {
        startTimer = TimerHandle.NONE;
        if (!running) {
            return;
        }
        link = new RelayLink(config.relayUri(), transport, loop, random, identity, name(), config.authToken(), this);
        RelayLink current = link;
        capture = new CaptureScheduler(name(), identity.sessionId(), tmux, new ScreenSink() {
            @Override
            public boolean isConnected() {
                return current.isConnected();
            }

            @Override
            public boolean send(RelayMessage message) {
                return current.send(message);
            }
        }, loop);
        link.connect();
    }

    @Override
    public void onConnected() {
        if (running) {
            capture.start();
        }
    }

    @Override
    public void onDisconnected(int code, String reason) {
        capture.stop();
    }

    @Override
    public void onKeys(String keys) {
        TmuxKeys.deliver(tmux, name(), keys, false);
    }

    @Override
    public void onResize(int cols, int rows) {
        LOGGER.info("[{}] Resize: {}x{}", name(), cols, rows);
        tmux.resize(name(), cols, rows);
    }

    @Override
    public void onCreateSessionRequested(String sessionName) {
        LOGGER.info("[{}] Create session request: {}", name(), sessionName);
        callbacks.onCreateSessionRequested(sessionName);
    }

    @Override
    public void onKillSessionRequested() {
        LOGGER.info("[{}] Kill session request", name());
        callbacks.onKillRequested(name());
    }

    @Override
    public void onTransportError(Throwable error) {
        LOGGER.warn("[{}] WebSocket error: {}", name(), error.getMessage());
    }

    @Override
    public void onLimitExceeded(LimitExceededNotice notice) {
        stop();
        callbacks.onLimitExceeded(name(), notice);
    }
}

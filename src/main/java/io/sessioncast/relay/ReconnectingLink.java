package io.sessioncast.relay;

import io.sessioncast.model.RelayMessage;
import io.sessioncast.util.EventLoop;
import io.sessioncast.util.TimerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Random;

/**
 * One persistent relay socket with registration on open and circuit-breaker-gated reconnection.
 *
 * <p>Confined to the {@link EventLoop}: socket callbacks are re-posted to the loop and tagged with
 * a connection generation so events from a replaced or destroyed socket are ignored. Subclasses
 * provide the registration message and inbound dispatch.
 */
public abstract class ReconnectingLink {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectingLink.class);

    private final URI relayUri;
    private final RelayTransport transport;
    private final EventLoop loop;
    private final Random random;
    private final String logPrefix;
    private final LinkState state = new LinkState();

    private RelayConnection connection;
    private boolean connecting;
    private boolean autoReconnect = true;
    private long generation;
    private TimerHandle reconnectTimer = TimerHandle.NONE;

    protected ReconnectingLink(URI relayUri, RelayTransport transport, EventLoop loop, Random random, String logPrefix) {
        this.relayUri = relayUri;
        this.transport = transport;
        this.loop = loop;
        this.random = random;
        this.logPrefix = logPrefix;
    }

    /**
     * Opens the socket. No-op once destroyed or while a socket is connecting or open.
     */
    public final void connect() {
        if (state.destroyed() || connecting || state.connected()) {
            return;
        }
        connecting = true;
        long gen = ++generation;
        try {
            transport.open(relayUri, new GenerationListener(gen));
        } catch (RuntimeException e) {
            // Transport refused synchronously; treat like an async connect failure.
            loop.execute(() -> {
                handleTransportError(gen, e);
                handleClosed(gen, JdkWebSocketTransport.ABNORMAL_CLOSURE, String.valueOf(e.getMessage()));
            });
        }
    }

    /**
     * @return {@code false} without error when the socket is not open
     */
    public final boolean send(RelayMessage message) {
        RelayConnection current = connection;
        if (current == null || !current.isOpen()) {
            return false;
        }
        try {
            return current.sendText(RelayCodec.encode(message));
        } catch (RuntimeException e) {
            LOGGER.debug("{} send failed: {}", logPrefix, e.getMessage());
            return false;
        }
    }

    /**
     * Closes the socket, cancels pending timers and forbids any further reconnection. Idempotent.
     */
    public final void destroy() {
        if (state.destroyed()) {
            return;
        }
        state.markDestroyed();
        autoReconnect = false;
        generation++;
        connecting = false;
        reconnectTimer.cancel();
        reconnectTimer = TimerHandle.NONE;
        RelayConnection current = connection;
        connection = null;
        if (current != null) {
            current.close();
        }
    }

    public final boolean isConnected() {
        return state.connected();
    }

    public final boolean isDestroyed() {
        return state.destroyed();
    }

    public final int reconnectAttempts() {
        return state.reconnectAttempts();
    }

    public final boolean isCircuitOpen() {
        return state.circuitOpen();
    }

    protected final void disableReconnect() {
        autoReconnect = false;
    }

    protected final EventLoop loop() {
        return loop;
    }

    protected final Random random() {
        return random;
    }

    protected final String logPrefix() {
        return logPrefix;
    }

    protected abstract RelayMessage registrationMessage();

    protected abstract void handleMessage(RelayMessage message);

    protected void onConnected() {
    }

    protected void onDisconnected(int code, String reason) {
    }

    protected void onProtocolError(RelayProtocolException error) {
    }

    protected void onTransportError(Throwable error) {
    }

    private void handleOpen(long gen, RelayConnection opened) {
        if (gen != generation || state.destroyed()) {
            opened.close();
            return;
        }
        connecting = false;
        connection = opened;
        state.markConnected();
        reconnectTimer.cancel();
        reconnectTimer = TimerHandle.NONE;
        send(registrationMessage());
        onConnected();
    }

    private void handleFrame(long gen, String frame) {
        if (gen != generation || state.destroyed()) {
            return;
        }
        RelayMessage message;
        try {
            message = RelayCodec.decode(frame);
        } catch (RelayProtocolException e) {
            LOGGER.warn("{} Failed to parse message: {}", logPrefix, e.getMessage());
            onProtocolError(e);
            return;
        }
        handleMessage(message);
    }

    private void handleClosed(long gen, int code, String reason) {
        if (gen != generation) {
            return;
        }
        connection = null;
        connecting = false;
        state.markDisconnected();
        onDisconnected(code, reason);
        if (autoReconnect && !state.destroyed()) {
            scheduleReconnect();
        }
    }

    private void handleTransportError(long gen, Throwable error) {
        if (gen != generation || state.destroyed()) {
            return;
        }
        LOGGER.debug("{} WebSocket error: {}", logPrefix, error.getMessage());
        onTransportError(error);
    }

    private void scheduleReconnect() {
        if (state.destroyed()) {
            return;
        }
        ReconnectDecision decision = state.nextReconnect(loop.nowMs(), random.nextDouble());
        switch (decision.kind()) {
            case ATTEMPT -> {
                LOGGER.info("{} Reconnecting in {}ms (attempt {}/{})",
                        logPrefix, decision.delayMs(), decision.attempt(), ReconnectPolicy.MAX_RECONNECT_ATTEMPTS);
                reconnectTimer = loop.schedule(() -> {
                    reconnectTimer = TimerHandle.NONE;
                    if (!state.connected() && !state.destroyed()) {
                        connect();
                    }
                }, decision.delayMs());
            }
            case CIRCUIT_OPENED -> {
                LOGGER.error("{} Max reconnect attempts ({}) reached. Circuit breaker active for {} seconds",
                        logPrefix, ReconnectPolicy.MAX_RECONNECT_ATTEMPTS, decision.delayMs() / 1000L);
                reconnectTimer = loop.schedule(this::scheduleReconnect, decision.delayMs());
            }
            case CIRCUIT_WAIT -> {
                LOGGER.info("{} Circuit breaker open. Retry in {} seconds",
                        logPrefix, (decision.delayMs() + 999L) / 1000L);
                reconnectTimer = loop.schedule(this::scheduleReconnect, decision.delayMs());
            }
            case NONE -> {
            }
        }
    }

    private final class GenerationListener implements TransportListener {
        private final long gen;

        private GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onOpen(RelayConnection opened) {
            loop.execute(() -> handleOpen(gen, opened));
        }

        @Override
        public void onText(String frame) {
            loop.execute(() -> handleFrame(gen, frame));
        }

        @Override
        public void onClosed(int code, String reason) {
            loop.execute(() -> handleClosed(gen, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> handleTransportError(gen, error));
        }
    }
}

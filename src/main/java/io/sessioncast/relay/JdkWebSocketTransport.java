package io.sessioncast.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relay transport on top of the JDK {@link HttpClient} WebSocket support.
 */
public final class JdkWebSocketTransport implements RelayTransport {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdkWebSocketTransport.class);
    static final int ABNORMAL_CLOSURE = 1006;

    private final HttpClient http;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), connectTimeout);
    }

    public JdkWebSocketTransport(HttpClient http, Duration connectTimeout) {
        this.http = http;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void open(URI uri, TransportListener listener) {
        FrameListener frames = new FrameListener(listener);
        CompletableFuture<WebSocket> attempt;
        try {
            attempt = http.newWebSocketBuilder()
                    .connectTimeout(connectTimeout)
                    .buildAsync(uri, frames);
        } catch (RuntimeException e) {
            frames.fail(e);
            return;
        }
        attempt.whenComplete((webSocket, error) -> {
            if (error != null) {
                frames.fail(unwrap(error));
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class FrameListener implements WebSocket.Listener {
        private final TransportListener listener;
        private final StringBuilder partial = new StringBuilder();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private JdkConnection connection;

        private FrameListener(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            connection = new JdkConnection(webSocket);
            listener.onOpen(connection);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String frame = partial.toString();
                partial.setLength(0);
                listener.onText(frame);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            // The relay speaks text frames only.
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            if (connection != null) {
                connection.markClosed();
            }
            if (closed.compareAndSet(false, true)) {
                listener.onClosed(statusCode, reason == null ? "" : reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            fail(error);
        }

        private void fail(Throwable error) {
            if (connection != null) {
                connection.markClosed();
            }
            listener.onError(error);
            if (closed.compareAndSet(false, true)) {
                String reason = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
                listener.onClosed(ABNORMAL_CLOSURE, reason);
            }
        }
    }

    private static final class JdkConnection implements RelayConnection {
        private final WebSocket webSocket;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);

        private JdkConnection(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public boolean isOpen() {
            return open.get() && !webSocket.isOutputClosed();
        }

        @Override
        public synchronized boolean sendText(String frame) {
            if (!isOpen()) {
                return false;
            }
            // WebSocket allows a single outstanding send, so writes are chained.
            tail = tail.handle((ignored, error) -> null)
                    .thenCompose(ignored -> webSocket.sendText(frame, true))
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            LOGGER.debug("Relay frame write failed: {}", error.getMessage());
                        }
                    });
            return true;
        }

        @Override
        public void close() {
            if (!open.compareAndSet(true, false)) {
                return;
            }
            synchronized (this) {
                tail = tail.handle((ignored, error) -> null)
                        .thenCompose(ignored -> webSocket.sendClose(WebSocket.NORMAL_CLOSURE, ""))
                        .whenComplete((ignored, error) -> {
                            if (error != null) {
                                webSocket.abort();
                            }
                        });
            }
        }

        private void markClosed() {
            open.set(false);
        }
    }
}

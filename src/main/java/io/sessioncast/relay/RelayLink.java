package io.sessioncast.relay;

import io.sessioncast.model.LimitExceededNotice;
import io.sessioncast.model.MessageTypes;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.model.SessionIdentity;
import io.sessioncast.util.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Relay link bound to one local tmux session.
 */
public final class RelayLink extends ReconnectingLink {
    private static final Logger LOGGER = LoggerFactory.getLogger(RelayLink.class);

    private final SessionIdentity identity;
    private final String label;
    private final String token;
    private final RelayLinkListener listener;

    public RelayLink(
            URI relayUri,
            RelayTransport transport,
            EventLoop loop,
            Random random,
            SessionIdentity identity,
            String label,
            String token,
            RelayLinkListener listener
    ) {
        super(relayUri, transport, loop, random, "[" + identity.localSessionName() + "]");
        this.identity = identity;
        this.label = label == null || label.isBlank() ? identity.localSessionName() : label;
        this.token = token;
        this.listener = listener;
    }

    public String sessionId() {
        return identity.sessionId();
    }

    public SessionIdentity identity() {
        return identity;
    }

    @Override
    protected RelayMessage registrationMessage() {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("label", label);
        meta.put("machineId", identity.machineId());
        if (token != null && !token.isEmpty()) {
            meta.put("token", token);
        }
        return new RelayMessage(MessageTypes.REGISTER, MessageTypes.ROLE_HOST, identity.sessionId(), null, meta);
    }

    @Override
    protected void onConnected() {
        LOGGER.info("{} Connected to relay", logPrefix());
        listener.onConnected();
    }

    @Override
    protected void onDisconnected(int code, String reason) {
        LOGGER.info("{} Disconnected: code={}, reason={}", logPrefix(), code, reason);
        listener.onDisconnected(code, reason);
    }

    @Override
    protected void onProtocolError(RelayProtocolException error) {
        listener.onProtocolError(error);
    }

    @Override
    protected void onTransportError(Throwable error) {
        listener.onTransportError(error);
    }

    @Override
    protected void handleMessage(RelayMessage message) {
        String sessionId = identity.sessionId();
        switch (message.type()) {
            case MessageTypes.KEYS -> {
                if (message.isAddressedTo(sessionId) && message.payload() != null && !message.payload().isEmpty()) {
                    listener.onKeys(message.payload());
                }
            }
            case MessageTypes.RESIZE -> {
                if (!message.isAddressedTo(sessionId)) {
                    return;
                }
                Integer cols = parseDimension(message.metaValue("cols"));
                Integer rows = parseDimension(message.metaValue("rows"));
                if (cols != null && rows != null) {
                    listener.onResize(cols, rows);
                }
            }
            case MessageTypes.CREATE_SESSION -> {
                String requested = message.metaValue("sessionName");
                if (requested != null && !requested.isEmpty()) {
                    listener.onCreateSessionRequested(requested);
                }
            }
            case MessageTypes.KILL_SESSION -> {
                if (message.isAddressedTo(sessionId)) {
                    LOGGER.info("{} Kill requested by relay", logPrefix());
                    listener.onKillSessionRequested();
                    destroy();
                }
            }
            case MessageTypes.ERROR -> handleError(message);
            default -> listener.onMessage(message);
        }
    }

    private void handleError(RelayMessage message) {
        String code = message.metaValue("code");
        if (MessageTypes.ERROR_LIMIT_EXCEEDED.equals(code)) {
            LimitExceededNotice notice = LimitExceededNotice.fromMeta(message.meta());
            LOGGER.error("{} Session limit exceeded: resource={}, current={}, max={}",
                    logPrefix(), notice.resource(), notice.current(), notice.max());
            disableReconnect();
            destroy();
            listener.onLimitExceeded(notice);
            return;
        }
        LOGGER.warn("{} Relay error: code={}, message={}", logPrefix(), code, message.metaValue("message"));
    }

    /**
     * Whole-string decimal parse; {@code null} for anything else.
     */
    static Integer parseDimension(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package io.sessioncast.runtime;

import io.sessioncast.config.AgentConfig;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.relay.RelayCodec;
import io.sessioncast.relay.RelayConnection;
import io.sessioncast.relay.RelayTransport;
import io.sessioncast.relay.TransportListener;
import io.sessioncast.tmux.FakeTmux;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentDaemonTest {
    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void limitExceededShouldEndRunWithExitCodeOne() throws Exception {
        List<String> sent = new CopyOnWriteArrayList<>();
        RelayTransport rejecting = (URI uri, TransportListener listener) -> {
            listener.onOpen(new RelayConnection() {
                private volatile boolean open = true;

                @Override
                public boolean isOpen() {
                    return open;
                }

                @Override
                public boolean sendText(String frame) {
                    sent.add(frame);
                    return open;
                }

                @Override
                public void close() {
                    open = false;
                }
            });
            listener.onText(RelayCodec.encode(new RelayMessage("error", null, "m1/dev", null, Map.of(
                    "code", "LIMIT_EXCEEDED",
                    "resource", "sessions",
                    "current", "1",
                    "max", "1",
                    "messageEn", "Upgrade your plan",
                    "upgradeUrl", "https://sessioncast.io/pricing"
            ))));
        };
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        AgentDaemon daemon = new AgentDaemon(
                new AgentConfig("m1", "ws://relay.test/ws", null, null),
                new FakeTmux().withSessions("dev"),
                rejecting,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8)
        );

        int code = daemon.run();

        assertEquals(SessionOrchestrator.EXIT_LIMIT_EXCEEDED, code);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Machine ID: m1"));
        String notice = err.toString(StandardCharsets.UTF_8);
        assertTrue(notice.contains("SESSION LIMIT EXCEEDED"));
        assertTrue(notice.contains("Current: 1, Max: 1"));
        assertTrue(sent.get(0).contains("\"type\":\"register\""));
    }
}

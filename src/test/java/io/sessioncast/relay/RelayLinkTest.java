package io.sessioncast.relay;

import io.sessioncast.model.LimitExceededNotice;
import io.sessioncast.model.RelayMessage;
import io.sessioncast.model.SessionIdentity;
import io.sessioncast.util.ManualEventLoop;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayLinkTest {
    private static final URI RELAY = URI.create("ws://relay.test/ws");
    private static final String SESSION_ID = "m1/dev";

    private final ManualEventLoop loop = new ManualEventLoop();
    private final FakeTransport transport = new FakeTransport();
    private final RecordingListener events = new RecordingListener();
    private final RelayLink link = new RelayLink(
            RELAY, transport, loop, noJitter(), new SessionIdentity("m1", "dev"), "dev", "tok-1", events
    );

    @Test
    void openShouldRegisterBeforeReportingConnected() {
        connect();

        List<RelayMessage> sent = transport.last().sentMessages();
        assertEquals(1, sent.size());
        RelayMessage register = sent.get(0);
        assertEquals("register", register.type());
        assertEquals("host", register.role());
        assertEquals(SESSION_ID, register.session());
        assertEquals(Map.of("label", "dev", "machineId", "m1", "token", "tok-1"), register.meta());
        assertEquals(List.of("connected"), events.log);
        assertTrue(link.isConnected());
    }

    @Test
    void registrationShouldOmitMissingToken() {
        RelayLink anonymous = new RelayLink(
                RELAY, transport, loop, noJitter(), new SessionIdentity("m1", "dev"), "dev", null, events
        );
        anonymous.connect();
        transport.last().accept();
        loop.runPending();

        RelayMessage register = transport.last().sentMessages().get(0);
        assertFalse(register.meta().containsKey("token"));
    }

    @Test
    void connectShouldBeNoOpWhileConnectingOrConnected() {
        link.connect();
        link.connect();
        assertEquals(1, transport.attempts().size());

        transport.last().accept();
        loop.runPending();
        link.connect();
        assertEquals(1, transport.attempts().size());
    }

    @Test
    void keysShouldOnlyBeEmittedForThisSession() {
        connect();
        deliver(RelayMessage.of("keys", "m1/other", "rm -rf /"));
        deliver(RelayMessage.of("keys", null, "ls"));
        deliver(RelayMessage.of("keys", SESSION_ID, ""));
        deliver(RelayMessage.of("keys", SESSION_ID, "ls\n"));

        assertEquals(List.of("connected", "keys:ls\n"), events.log);
    }

    @Test
    void resizeWithNonNumericDimensionShouldBeIgnored() {
        connect();
        deliver(resize("abc", "24"));
        deliver(resize("80", "2x"));
        deliver(resize(null, "24"));
        deliver(resize("120", "40"));

        assertEquals(List.of("connected", "resize:120x40"), events.log);
    }

    @Test
    void createSessionShouldEmitRequestedName() {
        connect();
        deliver(new RelayMessage("createSession", null, SESSION_ID, null, Map.of("sessionName", "build")));
        deliver(new RelayMessage("createSession", null, SESSION_ID, null, Map.of()));

        assertEquals(List.of("connected", "create:build"), events.log);
    }

    @Test
    void killSessionShouldDestroyLinkAndStopSending() {
        connect();
        FakeTransport.Attempt socket = transport.last();
        deliver(new RelayMessage("killSession", null, SESSION_ID, null, null));

        assertEquals(List.of("connected", "kill"), events.log);
        assertTrue(link.isDestroyed());
        assertTrue(socket.closedByClient());
        assertFalse(link.send(RelayMessage.of("screen", SESSION_ID, "AA==")));
        int framesBefore = socket.sent().size();

        socket.dropFromServer(1000, "bye");
        loop.advance(300_000L);
        assertEquals(1, transport.attempts().size());
        assertEquals(framesBefore, socket.sent().size());
    }

    @Test
    void killSessionForAnotherSessionShouldBeIgnored() {
        connect();
        deliver(new RelayMessage("killSession", null, "m1/other", null, null));

        assertFalse(link.isDestroyed());
        assertEquals(List.of("connected"), events.log);
    }

    @Test
    void limitExceededShouldDestroyWithoutReconnecting() {
        connect();
        deliver(new RelayMessage("error", null, SESSION_ID, null, Map.of(
                "code", "LIMIT_EXCEEDED",
                "resource", "sessions",
                "current", "3",
                "max", "3",
                "messageEn", "Session limit reached",
                "messageKo", "세션 한도 초과",
                "upgradeUrl", "https://sessioncast.io/pricing"
        )));

        assertTrue(link.isDestroyed());
        assertNotNull(events.notice);
        assertEquals("sessions", events.notice.resource());
        assertEquals("세션 한도 초과", events.notice.messageKo());
        List<String> lines = events.notice.renderLines();
        assertTrue(lines.contains("Current: 3, Max: 3"));
        assertTrue(lines.contains("Upgrade at: https://sessioncast.io/pricing"));

        loop.advance(600_000L);
        assertEquals(1, transport.attempts().size());
    }

    @Test
    void otherErrorsShouldNotTearDownLink() {
        connect();
        deliver(new RelayMessage("error", null, SESSION_ID, null, Map.of("code", "BAD_REQUEST")));

        assertTrue(link.isConnected());
        assertFalse(link.isDestroyed());
    }

    @Test
    void malformedFrameShouldBeDroppedAndReported() {
        connect();
        transport.last().receive("{oops");
        loop.runPending();
        deliver(RelayMessage.of("keys", SESSION_ID, "x"));

        assertEquals(List.of("connected", "protocolError", "keys:x"), events.log);
        assertTrue(link.isConnected());
    }

    @Test
    void unknownTypesShouldBeForwarded() {
        connect();
        deliver(RelayMessage.of("viewerJoined", SESSION_ID, null));
        assertEquals(List.of("connected", "message:viewerJoined"), events.log);
    }

    @Test
    void consecutiveFailuresShouldBackOffThenTripCircuit() {
        link.connect();
        transport.last().refuse();
        loop.runPending();
        assertEquals(1, link.reconnectAttempts());

        long[] expected = {2_000L, 4_000L, 8_000L, 16_000L, 32_000L};
        for (int i = 0; i < expected.length; i++) {
            int attemptsBefore = transport.attempts().size();
            loop.advance(expected[i] - 1L);
            assertEquals(attemptsBefore, transport.attempts().size(), "fired early on attempt " + (i + 1));
            loop.advance(1L);
            assertEquals(attemptsBefore + 1, transport.attempts().size(), "did not fire on attempt " + (i + 1));
            transport.last().refuse();
            loop.runPending();
        }

        assertTrue(link.isCircuitOpen());
        assertEquals(0, link.reconnectAttempts());
        int attemptsAtTrip = transport.attempts().size();
        loop.advance(120_000L - 1L);
        assertEquals(attemptsAtTrip, transport.attempts().size());
        loop.advance(1L);
        assertFalse(link.isCircuitOpen());
        assertEquals(1, link.reconnectAttempts());
        loop.advance(2_000L);
        assertEquals(attemptsAtTrip + 1, transport.attempts().size());
    }

    @Test
    void reconnectAfterDropShouldResetAttempts() {
        connect();
        transport.last().dropFromServer(1006, "network");
        loop.runPending();
        assertEquals(List.of("connected", "disconnected:1006"), events.log);
        assertEquals(1, link.reconnectAttempts());

        loop.advance(2_000L);
        assertEquals(2, transport.attempts().size());
        transport.last().accept();
        loop.runPending();

        assertTrue(link.isConnected());
        assertEquals(0, link.reconnectAttempts());
        assertEquals("register", transport.last().sentMessages().get(0).type());
    }

    @Test
    void destroyShouldCancelPendingReconnect() {
        link.connect();
        transport.last().refuse();
        loop.runPending();

        link.destroy();
        link.destroy();
        loop.advance(60_000L);

        assertEquals(1, transport.attempts().size());
        assertEquals(0, loop.pendingTasks());
    }

    @Test
    void eventsFromReplacedSocketShouldBeIgnored() {
        link.connect();
        FakeTransport.Attempt first = transport.last();
        link.destroy();
        first.accept();
        loop.runPending();

        assertTrue(first.closedByClient());
        assertFalse(link.isConnected());
        assertTrue(events.log.isEmpty());
    }

    private void connect() {
        link.connect();
        transport.last().accept();
        loop.runPending();
    }

    private void deliver(RelayMessage message) {
        transport.last().receive(message);
        loop.runPending();
    }

    private static RelayMessage resize(String cols, String rows) {
        Map<String, String> meta = new HashMap<>();
        meta.put("cols", cols);
        meta.put("rows", rows);
        return new RelayMessage("resize", null, SESSION_ID, null, meta);
    }

    static Random noJitter() {
        return new Random(7L) {
            @Override
            public double nextDouble() {
                return 0d;
            }
        };
    }

    private static final class RecordingListener implements RelayLinkListener {
        private final List<String> log = new ArrayList<>();
        private LimitExceededNotice notice;

        @Override
        public void onConnected() {
            log.add("connected");
        }

        @Override
        public void onDisconnected(int code, String reason) {
            log.add("disconnected:" + code);
        }

        @Override
        public void onKeys(String keys) {
            log.add("keys:" + keys);
        }

        @Override
        public void onResize(int cols, int rows) {
            log.add("resize:" + cols + "x" + rows);
        }

        @Override
        public void onCreateSessionRequested(String sessionName) {
            log.add("create:" + sessionName);
        }

        @Override
        public void onKillSessionRequested() {
            log.add("kill");
        }

        @Override
        public void onProtocolError(RelayProtocolException error) {
            log.add("protocolError");
        }

        @Override
        public void onLimitExceeded(LimitExceededNotice notice) {
            this.notice = notice;
            log.add("limitExceeded");
        }

        @Override
        public void onMessage(RelayMessage message) {
            log.add("message:" + message.type());
        }
    }
}

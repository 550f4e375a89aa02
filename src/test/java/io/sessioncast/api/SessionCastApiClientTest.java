package io.sessioncast.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sessioncast.config.CredentialStore;
import io.sessioncast.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCastApiClientTest {
    private static final String AGENTS = """
            {"agents":[
              {"id":"a1b2c3d4e5f6","label":"Laptop","machineId":"mbp","isActive":true,"apiEnabled":true,
               "lastConnectedAt":"2026-01-01T00:00:00Z","createdAt":"2025-12-01T00:00:00Z"},
              {"id":"ffff0000aaaa","label":null,"machineId":"build-box","isActive":false,"apiEnabled":false}
            ]}
            """;

    private HttpServer server;
    private CredentialStore credentials;
    private final Map<String, String> seenAuth = new ConcurrentHashMap<>();
    private final Map<String, String> seenBodies = new ConcurrentHashMap<>();

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/agents", exchange -> {
            String path = exchange.getRequestURI().getPath();
            seenAuth.put(path, String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            seenBodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            switch (path) {
                case "/api/v1/agents" -> respond(exchange, 200, AGENTS);
                case "/api/v1/agents/a1b2c3d4e5f6" -> respond(exchange, 200,
                        "{\"id\":\"a1b2c3d4e5f6\",\"label\":\"Laptop\",\"isActive\":true}");
                case "/api/v1/agents/a1b2c3d4e5f6/sessions" -> respond(exchange, 200,
                        "{\"sessions\":[{\"name\":\"dev\",\"windows\":2,\"created\":\"1700000000\",\"attached\":true}]}");
                case "/api/v1/agents/a1b2c3d4e5f6/send-keys" -> respond(exchange, 200,
                        "{\"success\":true,\"agentId\":\"a1b2c3d4e5f6\",\"target\":\"dev\"}");
                case "/api/v1/agents/ffff0000aaaa/send-keys" -> respond(exchange, 503,
                        "{\"message\":\"Agent is offline\"}");
                case "/api/v1/agents/ffff0000aaaa/sessions" -> respond(exchange, 500, "oops");
                default -> respond(exchange, 404, "{}");
            }
        });
        server.start();
        credentials = new CredentialStore(Files.createTempDirectory("sessioncast-api-test-").resolve("cli-config.json"));
        credentials.setApiUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/");
        credentials.setApiKey("sk_test_0123456789");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void listAgentsShouldSendBearerAndParseFlags() {
        List<AgentSummary> agents = new SessionCastApiClient(credentials).listAgents();

        assertEquals(2, agents.size());
        AgentSummary first = agents.get(0);
        assertEquals("Laptop", first.displayName());
        assertTrue(first.isActive());
        assertTrue(first.apiEnabled());
        assertEquals("a1b2c3d4", first.shortId());
        assertEquals("build-box", agents.get(1).displayName());
        assertFalse(agents.get(1).isActive());
        assertEquals("Bearer sk_test_0123456789", seenAuth.get("/api/v1/agents"));
    }

    @Test
    void findAgentByNameShouldMatchLabelMachineOrExactId() {
        SessionCastApiClient client = new SessionCastApiClient(credentials);

        assertEquals("a1b2c3d4e5f6", client.findAgentByName("laptop").orElseThrow().id());
        assertEquals("ffff0000aaaa", client.findAgentByName("BUILD-BOX").orElseThrow().id());
        assertEquals("ffff0000aaaa", client.findAgentByName("ffff0000aaaa").orElseThrow().id());
        assertTrue(client.findAgentByName("ffff").isEmpty());
    }

    @Test
    void getAgentShouldReportMissingAgent() {
        SessionCastApiClient client = new SessionCastApiClient(credentials);

        assertEquals("Laptop", client.getAgent("a1b2c3d4e5f6").label());
        ApiException error = assertThrows(ApiException.class, () -> client.getAgent("nope"));
        assertEquals("Agent not found", error.getMessage());
        assertEquals(404, error.status());
    }

    @Test
    void listSessionsShouldParseSessionRows() {
        List<RemoteSession> sessions = new SessionCastApiClient(credentials).listSessions("a1b2c3d4e5f6");

        assertEquals(1, sessions.size());
        assertEquals("dev", sessions.get(0).name());
        assertEquals(2, sessions.get(0).windows());
        assertTrue(sessions.get(0).attached());
    }

    @Test
    void sendKeysShouldPostPayload() throws Exception {
        SendKeysResult result = new SessionCastApiClient(credentials).sendKeys("a1b2c3d4e5f6", "dev", "ls -la", false);

        assertTrue(result.success());
        JsonNode body = Jsons.mapper().readTree(seenBodies.get("/api/v1/agents/a1b2c3d4e5f6/send-keys"));
        assertEquals("dev", body.get("target").asText());
        assertEquals("ls -la", body.get("keys").asText());
        assertFalse(body.get("enter").asBoolean());
    }

    @Test
    void errorsShouldUseServerMessageOrFallback() {
        SessionCastApiClient client = new SessionCastApiClient(credentials);

        ApiException offline = assertThrows(ApiException.class,
                () -> client.sendKeys("ffff0000aaaa", "dev", "ls", true));
        assertEquals("Agent is offline", offline.getMessage());
        assertEquals(503, offline.status());

        ApiException broken = assertThrows(ApiException.class, () -> client.listSessions("ffff0000aaaa"));
        assertEquals("Failed to list sessions", broken.getMessage());
    }

    @Test
    void loggedOutClientShouldRefuseToCall() {
        credentials.clearApiKey();

        ApiException error = assertThrows(ApiException.class, () -> new SessionCastApiClient(credentials).listAgents());
        assertEquals("Not logged in. Run: sessioncast login", error.getMessage());
        assertTrue(seenAuth.isEmpty());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}

package io.sessioncast.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.sessioncast.config.CredentialStore;
import io.sessioncast.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bearer-authenticated client for the SessionCast REST API used by the interactive commands.
 */
public final class SessionCastApiClient {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final TypeReference<List<AgentSummary>> AGENT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<RemoteSession>> SESSION_LIST = new TypeReference<>() {
    };

    private final CredentialStore credentials;
    private final HttpClient http;

    public SessionCastApiClient(CredentialStore credentials) {
        this(credentials, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public SessionCastApiClient(CredentialStore credentials, HttpClient http) {
        this.credentials = credentials;
        this.http = http;
    }

    public List<AgentSummary> listAgents() {
        JsonNode body = get("/api/v1/agents", "Failed to list agents");
        return convert(body.path("agents"), AGENT_LIST);
    }

    public AgentSummary getAgent(String agentId) {
        HttpResponse<String> response = send(request("/api/v1/agents/" + encode(agentId)).GET().build());
        if (!ok(response)) {
            throw new ApiException("Agent not found", response.statusCode(), null);
        }
        return convert(parse(response.body()), new TypeReference<AgentSummary>() {
        });
    }

    public List<RemoteSession> listSessions(String agentId) {
        JsonNode body = get("/api/v1/agents/" + encode(agentId) + "/sessions", "Failed to list sessions");
        return convert(body.path("sessions"), SESSION_LIST);
    }

    public SendKeysResult sendKeys(String agentId, String target, String keys, boolean enter) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("target", target);
        payload.put("keys", keys);
        payload.put("enter", enter);
        HttpRequest req = request("/api/v1/agents/" + encode(agentId) + "/send-keys")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(payload), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response = send(req);
        if (!ok(response)) {
            throw failure(response, "Failed to send keys");
        }
        return convert(parse(response.body()), new TypeReference<SendKeysResult>() {
        });
    }

    /**
     * Label or machine id (case-insensitive), or exact agent id.
     */
    public Optional<AgentSummary> findAgentByName(String name) {
        return listAgents().stream().filter(agent -> agent.matches(name, false)).findFirst();
    }

    private JsonNode get(String path, String fallbackError) {
        HttpResponse<String> response = send(request(path).GET().build());
        if (!ok(response)) {
            throw failure(response, fallbackError);
        }
        return parse(response.body());
    }

    private HttpRequest.Builder request(String path) {
        String apiKey = credentials.apiKey()
                .orElseThrow(() -> new ApiException("Not logged in. Run: sessioncast login"));
        String base = credentials.apiUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return HttpRequest.newBuilder(URI.create(base + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ApiException("Request to " + request.uri().getHost() + " failed: " + e.getMessage(), 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException("Request interrupted", 0, e);
        }
    }

    private static boolean ok(HttpResponse<String> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    private static ApiException failure(HttpResponse<String> response, String fallback) {
        String message = null;
        try {
            JsonNode body = Jsons.readObjectOrEmpty(response.body());
            JsonNode field = body.get("message");
            if (field != null && field.isTextual() && !field.asText().isBlank()) {
                message = field.asText();
            }
        } catch (IOException ignored) {
            message = null;
        }
        return new ApiException(message == null ? fallback : message, response.statusCode(), null);
    }

    private static JsonNode parse(String body) {
        try {
            return Jsons.readObjectOrEmpty(body);
        } catch (IOException e) {
            throw new ApiException("Invalid response from API: " + e.getMessage(), 0, e);
        }
    }

    private static <T> T convert(JsonNode node, TypeReference<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            node = Jsons.mapper().createArrayNode();
        }
        try {
            return Jsons.mapper().convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new ApiException("Invalid response from API: " + e.getMessage(), 0, e);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

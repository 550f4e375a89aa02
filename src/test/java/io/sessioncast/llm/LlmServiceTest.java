package io.sessioncast.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.sessioncast.config.LlmConfig;
import io.sessioncast.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmServiceTest {
    private static final List<ChatMessage> HELLO = List.of(new ChatMessage("user", "hello"));

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/chat", exchange -> capture(exchange, """
                {"model":"llama3","message":{"role":"assistant","content":"hi there"},
                 "done":true,"prompt_eval_count":7,"eval_count":3}
                """));
        server.createContext("/v1/chat/completions", exchange -> capture(exchange, """
                {"id":"chatcmpl-abc","object":"chat.completion","created":1700000000,"model":"gpt-4o",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"pong"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":5,"completion_tokens":1,"total_tokens":6}}
                """));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void ollamaReplyShouldBeReshapedAsChatCompletion() throws Exception {
        LlmService service = service(new LlmConfig(true, "ollama", baseUrl + "/", "llama3", null));

        ChatResult result = service.chat(null, HELLO, 0.2d, 64, true);

        assertFalse(result.failed());
        assertTrue(result.id().matches("chatcmpl-[a-z0-9]{8}"));
        assertEquals("chat.completion", result.object());
        assertEquals(1_700_000_123L, result.created());
        assertEquals("llama3", result.model());
        assertEquals("hi there", result.choices().get(0).message().content());
        assertEquals("assistant", result.choices().get(0).message().role());
        assertEquals("stop", result.choices().get(0).finishReason());
        assertEquals(7L, result.usage().promptTokens());
        assertEquals(3L, result.usage().completionTokens());
        assertEquals(10L, result.usage().totalTokens());

        JsonNode sent = Jsons.mapper().readTree(lastBody.get());
        assertEquals("llama3", sent.get("model").asText());
        assertFalse(sent.get("stream").asBoolean());
        assertEquals(0.2d, sent.path("options").get("temperature").asDouble());
        assertEquals(64, sent.path("options").get("num_predict").asInt());
        assertEquals("hello", sent.get("messages").get(0).get("content").asText());
        assertNull(lastAuth.get());
    }

    @Test
    void openAiReplyShouldPassThroughWithBearer() throws Exception {
        LlmService service = service(new LlmConfig(true, "openai", baseUrl + "/v1", "gpt-4o", "sk-test"));

        ChatResult result = service.chat("gpt-4o-mini", HELLO, null, 16, null);

        assertEquals("chatcmpl-abc", result.id());
        assertEquals("pong", result.choices().get(0).message().content());
        assertEquals(6L, result.usage().totalTokens());
        assertEquals("Bearer sk-test", lastAuth.get());
        JsonNode sent = Jsons.mapper().readTree(lastBody.get());
        assertEquals("gpt-4o-mini", sent.get("model").asText());
        assertEquals(16, sent.get("max_tokens").asInt());
        assertFalse(sent.has("temperature"));
    }

    @Test
    void openAiWithoutKeyShouldFailWithoutCalling() {
        LlmService service = service(new LlmConfig(true, "openai", baseUrl + "/v1", null, null));

        ChatResult result = service.chat(null, HELLO, null, null, null);

        assertEquals("OpenAI API key not configured", result.error().message());
        assertEquals(ChatResult.CONFIGURATION_ERROR, result.error().type());
        assertNull(lastBody.get());
    }

    @Test
    void disabledServiceShouldReportUnavailable() {
        ChatResult result = service(LlmConfig.disabled()).chat(null, HELLO, null, null, null);

        assertEquals("LLM is disabled on this agent", result.error().message());
        assertEquals(ChatResult.SERVICE_UNAVAILABLE, result.error().type());
        assertEquals("error", result.object());
    }

    @Test
    void unknownProviderShouldBeInvalidRequest() {
        ChatResult result = service(new LlmConfig(true, "bard", null, null, null)).chat(null, HELLO, null, null, null);

        assertEquals("Unknown LLM provider: bard", result.error().message());
        assertEquals(ChatResult.INVALID_REQUEST, result.error().type());
    }

    @Test
    void upstreamFailureShouldBecomeInternalError() {
        status.set(502);
        ChatResult result = service(new LlmConfig(true, "ollama", baseUrl, null, null)).chat(null, HELLO, null, null, null);

        assertEquals("Ollama returned status 502", result.error().message());
        assertEquals(ChatResult.INTERNAL_ERROR, result.error().type());
    }

    @Test
    void resultShouldSerializeWithSnakeCaseFields() throws Exception {
        ChatResult result = service(new LlmConfig(true, "ollama", baseUrl, null, null)).chat(null, HELLO, null, null, null);

        JsonNode json = Jsons.mapper().readTree(Jsons.toJson(result));
        assertEquals("stop", json.get("choices").get(0).get("finish_reason").asText());
        assertEquals(10, json.get("usage").get("total_tokens").asInt());
        assertFalse(json.has("error"));
    }

    private LlmService service(LlmConfig config) {
        return new LlmService(config, HttpClient.newHttpClient(), () -> 1_700_000_123_456L, new Random(3L));
    }

    private void capture(HttpExchange exchange, String reply) throws IOException {
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
        byte[] bytes = reply.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status.get(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}

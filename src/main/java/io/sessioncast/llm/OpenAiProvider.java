package io.sessioncast.llm;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessioncast.util.Jsons;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.function.LongSupplier;

/**
 * OpenAI-compatible {@code /chat/completions} endpoint; the reply is passed through.
 */
public final class OpenAiProvider implements LlmProvider {
    private final HttpClient http;
    private final String baseUrl;
    private final String apiKey;
    private final LongSupplier clock;

    public OpenAiProvider(HttpClient http, String baseUrl, String apiKey, LongSupplier clock) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public ChatResult chat(ChatRequest request) throws IOException, InterruptedException {
        if (apiKey == null || apiKey.isBlank()) {
            return ChatResult.error("OpenAI API key not configured", ChatResult.CONFIGURATION_ERROR, clock.getAsLong());
        }
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("model", request.model());
        body.set("messages", Jsons.mapper().valueToTree(request.messages()));
        if (request.temperature() != null) {
            body.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            body.put("max_tokens", request.maxTokens());
        }
        String raw = LlmHttp.postJson(http, baseUrl + "/chat/completions", body, apiKey, "OpenAI");
        return Jsons.mapper().readValue(raw, ChatResult.class);
    }
}

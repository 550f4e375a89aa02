package io.sessioncast.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessioncast.util.Jsons;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Local Ollama server; replies are reshaped into chat-completion form.
 */
public final class OllamaProvider implements LlmProvider {
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final HttpClient http;
    private final String baseUrl;
    private final LongSupplier clock;
    private final Random random;

    public OllamaProvider(HttpClient http, String baseUrl, LongSupplier clock, Random random) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.clock = clock;
        this.random = random;
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    public ChatResult chat(ChatRequest request) throws IOException, InterruptedException {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("model", request.model());
        body.set("messages", Jsons.mapper().valueToTree(request.messages()));
        body.put("stream", false);
        ObjectNode options = Jsons.mapper().createObjectNode();
        if (request.temperature() != null) {
            options.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            options.put("num_predict", request.maxTokens());
        }
        if (options.size() > 0) {
            body.set("options", options);
        }

        String raw = LlmHttp.postJson(http, baseUrl + "/api/chat", body, null, "Ollama");
        return toChatCompletion(Jsons.readObjectOrEmpty(raw), request.model());
    }

    ChatResult toChatCompletion(JsonNode reply, String model) {
        JsonNode message = reply.path("message");
        String content = message.path("content").asText("");
        long promptTokens = reply.path("prompt_eval_count").asLong(0L);
        long completionTokens = reply.path("eval_count").asLong(0L);
        return new ChatResult(
                "chatcmpl-" + randomId(8),
                "chat.completion",
                clock.getAsLong() / 1000L,
                model,
                List.of(new ChatResult.Choice(0, new ChatMessage("assistant", content), "stop")),
                new ChatResult.Usage(promptTokens, completionTokens, promptTokens + completionTokens),
                null
        );
    }

    private String randomId(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}

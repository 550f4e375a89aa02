package io.sessioncast.llm;

import java.util.List;

/**
 * Provider-neutral chat call. {@code temperature} and {@code maxTokens} are optional.
 */
public record ChatRequest(String model, List<ChatMessage> messages, Double temperature, Integer maxTokens) {
    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}

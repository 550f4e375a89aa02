package io.sessioncast.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sessioncast.llm.ChatMessage;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmChatRequest(
        String model,
        List<ChatMessage> messages,
        Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        Boolean stream
) {
    public LlmChatRequest {
        messages = messages == null ? List.of() : messages;
    }
}

package io.sessioncast.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Chat-completion shaped reply. Either {@code choices} is populated or {@code error} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatResult(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage,
        ChatError error
) {
    public static final String SERVICE_UNAVAILABLE = "service_unavailable";
    public static final String INVALID_REQUEST = "invalid_request";
    public static final String CONFIGURATION_ERROR = "configuration_error";
    public static final String INTERNAL_ERROR = "internal_error";

    public ChatResult {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static ChatResult error(String message, String type, long createdMs) {
        return new ChatResult("", "error", createdMs, "", List.of(), null, new ChatError(message, type));
    }

    public boolean failed() {
        return error != null;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
            int index,
            ChatMessage message,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
            @JsonProperty("prompt_tokens") long promptTokens,
            @JsonProperty("completion_tokens") long completionTokens,
            @JsonProperty("total_tokens") long totalTokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatError(String message, String type) {
    }
}

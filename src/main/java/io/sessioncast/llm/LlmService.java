package io.sessioncast.llm;

import io.sessioncast.config.LlmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.LongSupplier;

/**
 * Proxies chat requests to the configured provider. Never throws: failures come back as a
 * {@link ChatResult} carrying an error.
 */
public final class LlmService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LlmService.class);

    private final LlmConfig config;
    private final HttpClient http;
    private final LongSupplier clock;
    private final Random random;

    public LlmService(LlmConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), System::currentTimeMillis, new Random());
    }

    public LlmService(LlmConfig config, HttpClient http, LongSupplier clock, Random random) {
        this.config = config == null ? LlmConfig.disabled() : config;
        this.http = http;
        this.clock = clock;
        this.random = random;
    }

    /**
     * {@code stream} is accepted for compatibility; replies are always returned whole.
     */
    public ChatResult chat(String model, List<ChatMessage> messages, Double temperature, Integer maxTokens, Boolean stream) {
        if (!config.enabled()) {
            return ChatResult.error("LLM is disabled on this agent", ChatResult.SERVICE_UNAVAILABLE, clock.getAsLong());
        }
        String actualModel = model == null || model.isBlank() ? config.model() : model;
        ChatRequest request = new ChatRequest(actualModel, messages, temperature, maxTokens);
        LlmProvider provider;
        switch (config.provider().toLowerCase(Locale.ROOT)) {
            case LlmConfig.PROVIDER_OLLAMA -> provider =
                    new OllamaProvider(http, config.baseUrlOr(LlmConfig.DEFAULT_OLLAMA_URL), clock, random);
            case LlmConfig.PROVIDER_OPENAI -> provider =
                    new OpenAiProvider(http, config.baseUrlOr(LlmConfig.DEFAULT_OPENAI_URL), config.apiKey(), clock);
            default -> {
                return ChatResult.error("Unknown LLM provider: " + config.provider(), ChatResult.INVALID_REQUEST, clock.getAsLong());
            }
        }
        try {
            return provider.chat(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChatResult.error("interrupted", ChatResult.INTERNAL_ERROR, clock.getAsLong());
        } catch (Exception e) {
            LOGGER.warn("LLM call via {} failed: {}", provider.name(), e.getMessage());
            return ChatResult.error(String.valueOf(e.getMessage()), ChatResult.INTERNAL_ERROR, clock.getAsLong());
        }
    }
}

package io.sessioncast.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmConfig(
        boolean enabled,
        String provider,
        String baseUrl,
        String model,
        String apiKey
) {
    public static final String PROVIDER_OLLAMA = "ollama";
    public static final String PROVIDER_OPENAI = "openai";
    public static final String DEFAULT_OLLAMA_URL = "http://localhost:11434";
    public static final String DEFAULT_OPENAI_URL = "https://api.openai.com/v1";
    public static final String DEFAULT_MODEL = "llama2";

    public LlmConfig {
        provider = provider == null || provider.isBlank() ? PROVIDER_OLLAMA : provider.trim();
        model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
        baseUrl = baseUrl == null || baseUrl.isBlank() ? null : stripTrailingSlash(baseUrl.trim());
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
    }

    public static LlmConfig disabled() {
        return new LlmConfig(false, null, null, null, null);
    }

    public String baseUrlOr(String fallback) {
        return baseUrl == null ? fallback : baseUrl;
    }

    private static String stripTrailingSlash(String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}

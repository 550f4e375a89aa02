package io.sessioncast.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessioncast.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials before request payloads, configs or keys reach the log.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int MAX_LOGGED_CHARS = 256;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual() && likelySecretValue(input.asText(""))) {
            return Jsons.mapper().valueToTree(MASK);
        }
        return input;
    }

    /**
     * Masked and truncated rendering of a raw JSON payload for log lines. Unparseable input is
     * reported by length only.
     */
    public static String forLog(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            return "{}";
        }
        String rendered;
        try {
            rendered = Jsons.toJson(masked(Jsons.mapper().readTree(rawJson)));
        } catch (JsonProcessingException e) {
            return "<unparseable " + rawJson.length() + " chars>";
        }
        if (rendered.length() <= MAX_LOGGED_CHARS) {
            return rendered;
        }
        return rendered.substring(0, MAX_LOGGED_CHARS) + "...";
    }

    /**
     * {@code sk-abcdef123456} becomes {@code sk-abc...3456}; short values are masked fully.
     */
    public static String maskKey(String key) {
        if (key == null || key.isEmpty()) {
            return "none";
        }
        if (key.length() < 12) {
            return MASK;
        }
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 24 || v.indexOf(' ') >= 0) {
            return false;
        }
        return v.matches("^[A-Za-z0-9+/=_\\-:.]{24,}$");
    }
}

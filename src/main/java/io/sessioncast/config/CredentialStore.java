package io.sessioncast.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessioncast.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * API key and API base URL for the interactive commands, kept in a small JSON file.
 */
public final class CredentialStore {
    public static final String DEFAULT_API_URL = "https://api.sessioncast.io";
    private static final String KEY_API_KEY = "apiKey";
    private static final String KEY_API_URL = "apiUrl";

    private final Path file;

    public CredentialStore(Path file) {
        this.file = file;
    }

    public static CredentialStore defaultStore() {
        return new CredentialStore(Paths.get(System.getProperty("user.home", "."), ".sessioncast", "cli-config.json"));
    }

    public Path file() {
        return file;
    }

    public synchronized Optional<String> apiKey() {
        return text(read(), KEY_API_KEY);
    }

    public synchronized void setApiKey(String apiKey) {
        ObjectNode root = read();
        root.put(KEY_API_KEY, apiKey);
        write(root);
    }

    public synchronized void clearApiKey() {
        ObjectNode root = read();
        if (root.remove(KEY_API_KEY) != null) {
            write(root);
        }
    }

    public synchronized String apiUrl() {
        return text(read(), KEY_API_URL).orElse(DEFAULT_API_URL);
    }

    public synchronized void setApiUrl(String apiUrl) {
        ObjectNode root = read();
        root.put(KEY_API_URL, apiUrl);
        write(root);
    }

    public boolean isLoggedIn() {
        return apiKey().isPresent();
    }

    private ObjectNode read() {
        if (!Files.isRegularFile(file)) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            JsonNode node = Jsons.readObjectOrEmpty(Files.readString(file, StandardCharsets.UTF_8));
            if (node.isObject()) {
                return (ObjectNode) node;
            }
            return Jsons.mapper().createObjectNode();
        } catch (IOException e) {
            throw new ConfigException("Failed to read credentials from " + file + ": " + e.getMessage(), e);
        }
    }

    private void write(ObjectNode root) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toPrettyJson(root), StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ConfigException("Failed to write credentials to " + file + ": " + e.getMessage(), e);
        }
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}

package io.sessioncast.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.sessioncast.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Locates, parses and validates the agent configuration file.
 *
 * <p>Lookup order: explicit path, {@code SESSIONCAST_CONFIG}, {@code TMUX_REMOTE_CONFIG}, then the
 * first existing of {@code ~/.sessioncast.yml} and {@code ~/.tmux-remote.yml}. Files ending in
 * {@code .json} are read as JSON, everything else as YAML.
 */
public final class AgentConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(AgentConfigLoader.class);
    public static final String ENV_CONFIG = "SESSIONCAST_CONFIG";
    public static final String ENV_LEGACY_CONFIG = "TMUX_REMOTE_CONFIG";
    private static final List<String> DEFAULT_FILE_NAMES = List.of(".sessioncast.yml", ".tmux-remote.yml");

    private static final ObjectMapper YAML = YAMLMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private final Map<String, String> env;
    private final Path homeDir;

    public AgentConfigLoader() {
        this(System.getenv(), Paths.get(System.getProperty("user.home", ".")));
    }

    public AgentConfigLoader(Map<String, String> env, Path homeDir) {
        this.env = env == null ? Map.of() : Map.copyOf(env);
        this.homeDir = homeDir;
    }

    public AgentConfig load(String explicitPath) {
        Path path = resolve(explicitPath);
        LOGGER.info("Loading config from: {}", path);
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
        AgentConfig config = parse(content, isJson(path));
        validate(config);
        return config;
    }

    Path resolve(String explicitPath) {
        String requested = firstNonBlank(explicitPath, env.get(ENV_CONFIG), env.get(ENV_LEGACY_CONFIG));
        if (requested != null) {
            Path path = Paths.get(requested);
            if (!Files.isRegularFile(path)) {
                throw new ConfigException("Config file not found. Tried: " + requested);
            }
            return path;
        }
        StringBuilder tried = new StringBuilder();
        for (String name : DEFAULT_FILE_NAMES) {
            Path candidate = homeDir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
            if (tried.length() > 0) {
                tried.append(", ");
            }
            tried.append(candidate);
        }
        throw new ConfigException("Config file not found. Tried: " + tried);
    }

    static AgentConfig parse(String content, boolean json) {
        if (content == null || content.isBlank()) {
            throw new ConfigException("Config file is empty");
        }
        try {
            ObjectMapper mapper = json ? Jsons.mapper() : YAML;
            AgentConfig config = mapper.readValue(content, AgentConfig.class);
            if (config == null) {
                throw new ConfigException("Config file is empty");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid config: " + e.getOriginalMessage(), e);
        }
    }

    static void validate(AgentConfig config) {
        if (config.machineId() == null || config.machineId().isBlank()) {
            throw new ConfigException("machineId is required");
        }
        if (config.relayUrl() == null || config.relayUrl().isBlank()) {
            throw new ConfigException("relay is required");
        }
        URI uri;
        try {
            uri = new URI(config.relayUrl());
        } catch (URISyntaxException e) {
            throw new ConfigException("relay is not a valid URL: " + config.relayUrl(), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"ws".equals(scheme) && !"wss".equals(scheme)) {
            throw new ConfigException("relay must be a ws:// or wss:// URL: " + config.relayUrl());
        }
        if (config.control().enabled() && config.control().agentId() == null) {
            LOGGER.warn("api.enabled is set without api.agentId; control channel stays off");
        }
    }

    private static boolean isJson(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}

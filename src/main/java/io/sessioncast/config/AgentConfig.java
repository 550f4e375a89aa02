package io.sessioncast.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;

/**
 * Startup configuration of the agent daemon. Immutable; changes need a restart.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
        @JsonProperty("machineId") String machineId,
        @JsonProperty("relay") String relayUrl,
        @JsonProperty("token") String authToken,
        @JsonProperty("api") ControlConfig control
) {
    public AgentConfig {
        machineId = machineId == null ? null : machineId.trim();
        relayUrl = relayUrl == null ? null : relayUrl.trim();
        authToken = authToken == null || authToken.isBlank() ? null : authToken.trim();
        control = control == null ? ControlConfig.disabled() : control;
    }

    public URI relayUri() {
        return URI.create(relayUrl);
    }
}

package io.sessioncast.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The {@code api} section: the control channel and the services it exposes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlConfig(
        boolean enabled,
        String agentId,
        ExecConfig exec,
        LlmConfig llm
) {
    public ControlConfig {
        agentId = agentId == null || agentId.isBlank() ? null : agentId.trim();
        exec = exec == null ? ExecConfig.disabled() : exec;
        llm = llm == null ? LlmConfig.disabled() : llm;
    }

    public static ControlConfig disabled() {
        return new ControlConfig(false, null, null, null);
    }

    /**
     * Channel runs only when enabled with an agent id.
     */
    public boolean active() {
        return enabled && agentId != null;
    }
}

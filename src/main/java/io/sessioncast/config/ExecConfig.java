package io.sessioncast.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecConfig(
        boolean enabled,
        String shell,
        String workingDir,
        List<String> allowedCommands,
        Long defaultTimeout
) {
    public static final String DEFAULT_SHELL = "/bin/bash";
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    public ExecConfig {
        shell = shell == null || shell.isBlank() ? DEFAULT_SHELL : shell.trim();
        workingDir = workingDir == null || workingDir.isBlank() ? null : workingDir;
        allowedCommands = allowedCommands == null ? List.of() : List.copyOf(allowedCommands);
        defaultTimeout = defaultTimeout == null || defaultTimeout <= 0L ? DEFAULT_TIMEOUT_MS : defaultTimeout;
    }

    public static ExecConfig disabled() {
        return new ExecConfig(false, null, null, null, null);
    }
}

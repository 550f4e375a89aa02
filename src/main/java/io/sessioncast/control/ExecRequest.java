package io.sessioncast.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecRequest(String command, String cwd, Long timeout, String sessionId) {
}

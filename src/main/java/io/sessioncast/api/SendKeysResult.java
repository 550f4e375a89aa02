package io.sessioncast.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendKeysResult(boolean success, String agentId, String target, String error) {
}

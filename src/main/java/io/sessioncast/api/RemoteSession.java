package io.sessioncast.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteSession(String name, int windows, String created, boolean attached) {
}

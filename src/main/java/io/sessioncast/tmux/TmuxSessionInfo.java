package io.sessioncast.tmux;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TmuxSessionInfo(String name, int windows, String created, boolean attached) {
}

package io.sessioncast.control;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SendKeysRequest(String target, String keys, Boolean enter) {
    public boolean pressEnter() {
        return enter == null || enter;
    }

    public boolean complete() {
        return target != null && !target.isEmpty() && keys != null && !keys.isEmpty();
    }
}

package io.sessioncast.control;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.sessioncast.tmux.TmuxSessionInfo;

import java.util.List;
import java.util.Map;

/**
 * Bodies of {@code api_response} messages other than exec and chat results.
 */
final class ControlResponses {
    private ControlResponses() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendKeysResponse(boolean success, String target, String error) {
        static SendKeysResponse ok(boolean success, String target) {
            return new SendKeysResponse(success, target, null);
        }

        static SendKeysResponse fail(String error) {
            return new SendKeysResponse(false, null, error);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SessionListResponse(List<TmuxSessionInfo> sessions, String error) {
        static SessionListResponse ok(List<TmuxSessionInfo> sessions) {
            return new SessionListResponse(sessions, null);
        }

        static SessionListResponse fail(String error) {
            return new SessionListResponse(List.of(), error);
        }
    }

    static Map<String, Object> chatFailure(String message) {
        return Map.of("error", Map.of("message", String.valueOf(message), "type", "internal_error"));
    }
}

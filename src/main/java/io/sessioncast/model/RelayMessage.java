package io.sessioncast.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire unit exchanged with the relay over every socket.
 *
 * <p>{@code payload} carries base64 or raw text depending on {@code type}; {@code meta} carries
 * string side data such as {@code requestId}, {@code cols} and {@code rows}. Absent fields are
 * omitted from the encoded JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelayMessage(
        String type,
        String role,
        String session,
        String payload,
        Map<String, String> meta
) {
    public RelayMessage {
        if (meta != null) {
            Map<String, String> copy = new LinkedHashMap<>();
            meta.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
            meta = Collections.unmodifiableMap(copy);
        }
    }

    public static RelayMessage of(String type, String session, String payload) {
        return new RelayMessage(type, null, session, payload, null);
    }

    public String metaValue(String key) {
        return meta == null ? null : meta.get(key);
    }

    public boolean isAddressedTo(String sessionId) {
        return sessionId != null && sessionId.equals(session);
    }
}

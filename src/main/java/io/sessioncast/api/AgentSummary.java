package io.sessioncast.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentSummary(
        String id,
        String label,
        String machineId,
        @JsonProperty("isActive") boolean isActive,
        @JsonProperty("apiEnabled") boolean apiEnabled,
        String lastConnectedAt,
        String createdAt
) {
    /**
     * Label, then machine id, then the first eight characters of the id.
     */
    public String displayName() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        if (machineId != null && !machineId.isBlank()) {
            return machineId;
        }
        return shortId();
    }

    public String shortId() {
        if (id == null) {
            return "";
        }
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    /**
     * Case-insensitive label or machine id match, or an id match (exact, or by prefix when
     * {@code idPrefix} is set).
     */
    public boolean matches(String name, boolean idPrefix) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        if (label != null && label.toLowerCase(Locale.ROOT).equals(wanted)) {
            return true;
        }
        if (machineId != null && machineId.toLowerCase(Locale.ROOT).equals(wanted)) {
            return true;
        }
        if (id == null) {
            return false;
        }
        return idPrefix ? id.startsWith(name) : id.equals(name);
    }
}

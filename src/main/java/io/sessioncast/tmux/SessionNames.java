package io.sessioncast.tmux;

import java.util.Optional;
import java.util.regex.Pattern;

public final class SessionNames {
    private static final Pattern INVALID = Pattern.compile("[^a-zA-Z0-9_-]");

    private SessionNames() {
    }

    /**
     * Replaces every character outside {@code [a-zA-Z0-9_-]} with {@code _}. Empty when nothing of
     * the request survives, that is for an empty request or one made only of invalid characters.
     */
    public static Optional<String> sanitize(String requested) {
        if (requested == null || requested.isEmpty()) {
            return Optional.empty();
        }
        if (INVALID.matcher(requested).replaceAll("").isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(INVALID.matcher(requested).replaceAll("_"));
    }
}

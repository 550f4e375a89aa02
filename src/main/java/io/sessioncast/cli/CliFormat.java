package io.sessioncast.cli;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

final class CliFormat {
    static final String BANNER = "\n  SessionCast CLI\n\n  Control your agents from anywhere.\n\n  Run `sessioncast --help` for usage.\n";

    private CliFormat() {
    }

    static String padRight(String value, int width) {
        String text = value == null ? "" : value;
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }

    static String rule(int width) {
        return "-".repeat(width);
    }

    /**
     * {@code just now}, {@code 5m ago}, {@code 3h ago}, {@code 2d ago}, then the plain date.
     * Unparseable timestamps are shown as they are.
     */
    static String relativeTime(String isoTimestamp, Instant now, ZoneId zone) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            return "never";
        }
        Instant then;
        try {
            then = Instant.parse(isoTimestamp);
        } catch (DateTimeParseException e) {
            return isoTimestamp;
        }
        long seconds = Math.max(0L, Duration.between(then, now).getSeconds());
        long minutes = seconds / 60L;
        long hours = minutes / 60L;
        long days = hours / 24L;
        if (seconds < 60L) {
            return "just now";
        }
        if (minutes < 60L) {
            return minutes + "m ago";
        }
        if (hours < 24L) {
            return hours + "h ago";
        }
        if (days < 7L) {
            return days + "d ago";
        }
        return LocalDate.ofInstant(then, zone).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}

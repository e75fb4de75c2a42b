package com.llmorch.core.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written either in ISO-8601 ({@code PT30S}) or in the short
 * form used on the command line and in workload specs ({@code 500ms},
 * {@code 30s}, {@code 5m}, {@code 1h}). A bare number is seconds.
 */
public final class Durations {
    private static final Pattern SHORT = Pattern.compile("^(\\d+)(ms|s|m|h|d)?$");

    private Durations() {
    }

    public static Optional<Duration> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                Duration d = Duration.parse(trimmed);
                return d.isNegative() ? Optional.empty() : Optional.of(d);
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        Matcher m = SHORT.matcher(trimmed);
        if (!m.matches()) {
            return Optional.empty();
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "s" : m.group(2);
        switch (unit) {
            case "ms":
                return Optional.of(Duration.ofMillis(amount));
            case "m":
                return Optional.of(Duration.ofMinutes(amount));
            case "h":
                return Optional.of(Duration.ofHours(amount));
            case "d":
                return Optional.of(Duration.ofDays(amount));
            default:
                return Optional.of(Duration.ofSeconds(amount));
        }
    }

    /**
     * @throws IllegalArgumentException when the text is present but malformed
     */
    public static Duration parseOrDefault(String text, Duration defaultValue) {
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        return parse(text).orElseThrow(() -> new IllegalArgumentException("Invalid duration: " + text));
    }
}

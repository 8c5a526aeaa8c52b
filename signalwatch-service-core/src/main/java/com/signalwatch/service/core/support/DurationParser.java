package com.signalwatch.service.core.support;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses operator-supplied ages such as {@code 7d}, {@code 12h}, {@code 90m}, {@code 30s},
 * {@code 500ms}, {@code 2w} as well as ISO-8601 {@code P7D} / {@code PT12H}. Bare numbers are days.
 * Negative and out-of-range values are rejected with {@link IllegalArgumentException}.
 */
public final class DurationParser {

    private static final Pattern SHORTHAND = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d|w)?");

    private DurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Duration cannot be null or empty");
        }
        String trimmed = input.trim().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("p")) {
            Duration iso;
            try {
                iso = Duration.parse(trimmed.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Unsupported duration format: " + input, ex);
            }
            if (iso.isNegative()) {
                throw new IllegalArgumentException("Duration must not be negative: " + input);
            }
            return iso;
        }

        Matcher m = SHORTHAND.matcher(trimmed);
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported duration format: " + input);
        }
        String unit = m.group(2) == null ? "d" : m.group(2);
        try {
            long value = Long.parseLong(m.group(1));
            return switch (unit) {
                case "ms" -> Duration.ofMillis(value);
                case "s" -> Duration.ofSeconds(value);
                case "m" -> Duration.ofMinutes(value);
                case "h" -> Duration.ofHours(value);
                case "w" -> Duration.ofDays(Math.multiplyExact(value, 7L));
                default -> Duration.ofDays(value);
            };
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: " + input, ex);
        }
    }
}

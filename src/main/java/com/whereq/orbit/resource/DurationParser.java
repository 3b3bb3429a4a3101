package com.whereq.orbit.resource;

import com.whereq.orbit.exception.ResourceValidationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses scale-rule durations: "30s", "10m", "1h", "2d" or ISO-8601 ("PT10M")
 */
public final class DurationParser {

    private static final Pattern SHORT_PATTERN = Pattern.compile("(\\d+)([smhd])");

    private DurationParser() {
    }

    /**
     * Parse a duration, null or blank meaning zero
     *
     * @param value duration string
     * @return parsed duration
     * @throws ResourceValidationException on malformed input
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            return Duration.ZERO;
        }
        String trimmed = value.trim();
        Matcher matcher = SHORT_PATTERN.matcher(trimmed.toLowerCase());
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "s" -> Duration.ofSeconds(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> throw new ResourceValidationException("Unsupported duration unit in '" + value + "'");
            };
        }

        try {
            Duration duration = Duration.parse(trimmed);
            if (duration.isNegative()) {
                throw new ResourceValidationException("Duration must not be negative: " + value);
            }
            return duration;
        } catch (DateTimeParseException e) {
            throw new ResourceValidationException("Invalid duration '" + value + "', expected e.g. 30s, 10m, 1h", e);
        }
    }
}

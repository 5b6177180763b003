package com.nodeguardian.rule;

import com.nodeguardian.exception.ConfigException;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the short duration form used in rule documents: {@code 30s}, {@code 5m}, {@code 1h},
 * {@code 2d}, or a bare number of seconds. ISO-8601 ({@code PT5M}) is accepted as well.
 */
public final class DurationParser {

    private static final Pattern SHORT_FORM = Pattern.compile("^(\\d+)\\s*([smhd]?)$");

    private DurationParser() {}

    /** @return {@code fallback} when {@code value} is null or blank */
    public static Duration parse(String value, Duration fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = SHORT_FORM.matcher(trimmed);
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            return switch (matcher.group(2)) {
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                case "d" -> Duration.ofDays(amount);
                default -> Duration.ofSeconds(amount);
            };
        }
        if (trimmed.startsWith("pt") || trimmed.startsWith("p")) {
            try {
                return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
            } catch (RuntimeException e) {
                throw new ConfigException("Invalid duration: " + value, e);
            }
        }
        throw new ConfigException("Invalid duration: " + value);
    }
}

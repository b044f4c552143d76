package work.signbox.shared;

import java.time.Duration;
import java.util.Locale;

/**
 * Parses the duration notation used by the CLI and the TOML configuration
 * ({@code 1500}, {@code 1500ms}, {@code 30s}, {@code 2m}, {@code 1h}).
 */
public final class Durations {
    private Durations() {}

    public static Duration parse(String raw, Duration fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        try {
            return Duration.ofMillis(Math.multiplyExact(value, multiplier));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }

    public static Duration requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return value;
    }
}

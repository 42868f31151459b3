package work.lcod.manifest.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses service timeouts as written in app definitions (e.g. {@code 30s}, {@code 500ms}, {@code 2m}).
 * A bare number is a count of seconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long nanosPerUnit = 1_000_000_000L;
        if (trimmed.endsWith("ns")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            nanosPerUnit = 1L;
        } else if (trimmed.endsWith("us")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            nanosPerUnit = 1_000L;
        } else if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            nanosPerUnit = 1_000_000L;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            nanosPerUnit = 60_000_000_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        try {
            return Optional.of(Duration.ofNanos(Math.multiplyExact(value, nanosPerUnit)));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Duration out of range: " + raw, ex);
        }
    }
}

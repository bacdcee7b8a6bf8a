package work.sdl2.canvas.shared;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses user-friendly durations ({@code 500ms}, {@code 5s}, {@code 2m}, {@code 1h}). A bare number is
 * read in the caller's unit, so {@code TASK_POLL_INTERVAL_SECONDS=5} means five seconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw, ChronoUnit bareUnit) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        ChronoUnit unit = bareUnit;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
            unit = ChronoUnit.MILLIS;
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unit = ChronoUnit.SECONDS;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unit = ChronoUnit.MINUTES;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unit = ChronoUnit.HOURS;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.of(value, unit));
    }

    public static Optional<Duration> parseSeconds(String raw) {
        return parse(raw, ChronoUnit.SECONDS);
    }
}

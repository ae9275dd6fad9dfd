package work.kdotool.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses durations written in config files ({@code 100ms}, {@code 5s}, {@code 2m}, {@code 1h}).
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        long unitMillis = 1L;
        if (value.endsWith("ms")) {
            value = value.substring(0, value.length() - 2);
        } else if (value.endsWith("s")) {
            value = value.substring(0, value.length() - 1);
            unitMillis = 1_000L;
        } else if (value.endsWith("m")) {
            value = value.substring(0, value.length() - 1);
            unitMillis = 60_000L;
        } else if (value.endsWith("h")) {
            value = value.substring(0, value.length() - 1);
            unitMillis = 3_600_000L;
        }
        long amount;
        try {
            amount = Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.multiplyExact(amount, unitMillis)));
    }

    public static Duration parseOrDefault(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}

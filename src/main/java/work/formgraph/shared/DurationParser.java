package work.formgraph.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the short duration notation used in configuration files ({@code 250ms}, {@code 2s}, {@code 1m}).
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern SHAPE = Pattern.compile("^(\\d+)\\s*(ms|s|m|h)?$");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var matcher = SHAPE.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Unsupported duration: " + raw);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        switch (unit) {
            case "s":
                return Optional.of(Duration.ofSeconds(amount));
            case "m":
                return Optional.of(Duration.ofMinutes(amount));
            case "h":
                return Optional.of(Duration.ofHours(amount));
            default:
                return Optional.of(Duration.ofMillis(amount));
        }
    }
}

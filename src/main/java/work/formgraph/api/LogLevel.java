package work.formgraph.api;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Log thresholds accepted on the command line, mapped onto {@code java.util.logging} levels.
 */
public enum LogLevel {
    TRACE(Level.FINEST),
    DEBUG(Level.FINE),
    INFO(Level.INFO),
    WARN(Level.WARNING),
    ERROR(Level.SEVERE),
    FATAL(Level.OFF);

    private final Level julLevel;

    LogLevel(Level julLevel) {
        this.julLevel = julLevel;
    }

    public Level julLevel() {
        return julLevel;
    }

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value, ex);
        }
    }
}

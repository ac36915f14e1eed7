package work.formgraph.importer;

import java.util.Locale;

/**
 * How an imported schema is combined with the graph currently being edited.
 */
public enum ImportMode {
    /** The imported graph replaces the current one. */
    REPLACE,
    /** Accepted for compatibility; currently behaves exactly like {@link #REPLACE}. */
    MERGE;

    public static ImportMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return REPLACE;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "replace" -> REPLACE;
            case "merge" -> MERGE;
            default -> throw new IllegalArgumentException("Unknown import mode: " + raw);
        };
    }
}

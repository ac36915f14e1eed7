package work.formgraph.api;

import java.util.Locale;

/**
 * When a {@link FormBuilderSession} regenerates the UI schema after a mutation.
 */
public enum RegenerationPolicy {
    /** Regenerate after every mutation. */
    IMMEDIATE,
    /** Batch mutations and regenerate once the debounce window has passed. */
    DEBOUNCED;

    public static RegenerationPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return DEBOUNCED;
        }
        try {
            return RegenerationPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported regeneration policy: " + value, ex);
        }
    }
}

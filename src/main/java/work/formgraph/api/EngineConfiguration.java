package work.formgraph.api;

import java.time.Duration;
import java.util.Objects;
import work.formgraph.importer.ImportMode;
import work.formgraph.ui.WidgetRegistry;

/**
 * Immutable settings of a {@link FormGraphEngine} and the sessions built on it.
 */
public record EngineConfiguration(
    WidgetRegistry widgets,
    RegenerationPolicy regeneration,
    Duration debounce,
    ImportMode importMode,
    boolean strictReferences,
    boolean prettyPrint
) {
    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(250);

    public EngineConfiguration {
        Objects.requireNonNull(widgets, "widgets");
        Objects.requireNonNull(regeneration, "regeneration");
        Objects.requireNonNull(debounce, "debounce");
        Objects.requireNonNull(importMode, "importMode");
        if (debounce.isNegative()) {
            throw new IllegalArgumentException("debounce must not be negative");
        }
    }

    public static EngineConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WidgetRegistry widgets;
        private RegenerationPolicy regeneration = RegenerationPolicy.DEBOUNCED;
        private Duration debounce = DEFAULT_DEBOUNCE;
        private ImportMode importMode = ImportMode.REPLACE;
        private boolean strictReferences = true;
        private boolean prettyPrint = true;

        public Builder widgets(WidgetRegistry widgets) {
            this.widgets = widgets;
            return this;
        }

        public Builder regeneration(RegenerationPolicy regeneration) {
            this.regeneration = regeneration;
            return this;
        }

        public Builder debounce(Duration debounce) {
            this.debounce = debounce;
            return this;
        }

        public Builder importMode(ImportMode importMode) {
            this.importMode = importMode;
            return this;
        }

        public Builder strictReferences(boolean strictReferences) {
            this.strictReferences = strictReferences;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                widgets == null ? WidgetRegistry.standard() : widgets,
                regeneration,
                debounce,
                importMode,
                strictReferences,
                prettyPrint
            );
        }
    }
}

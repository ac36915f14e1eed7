package work.formgraph.ui;

import java.util.Locale;

public enum WidgetCategory {
    STANDARD,
    CUSTOM,
    SPECIALIZED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WidgetCategory from(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        for (WidgetCategory category : values()) {
            if (category.tag().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown widget category: " + value);
    }
}

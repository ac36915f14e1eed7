package work.formgraph.ui;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.formgraph.graph.NodeKind;

/**
 * A form widget the preview layer knows how to render, with the node kinds it accepts and the {@code ui:options} it
 * starts from.
 */
public record Widget(
    String id,
    String name,
    String displayName,
    String description,
    Set<NodeKind> compatibleKinds,
    Map<String, Object> defaultOptions,
    WidgetCategory category
) {
    public Widget {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Widget id must not be blank");
        }
        compatibleKinds = Set.copyOf(compatibleKinds);
        defaultOptions = defaultOptions == null || defaultOptions.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(defaultOptions));
        category = category == null ? WidgetCategory.CUSTOM : category;
    }

    public boolean accepts(NodeKind kind) {
        return compatibleKinds.contains(kind);
    }
}

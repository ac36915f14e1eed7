package work.formgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.formgraph.shared.JsonValues;

/**
 * Shallow update for {@link GraphMutations#updateNode}. Only the entries present are changed; a {@code null} value
 * clears the field.
 *
 * <p>Recognised entries: {@code key}, {@code title}, {@code description}, {@code required}, {@code default},
 * {@code widget}, {@code widgetOptions}, {@code type} (switches the node kind and resets its details) and any keyword
 * attribute of the node kind ({@code minimum}, {@code enum}, ...).
 */
public final class NodePatch {
    private final Map<String, Object> entries;

    private NodePatch(Map<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static NodePatch empty() {
        return new NodePatch(new LinkedHashMap<>());
    }

    public static NodePatch of(Map<String, Object> entries) {
        return new NodePatch(new LinkedHashMap<>(entries));
    }

    public NodePatch set(String name, Object value) {
        var copy = new LinkedHashMap<>(entries);
        copy.put(name, value);
        return new NodePatch(copy);
    }

    public NodePatch key(String value) {
        return set("key", value);
    }

    public NodePatch title(String value) {
        return set("title", value);
    }

    public NodePatch description(String value) {
        return set("description", value);
    }

    public NodePatch required(boolean value) {
        return set("required", value);
    }

    public NodePatch defaultValue(Object value) {
        return set("default", value);
    }

    public NodePatch widget(String value) {
        return set("widget", value);
    }

    public NodePatch widgetOptions(Map<String, Object> value) {
        return set("widgetOptions", value);
    }

    public NodePatch kind(NodeKind value) {
        return set("type", value.tag());
    }

    public Map<String, Object> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    SchemaNode applyTo(SchemaNode node) {
        String key = node.key();
        String title = node.title();
        String description = node.description();
        boolean required = node.required();
        Object defaultValue = node.defaultValue();
        String widget = node.widget();
        Map<String, Object> widgetOptions = node.widgetOptions();
        NodeDetails details = node.details();

        if (entries.containsKey("type")) {
            Object raw = entries.get("type");
            NodeKind kind = raw instanceof NodeKind k ? k : NodeKind.fromTag(raw == null ? null : raw.toString())
                .orElseThrow(() -> new IllegalArgumentException("Unknown node type: " + raw));
            if (kind != details.kind()) {
                details = NodeDetails.defaults(kind);
            }
        }
        var attributes = new LinkedHashMap<String, Object>();
        for (var entry : entries.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "type" -> { }
                case "key" -> key = value == null ? null : value.toString();
                case "title" -> title = value == null ? null : value.toString();
                case "description" -> description = value == null ? null : value.toString();
                case "required" -> required = Boolean.TRUE.equals(value);
                case "default" -> defaultValue = JsonValues.deepCopy(value);
                case "widget" -> widget = value == null ? null : value.toString();
                case "widgetOptions" -> {
                    if (value != null && !(value instanceof Map<?, ?>)) {
                        throw new IllegalArgumentException("widgetOptions must be an object: " + value);
                    }
                    widgetOptions = JsonValues.asObject(value);
                }
                default -> attributes.put(entry.getKey(), value);
            }
        }
        if (!attributes.isEmpty()) {
            details = details.withAttributes(attributes);
        }
        return new SchemaNode(node.id(), key, title, description, required, defaultValue, widget, widgetOptions,
            details);
    }

    @Override
    public String toString() {
        return "NodePatch" + entries;
    }
}

package work.formgraph.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.formgraph.shared.JsonValues;

/**
 * One field, container, conditional group, definition or reference of a form.
 *
 * <p>{@code id} is assigned by the graph on insertion; values built through {@link #builder(NodeKind)} carry a
 * {@code null} id until then. {@code defaultValue} and {@code widgetOptions} are held as read-only deep copies.
 */
public record SchemaNode(
    String id,
    String key,
    String title,
    String description,
    boolean required,
    Object defaultValue,
    String widget,
    Map<String, Object> widgetOptions,
    NodeDetails details
) {
    public SchemaNode {
        Objects.requireNonNull(details, "details");
        defaultValue = JsonValues.freeze(defaultValue);
        widgetOptions = widgetOptions == null || widgetOptions.isEmpty()
            ? Map.of()
            : JsonValues.freezeObject(widgetOptions);
    }

    public NodeKind kind() {
        return details.kind();
    }

    public SchemaNode withId(String newId) {
        return new SchemaNode(newId, key, title, description, required, defaultValue, widget, widgetOptions, details);
    }

    public SchemaNode withKey(String newKey) {
        return new SchemaNode(id, newKey, title, description, required, defaultValue, widget, widgetOptions, details);
    }

    public SchemaNode withDetails(NodeDetails newDetails) {
        return new SchemaNode(id, key, title, description, required, defaultValue, widget, widgetOptions, newDetails);
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(NodeDetails.defaults(kind));
    }

    public static Builder builder(NodeDetails details) {
        return new Builder(details);
    }

    public static SchemaNode string(String key, String title) {
        return builder(NodeKind.STRING).key(key).title(title).build();
    }

    public static SchemaNode number(String key, String title) {
        return builder(NodeKind.NUMBER).key(key).title(title).build();
    }

    public static SchemaNode object(String key, String title) {
        return builder(NodeKind.OBJECT).key(key).title(title).build();
    }

    public static final class Builder {
        private String key;
        private String title;
        private String description;
        private boolean required;
        private Object defaultValue;
        private String widget;
        private Map<String, Object> widgetOptions;
        private NodeDetails details;

        private Builder(NodeDetails details) {
            this.details = Objects.requireNonNull(details, "details");
        }

        public Builder key(String value) {
            this.key = value;
            return this;
        }

        public Builder title(String value) {
            this.title = value;
            return this;
        }

        public Builder description(String value) {
            this.description = value;
            return this;
        }

        public Builder required(boolean value) {
            this.required = value;
            return this;
        }

        public Builder defaultValue(Object value) {
            this.defaultValue = value;
            return this;
        }

        public Builder widget(String value) {
            this.widget = value;
            return this;
        }

        public Builder widgetOptions(Map<String, Object> value) {
            this.widgetOptions = value;
            return this;
        }

        public Builder details(NodeDetails value) {
            this.details = Objects.requireNonNull(value, "details");
            return this;
        }

        /** Merges keyword attributes (minimum, enum, pattern...) into the current details. */
        public Builder attributes(Map<String, Object> attributes) {
            this.details = details.withAttributes(attributes);
            return this;
        }

        public Builder attribute(String name, Object value) {
            var single = new LinkedHashMap<String, Object>();
            single.put(name, value);
            return attributes(single);
        }

        public SchemaNode build() {
            return new SchemaNode(null, key, title, description, required, defaultValue, widget, widgetOptions,
                details);
        }
    }
}

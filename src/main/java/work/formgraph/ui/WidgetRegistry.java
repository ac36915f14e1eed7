package work.formgraph.ui;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import work.formgraph.graph.NodeDetails;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.SchemaNode;

/**
 * Known widgets plus the auto-mapping rules that pick one for a node without an explicit widget.
 *
 * <p>Rules are checked in registration order and the first match wins; without a match the first standard widget
 * compatible with the node kind is used. Instances are not thread-safe; configure them before handing them to a
 * generator.
 */
public final class WidgetRegistry {
    private final Map<String, Widget> widgets = new LinkedHashMap<>();
    private final List<Rule> rules = new ArrayList<>();

    /** Empty registry, no widgets and no rules. */
    public WidgetRegistry() {}

    /**
     * Registry preloaded with the text, textarea, select, checkbox, number, yesno and photo-gallery widgets and the
     * yes/no and photo rules.
     */
    public static WidgetRegistry standard() {
        var registry = new WidgetRegistry();
        registry.register(standardWidget("text", "TextWidget", "Text Input", "Single-line text input",
            Set.of(NodeKind.STRING)));
        registry.register(standardWidget("textarea", "TextareaWidget", "Textarea", "Multi-line text input",
            Set.of(NodeKind.STRING)));
        registry.register(standardWidget("select", "SelectWidget", "Select Dropdown", "Dropdown select menu",
            Set.of(NodeKind.STRING, NodeKind.ENUM)));
        registry.register(standardWidget("checkbox", "CheckboxWidget", "Checkbox", "Single checkbox input",
            Set.of(NodeKind.BOOLEAN)));
        registry.register(standardWidget("number", "NumberWidget", "Number Input", "Number input field",
            Set.of(NodeKind.NUMBER)));

        var yesNoOptions = new LinkedHashMap<String, Object>();
        yesNoOptions.put("enumOptions", List.of(
            Map.of("value", "yes", "label", "Yes"),
            Map.of("value", "no", "label", "No")));
        registry.register(new Widget("yesno", "YesNoWidget", "Yes/No Select", "Yes/No selection for enum fields",
            Set.of(NodeKind.ENUM, NodeKind.STRING), yesNoOptions, WidgetCategory.SPECIALIZED));
        registry.register(new Widget("photo-gallery", "AddPhotoToGallery", "Photo Gallery",
            "Image upload with gallery view for array fields", Set.of(NodeKind.ARRAY), arrayOptions(),
            WidgetCategory.SPECIALIZED));

        registry.addRule(WidgetRegistry::isYesNo, "yesno");
        registry.addRule(WidgetRegistry::isPhotoArray, "photo-gallery");
        return registry;
    }

    /** Registers or replaces a widget by id. */
    public WidgetRegistry register(Widget widget) {
        Objects.requireNonNull(widget, "widget");
        widgets.put(widget.id(), widget);
        return this;
    }

    /**
     * Appends an auto-mapping rule.
     *
     * @throws IllegalArgumentException when {@code widgetId} is not registered
     */
    public WidgetRegistry addRule(Predicate<SchemaNode> predicate, String widgetId) {
        Objects.requireNonNull(predicate, "predicate");
        if (!widgets.containsKey(widgetId)) {
            throw new IllegalArgumentException("Widget " + widgetId + " not found");
        }
        rules.add(new Rule(predicate, widgetId));
        return this;
    }

    public Optional<Widget> widget(String id) {
        return Optional.ofNullable(id == null ? null : widgets.get(id));
    }

    public List<Widget> widgets() {
        return List.copyOf(widgets.values());
    }

    public List<Widget> compatible(NodeKind kind) {
        var out = new ArrayList<Widget>();
        for (Widget widget : widgets.values()) {
            if (widget.accepts(kind)) {
                out.add(widget);
            }
        }
        return out;
    }

    public List<Widget> byCategory(WidgetCategory category) {
        var out = new ArrayList<Widget>();
        for (Widget widget : widgets.values()) {
            if (widget.category() == category) {
                out.add(widget);
            }
        }
        return out;
    }

    /** Widget picked for a node that has no explicit widget. */
    public Optional<Widget> widgetFor(SchemaNode node) {
        for (Rule rule : rules) {
            if (rule.predicate().test(node)) {
                return widget(rule.widgetId());
            }
        }
        for (Widget widget : widgets.values()) {
            if (widget.category() == WidgetCategory.STANDARD && widget.accepts(node.kind())) {
                return Optional.of(widget);
            }
        }
        return Optional.empty();
    }

    static boolean isYesNo(SchemaNode node) {
        if (!(node.details() instanceof NodeDetails.EnumField field)) {
            return false;
        }
        List<Object> values = field.values();
        return values.size() == 2 && values.contains("yes") && values.contains("no");
    }

    static boolean isPhotoArray(SchemaNode node) {
        if (node.kind() != NodeKind.ARRAY || node.key() == null) {
            return false;
        }
        String key = node.key().toLowerCase(Locale.ROOT);
        return key.contains("photo") || key.contains("image") || key.contains("gallery");
    }

    static Map<String, Object> arrayOptions() {
        var options = new LinkedHashMap<String, Object>();
        options.put("addable", true);
        options.put("orderable", true);
        options.put("removable", true);
        return options;
    }

    private static Widget standardWidget(String id, String name, String displayName, String description,
                                         Set<NodeKind> kinds) {
        return new Widget(id, name, displayName, description, kinds, Map.of(), WidgetCategory.STANDARD);
    }

    private record Rule(Predicate<SchemaNode> predicate, String widgetId) {}
}

package work.formgraph.ui;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.logging.Logger;
import work.formgraph.compile.SchemaCompiler;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.shared.JsonValues;

/**
 * Derives the UI schema (widgets, options, field order) of a graph.
 *
 * <p>Generation runs in two passes. The first walks the graph and assigns widgets and options to every field,
 * including fields that only exist inside then/else branches; those are placed at the level of the object that owns
 * the conditional and never appear in its order. The second pass walks the compiled schema and rewrites every
 * {@code ui:order} from the properties actually emitted at that path, so the order key set always matches the
 * compiled property key set.
 */
public final class UiSchemaGenerator {
    private static final Logger LOG = Logger.getLogger(UiSchemaGenerator.class.getName());

    public static final String ORDER = "ui:order";
    public static final String WIDGET = "ui:widget";
    public static final String OPTIONS = "ui:options";
    public static final String COLLAPSIBLE = "ui:collapsible";
    public static final String COLLAPSED = "ui:collapsed";
    public static final String WILDCARD = "*";
    public static final String ITEMS = "items";

    private static final String DEFINITIONS_PREFIX = "#/definitions/";
    private static final List<String> COMBINATORS = List.of("allOf", "anyOf", "oneOf");

    private final WidgetRegistry registry;
    private final SchemaCompiler compiler;
    private final Map<SchemaGraph, Map<String, Object>> cache = Collections.synchronizedMap(new WeakHashMap<>());

    public UiSchemaGenerator(WidgetRegistry registry, SchemaCompiler compiler) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    public UiSchemaGenerator() {
        this(WidgetRegistry.standard(), new SchemaCompiler());
    }

    public WidgetRegistry registry() {
        return registry;
    }

    /**
     * Returns the UI schema of {@code graph}, read-only.
     *
     * @throws work.formgraph.compile.SchemaCompileException when the graph does not compile
     */
    public Map<String, Object> generate(SchemaGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Object> cached = cache.get(graph);
        if (cached != null) {
            return cached;
        }
        Map<String, Object> schema = compiler.compile(graph);
        Map<String, Object> ui = new LinkedHashMap<>();
        fillChildren(graph, graph.root(), ui);
        new OrderSync(JsonValues.objectAt(schema, "definitions")).syncLevel(ui, schema, true);
        Map<String, Object> frozen = JsonValues.freezeObject(ui);
        cache.put(graph, frozen);
        LOG.fine(() -> "Generated UI schema for " + graph);
        return frozen;
    }

    public boolean isCached(SchemaGraph graph) {
        return cache.containsKey(graph);
    }

    public void clearCache() {
        cache.clear();
    }

    /** Collects the order keys of a UI schema level, without the wildcard. */
    public static List<String> orderKeys(Map<String, Object> level) {
        var out = new ArrayList<String>();
        List<Object> order = JsonValues.arrayAt(level, ORDER);
        if (order != null) {
            for (Object key : order) {
                if (!WILDCARD.equals(key)) {
                    out.add(String.valueOf(key));
                }
            }
        }
        return out;
    }

    private Map<String, Object> fieldUi(SchemaGraph graph, SchemaNode node) {
        var ui = new LinkedHashMap<String, Object>();
        assignWidget(node, ui);
        if (node.kind().isObjectLike()) {
            ui.put(COLLAPSIBLE, true);
            ui.put(COLLAPSED, false);
            fillChildren(graph, node, ui);
        } else if (node.kind() == NodeKind.ARRAY) {
            var options = new LinkedHashMap<String, Object>();
            Map<String, Object> current = JsonValues.objectAt(ui, OPTIONS);
            if (current != null) {
                options.putAll(current);
            }
            options.putAll(WidgetRegistry.arrayOptions());
            ui.put(OPTIONS, options);
            List<SchemaNode> items = graph.children(node.id(), EdgeType.CHILD);
            if (!items.isEmpty()) {
                ui.put(ITEMS, fieldUi(graph, items.get(0)));
            }
        }
        return ui;
    }

    private void assignWidget(SchemaNode node, Map<String, Object> ui) {
        if (node.widget() != null && !node.widget().isBlank()) {
            var explicit = registry.widget(node.widget());
            ui.put(WIDGET, node.widget());
            var options = new LinkedHashMap<String, Object>();
            explicit.ifPresent(widget -> options.putAll(widget.defaultOptions()));
            options.putAll(node.widgetOptions());
            if (!options.isEmpty()) {
                ui.put(OPTIONS, JsonValues.deepCopy(options));
            }
            return;
        }
        registry.widgetFor(node).ifPresent(widget -> {
            ui.put(WIDGET, widget.id());
            var options = new LinkedHashMap<String, Object>(widget.defaultOptions());
            options.putAll(node.widgetOptions());
            if (!options.isEmpty()) {
                ui.put(OPTIONS, JsonValues.deepCopy(options));
            }
        });
    }

    /** Places the child fields of an object level and computes its provisional order from the graph. */
    private void fillChildren(SchemaGraph graph, SchemaNode owner, Map<String, Object> level) {
        var order = new ArrayList<Object>();
        for (SchemaNode child : graph.children(owner.id(), EdgeType.CHILD)) {
            if (child.kind().isBranchSource()) {
                placeBranches(graph, child, level, new HashSet<>());
            } else if (child.key() != null && !child.key().isBlank()) {
                place(level, child.key(), fieldUi(graph, child));
                order.add(child.key());
            }
        }
        if (!order.isEmpty()) {
            level.put(ORDER, withWildcard(order));
        }
    }

    private void placeBranches(SchemaGraph graph, SchemaNode conditional, Map<String, Object> level,
                               Set<String> visiting) {
        if (!visiting.add(conditional.id())) {
            return;
        }
        for (EdgeType type : List.of(EdgeType.THEN, EdgeType.ELSE)) {
            for (SchemaNode member : graph.children(conditional.id(), type)) {
                if (member.kind().isBranchSource()) {
                    placeBranches(graph, member, level, visiting);
                } else if (member.key() != null && !member.key().isBlank()) {
                    place(level, member.key(), fieldUi(graph, member));
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void place(Map<String, Object> level, String key, Map<String, Object> fieldUi) {
        Object existing = level.get(key);
        if (existing instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).putAll(fieldUi);
        } else {
            level.put(key, fieldUi);
        }
    }

    static List<Object> withWildcard(List<?> keys) {
        var seen = new LinkedHashSet<String>();
        for (Object key : keys) {
            String text = key == null ? "" : String.valueOf(key).trim();
            if (!text.isEmpty()) {
                seen.add(text);
            }
        }
        seen.add(WILDCARD);
        return new ArrayList<>(seen);
    }

    /** Second pass: rewrites orders from the compiled schema. */
    private static final class OrderSync {
        private final Map<String, Object> definitions;
        private final Set<String> expanding = new HashSet<>();

        OrderSync(Map<String, Object> definitions) {
            this.definitions = definitions == null ? Map.of() : definitions;
        }

        /**
         * Syncs one UI level against a compiled schema. {@code ownLevel} is false for then/else and combinator
         * entries, whose properties land on the enclosing level without joining its order.
         */
        void syncLevel(Map<String, Object> ui, Map<String, Object> schema, boolean ownLevel) {
            String ref = JsonValues.stringAt(schema, "$ref");
            if (ref != null) {
                String name = ref.startsWith(DEFINITIONS_PREFIX) ? ref.substring(DEFINITIONS_PREFIX.length()) : ref;
                Map<String, Object> target = JsonValues.objectAt(definitions, name);
                if (target == null || !expanding.add(name)) {
                    return;
                }
                try {
                    syncLevel(ui, target, ownLevel);
                } finally {
                    expanding.remove(name);
                }
                return;
            }
            Map<String, Object> properties = JsonValues.objectAt(schema, "properties");
            if (ownLevel) {
                if (properties != null && !properties.isEmpty()) {
                    ui.put(ORDER, withWildcard(new ArrayList<>(properties.keySet())));
                } else {
                    ui.remove(ORDER);
                }
            }
            if (properties != null) {
                for (var entry : properties.entrySet()) {
                    syncProperty(ui, entry.getKey(), JsonValues.asObject(entry.getValue()));
                }
            }
            for (String keyword : COMBINATORS) {
                List<Object> entries = JsonValues.arrayAt(schema, keyword);
                if (entries != null) {
                    for (Object entry : entries) {
                        Map<String, Object> sub = JsonValues.asObject(entry);
                        if (sub != null) {
                            syncLevel(ui, sub, false);
                        }
                    }
                }
            }
            for (String keyword : List.of("then", "else")) {
                Map<String, Object> branch = JsonValues.objectAt(schema, keyword);
                if (branch != null) {
                    syncLevel(ui, branch, false);
                }
            }
        }

        private void syncProperty(Map<String, Object> ui, String key, Map<String, Object> schema) {
            Map<String, Object> resolved = resolve(schema);
            if (resolved == null) {
                return;
            }
            if (isObject(resolved)) {
                syncLevel(childLevel(ui, key), schema, true);
            } else if ("array".equals(resolved.get("type"))) {
                Map<String, Object> items = JsonValues.objectAt(resolved, ITEMS);
                if (items != null) {
                    syncProperty(childLevel(ui, key), ITEMS, items);
                }
            }
        }

        private Map<String, Object> resolve(Map<String, Object> schema) {
            String ref = JsonValues.stringAt(schema, "$ref");
            if (ref == null) {
                return schema;
            }
            String name = ref.startsWith(DEFINITIONS_PREFIX) ? ref.substring(DEFINITIONS_PREFIX.length()) : ref;
            return expanding.contains(name) ? null : JsonValues.objectAt(definitions, name);
        }

        private static boolean isObject(Map<String, Object> schema) {
            return "object".equals(schema.get("type")) || schema.containsKey("properties");
        }

        @SuppressWarnings("unchecked")
        private static Map<String, Object> childLevel(Map<String, Object> ui, String key) {
            Object existing = ui.get(key);
            if (existing instanceof Map<?, ?> map) {
                return (Map<String, Object>) map;
            }
            var created = new LinkedHashMap<String, Object>();
            ui.put(key, created);
            return created;
        }
    }
}

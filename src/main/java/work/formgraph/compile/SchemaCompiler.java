package work.formgraph.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.logging.Logger;
import work.formgraph.graph.Combinator;
import work.formgraph.graph.Condition;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.NodeDetails;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.Predicate;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.shared.JsonValues;

/**
 * Compiles a {@link SchemaGraph} into a JSON Schema document.
 *
 * <p>Compilation is a pure function of the graph value, so results are cached per graph instance and handed out
 * read-only. A graph that is no longer referenced drops out of the cache on its own.
 */
public final class SchemaCompiler {
    private static final Logger LOG = Logger.getLogger(SchemaCompiler.class.getName());
    private static final String DEFINITIONS_PREFIX = "#/definitions/";

    private final Map<SchemaGraph, Map<String, Object>> cache = Collections.synchronizedMap(new WeakHashMap<>());

    /**
     * Returns the compiled schema of {@code graph}, read-only.
     *
     * @throws SchemaCompileException when a reachable ref names an unknown definition
     */
    public Map<String, Object> compile(SchemaGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Object> cached = cache.get(graph);
        if (cached != null) {
            return cached;
        }
        var pass = new Pass(graph);
        Map<String, Object> schema = pass.compileNode(graph.root());
        Map<String, Object> definitions = pass.compileDefinitions();
        if (!definitions.isEmpty()) {
            schema.put("definitions", definitions);
        }
        Map<String, Object> frozen = JsonValues.freezeObject(schema);
        cache.put(graph, frozen);
        LOG.fine(() -> "Compiled " + graph + " into a schema with " + definitions.size() + " definition(s)");
        return frozen;
    }

    public boolean isCached(SchemaGraph graph) {
        return cache.containsKey(graph);
    }

    public void clearCache() {
        cache.clear();
    }

    /** State of one compilation: the graph and the definition names reached so far. */
    private static final class Pass {
        private final SchemaGraph graph;
        private final Set<String> referenced = new LinkedHashSet<>();

        private Pass(SchemaGraph graph) {
            this.graph = graph;
        }

        Map<String, Object> compileNode(SchemaNode node) {
            return switch (node.kind()) {
                case REF -> compileRef(node);
                case ALL_OF, ANY_OF, ONE_OF -> compileGroup(node);
                case IF_BLOCK -> compileIfBlock(node);
                default -> compileField(node);
            };
        }

        /** Compiles every referenced definition, following refs found inside definitions. */
        Map<String, Object> compileDefinitions() {
            var compiled = new LinkedHashMap<String, Object>();
            String next = nextPending(compiled);
            while (next != null) {
                String nodeId = graph.definitions().get(next);
                compiled.put(next, compileNode(graph.requireNode(nodeId)));
                next = nextPending(compiled);
            }
            var ordered = new LinkedHashMap<String, Object>();
            for (String name : graph.definitions().keySet()) {
                if (compiled.containsKey(name)) {
                    ordered.put(name, compiled.get(name));
                }
            }
            return ordered;
        }

        private String nextPending(Map<String, Object> compiled) {
            for (String name : referenced) {
                if (!compiled.containsKey(name)) {
                    return name;
                }
            }
            return null;
        }

        private Map<String, Object> compileRef(SchemaNode node) {
            var ref = (NodeDetails.Reference) node.details();
            String target = ref.refTarget();
            String definitionId = target == null ? null : graph.definitions().get(target);
            if (definitionId == null || !graph.contains(definitionId)) {
                throw new SchemaCompileException("Unresolved reference '" + target + "' at node " + node.id());
            }
            referenced.add(target);
            var schema = new LinkedHashMap<String, Object>();
            schema.put("$ref", DEFINITIONS_PREFIX + target);
            if (node.title() != null) {
                schema.put("title", node.title());
            }
            if (node.description() != null && !node.description().isBlank()) {
                schema.put("description", node.description());
            }
            return schema;
        }

        private Map<String, Object> compileField(SchemaNode node) {
            var schema = new LinkedHashMap<String, Object>();
            schema.put("type", node.details() instanceof NodeDetails.EnumField enumField
                ? enumField.valueType()
                : schemaType(node.kind()));
            if (node.title() != null) {
                schema.put("title", node.title());
            }
            if (node.description() != null && !node.description().isBlank()) {
                schema.put("description", node.description());
            }
            if (node.defaultValue() != null) {
                schema.put("default", JsonValues.deepCopy(node.defaultValue()));
            }
            NodeDetails details = node.details();
            if (details instanceof NodeDetails.EnumField choice) {
                schema.put("enum", new ArrayList<Object>(choice.values()));
                if (choice.labels() != null) {
                    schema.put("enumNames", new ArrayList<Object>(choice.labels()));
                }
            } else if (details instanceof NodeDetails.ObjectField || details instanceof NodeDetails.DefinitionMarker) {
                compileObjectBody(node, schema);
                schema.putAll(details.attributes());
            } else if (details instanceof NodeDetails.ArrayField) {
                List<SchemaNode> items = graph.children(node.id(), EdgeType.CHILD);
                if (!items.isEmpty()) {
                    schema.put("items", compileNode(items.get(0)));
                }
                schema.putAll(details.attributes());
            } else {
                schema.putAll(details.attributes());
            }
            return schema;
        }

        private void compileObjectBody(SchemaNode node, Map<String, Object> schema) {
            List<SchemaNode> children = graph.children(node.id(), EdgeType.CHILD);
            if (children.isEmpty()) {
                return;
            }
            var properties = new LinkedHashMap<String, Object>();
            var required = new ArrayList<Object>();
            var groups = new ArrayList<GroupEntries>();
            var nested = new ArrayList<Object>();
            for (SchemaNode child : children) {
                if (child.details() instanceof NodeDetails.ConditionalGroup group) {
                    if (group.conditions().isEmpty()) {
                        continue;
                    }
                    Map<String, Object> compiled = compileGroup(child);
                    List<Object> entries = JsonValues.arrayAt(compiled, group.combinator().keyword());
                    if (entries != null && compiled.size() == 1) {
                        groups.add(new GroupEntries(group.combinator(), entries, compiled));
                    } else if (group.conditions().size() == 1) {
                        var wrapper = new LinkedHashMap<String, Object>();
                        wrapper.put(group.combinator().keyword(), new ArrayList<Object>(List.of(compiled)));
                        groups.add(new GroupEntries(group.combinator(), List.of(compiled), wrapper));
                    } else {
                        nested.add(compiled);
                    }
                } else if (child.kind() == NodeKind.IF_BLOCK) {
                    nested.add(compileIfBlock(child));
                } else if (child.key() == null || child.key().isBlank()) {
                    LOG.fine(() -> "Skipping child " + child.id() + " without a key");
                } else {
                    properties.put(child.key(), compileNode(child));
                    if (child.required()) {
                        required.add(child.key());
                    }
                }
            }
            schema.put("properties", properties);
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
            foldConditionals(schema, groups, nested);
        }

        /**
         * A single group puts its entries under its own combinator; same-combinator groups concatenate; mixed
         * combinators become allOf entries. If-blocks and compacted groups always go to allOf.
         */
        private void foldConditionals(Map<String, Object> schema, List<GroupEntries> groups, List<Object> nested) {
            Combinator combinator = null;
            List<Object> combined = null;
            if (!groups.isEmpty()) {
                Combinator first = groups.get(0).combinator();
                boolean same = groups.stream().allMatch(group -> group.combinator() == first);
                if (same) {
                    combinator = first;
                    combined = new ArrayList<>();
                    for (GroupEntries group : groups) {
                        combined.addAll(group.entries());
                    }
                } else {
                    var wrapped = new ArrayList<Object>();
                    for (GroupEntries group : groups) {
                        wrapped.add(group.schema());
                    }
                    wrapped.addAll(nested);
                    nested = wrapped;
                }
            }
            if (combined != null && nested.isEmpty()) {
                schema.put(combinator.keyword(), combined);
                return;
            }
            if (nested.isEmpty()) {
                return;
            }
            var allOf = new ArrayList<Object>();
            if (combined != null) {
                if (combinator == Combinator.ALL_OF) {
                    allOf.addAll(combined);
                } else {
                    var wrapper = new LinkedHashMap<String, Object>();
                    wrapper.put(combinator.keyword(), combined);
                    allOf.add(wrapper);
                }
            }
            allOf.addAll(nested);
            schema.put("allOf", allOf);
        }

        private Map<String, Object> compileGroup(SchemaNode node) {
            var group = (NodeDetails.ConditionalGroup) node.details();
            List<Condition> conditions = group.conditions();
            if (conditions.isEmpty()) {
                return emptyObject();
            }
            boolean strict = group.combinator().isStrict();
            String sharedThen = conditions.get(0).thenId();
            String sharedElse = conditions.get(0).elseId();
            boolean allShareThen = conditions.stream().allMatch(c -> Objects.equals(c.thenId(), sharedThen));
            boolean allShareElse = conditions.stream().allMatch(c -> Objects.equals(c.elseId(), sharedElse));
            List<SchemaNode> edgeThen = graph.children(node.id(), EdgeType.THEN);
            List<SchemaNode> edgeElse = graph.children(node.id(), EdgeType.ELSE);

            if (allShareThen && allShareElse) {
                Map<String, Object> thenSchema = edgeThen.isEmpty()
                    ? branchSchema(existing(sharedThen))
                    : branchSchema(edgeThen);
                if (thenSchema != null) {
                    Map<String, Object> elseSchema = edgeElse.isEmpty()
                        ? branchSchema(existing(sharedElse))
                        : branchSchema(edgeElse);
                    var predicates = new ArrayList<Predicate>(conditions.size());
                    for (Condition condition : conditions) {
                        predicates.add(condition.when());
                    }
                    var compact = new LinkedHashMap<String, Object>();
                    compact.put("if", PredicateCompiler.combine(group.combinator(), predicates));
                    compact.put("then", thenSchema);
                    if (elseSchema != null) {
                        compact.put("else", elseSchema);
                    } else if (strict) {
                        compact.put("else", failingBranch());
                    }
                    return compact;
                }
            }

            List<SchemaNode> unclaimedThen = unclaimed(edgeThen, conditions, true);
            List<SchemaNode> unclaimedElse = unclaimed(edgeElse, conditions, false);
            var entries = new ArrayList<Object>(conditions.size());
            for (Condition condition : conditions) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("if", PredicateCompiler.compile(condition.when()));
                Map<String, Object> thenSchema = graph.contains(condition.thenId())
                    ? branchSchema(existing(condition.thenId()))
                    : branchSchema(unclaimedThen);
                if (thenSchema != null) {
                    entry.put("then", thenSchema);
                }
                Map<String, Object> elseSchema = graph.contains(condition.elseId())
                    ? branchSchema(existing(condition.elseId()))
                    : branchSchema(unclaimedElse);
                if (elseSchema != null) {
                    entry.put("else", elseSchema);
                } else if (strict) {
                    entry.put("else", failingBranch());
                }
                entries.add(entry);
            }
            var schema = new LinkedHashMap<String, Object>();
            schema.put(group.combinator().keyword(), entries);
            return schema;
        }

        private Map<String, Object> compileIfBlock(SchemaNode node) {
            var block = (NodeDetails.IfBlock) node.details();
            if (block.condition() == null) {
                return emptyObject();
            }
            List<SchemaNode> thenNodes = branchNodes(node, EdgeType.THEN, block.thenIds());
            List<SchemaNode> elseNodes = branchNodes(node, EdgeType.ELSE, block.elseIds());
            Map<String, Object> thenSchema = branchSchema(thenNodes);
            var schema = new LinkedHashMap<String, Object>();
            schema.put("if", PredicateCompiler.compile(block.condition()));
            schema.put("then", thenSchema == null ? emptyObject() : thenSchema);
            Map<String, Object> elseSchema = branchSchema(elseNodes);
            if (elseSchema != null) {
                schema.put("else", elseSchema);
            }
            return schema;
        }

        /** Then/else edges win; legacy id lists are used only when the block has no such edges. */
        private List<SchemaNode> branchNodes(SchemaNode node, EdgeType type, List<String> legacyIds) {
            List<SchemaNode> fromEdges = graph.children(node.id(), type);
            if (!fromEdges.isEmpty()) {
                return fromEdges;
            }
            var out = new ArrayList<SchemaNode>();
            for (String id : legacyIds) {
                graph.node(id).ifPresent(out::add);
            }
            return out;
        }

        /**
         * Schema of a then/else branch. Property-like nodes are added as properties under their key; conditional
         * nodes are nested under allOf. A branch made of one conditional node is that node's schema.
         */
        private Map<String, Object> branchSchema(List<SchemaNode> nodes) {
            if (nodes.isEmpty()) {
                return null;
            }
            if (nodes.size() == 1 && isConditional(nodes.get(0))) {
                return compileNode(nodes.get(0));
            }
            var properties = new LinkedHashMap<String, Object>();
            var required = new ArrayList<Object>();
            var nested = new ArrayList<Object>();
            for (SchemaNode member : nodes) {
                if (isConditional(member)) {
                    nested.add(compileNode(member));
                } else if (member.key() != null && !member.key().isBlank()) {
                    properties.put(member.key(), compileNode(member));
                    if (member.required() && !required.contains(member.key())) {
                        required.add(member.key());
                    }
                }
            }
            if (properties.isEmpty() && nested.isEmpty()) {
                return null;
            }
            var schema = new LinkedHashMap<String, Object>();
            schema.put("type", "object");
            if (!properties.isEmpty()) {
                schema.put("properties", properties);
            }
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
            if (!nested.isEmpty()) {
                schema.put("allOf", nested);
            }
            return schema;
        }

        private List<SchemaNode> existing(String nodeId) {
            return graph.node(nodeId).map(List::of).orElse(List.of());
        }

        private List<SchemaNode> unclaimed(List<SchemaNode> bucket, List<Condition> conditions, boolean then) {
            var claimed = new LinkedHashSet<String>();
            for (Condition condition : conditions) {
                String id = then ? condition.thenId() : condition.elseId();
                if (id != null) {
                    claimed.add(id);
                }
            }
            var out = new ArrayList<SchemaNode>();
            for (SchemaNode member : bucket) {
                if (!claimed.contains(member.id())) {
                    out.add(member);
                }
            }
            return out;
        }
    }

    private record GroupEntries(Combinator combinator, List<Object> entries, Map<String, Object> schema) {}

    static boolean isConditional(SchemaNode node) {
        return node.kind().isBranchSource();
    }

    static String schemaType(NodeKind kind) {
        return switch (kind) {
            case STRING, ENUM -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case ARRAY -> "array";
            default -> "object";
        };
    }

    private static Map<String, Object> emptyObject() {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("type", "object");
        schema.put("properties", new LinkedHashMap<String, Object>());
        return schema;
    }

    private static Map<String, Object> failingBranch() {
        var schema = new LinkedHashMap<String, Object>();
        schema.put("not", new LinkedHashMap<String, Object>());
        return schema;
    }
}

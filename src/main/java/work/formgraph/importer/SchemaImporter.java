package work.formgraph.importer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import work.formgraph.compile.PredicateCompiler;
import work.formgraph.graph.Combinator;
import work.formgraph.graph.Condition;
import work.formgraph.graph.ConditionalGroups;
import work.formgraph.graph.EdgeType;
import work.formgraph.graph.GraphMutations;
import work.formgraph.graph.NodeAdded;
import work.formgraph.graph.NodeDetails;
import work.formgraph.graph.NodeKind;
import work.formgraph.graph.NodePatch;
import work.formgraph.graph.Predicate;
import work.formgraph.graph.SchemaGraph;
import work.formgraph.graph.SchemaNode;
import work.formgraph.shared.JsonValues;

/**
 * Rebuilds a {@link SchemaGraph} from a JSON Schema document.
 *
 * <p>Definitions are imported first as detached nodes; references to definitions declared later are patched once
 * the whole document has been read. Unsupported keywords and fragments are skipped and reported as warnings.
 *
 * <p>Conditional entries of one combinator become a single group when that is lossless: one entry, or entries whose
 * branches each hold at most one property under distinct keys. Otherwise every entry gets a group of its own, which
 * the compiler folds back into one combinator array.
 */
public final class SchemaImporter {
    private static final Logger LOG = Logger.getLogger(SchemaImporter.class.getName());
    private static final String REF_PREFIX = "#/definitions/";
    private static final Set<String> SUPPORTED_KEYWORDS = Set.of(
        "$schema", "$id", "$ref", "type", "title", "description", "default", "definitions",
        "properties", "required", "items", "enum", "enumNames",
        "minLength", "maxLength", "pattern", "format",
        "minimum", "maximum", "multipleOf", "exclusiveMinimum", "exclusiveMaximum",
        "minItems", "maxItems", "uniqueItems", "additionalItems",
        "minProperties", "maxProperties", "additionalProperties",
        "allOf", "anyOf", "oneOf", "if", "then", "else");
    private static final Set<String> FIELD_KEYWORDS = fieldKeywords();

    private final boolean strictReferences;

    public SchemaImporter() {
        this(true);
    }

    /**
     * @param strictReferences when true a {@code $ref} to an unknown definition aborts the import; otherwise the
     *     reference is dropped with a warning
     */
    public SchemaImporter(boolean strictReferences) {
        this.strictReferences = strictReferences;
    }

    public boolean strictReferences() {
        return strictReferences;
    }

    public ImportResult importSchema(Object document) {
        Map<String, Object> schema = JsonValues.asObject(document);
        if (schema == null) {
            throw new SchemaImportException("Schema document must be a JSON object");
        }
        var run = new Run();
        run.importRoot(schema);
        run.resolveReferences();
        LOG.fine(() -> "Imported schema into " + run.graph + " with " + run.warnings.size() + " warning(s)");
        return new ImportResult(run.graph, run.warnings);
    }

    /** One single-predicate conditional entry waiting to be grouped. */
    private record Entry(Predicate predicate, Map<String, Object> thenBranch, Map<String, Object> elseBranch,
                         String path) {}

    private final class Run {
        private SchemaGraph graph = SchemaGraph.empty();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, String> pendingRefs = new LinkedHashMap<>();

        void importRoot(Map<String, Object> schema) {
            checkKeywords(schema, "#");
            Object type = schema.get("type");
            if (type != null && !"object".equals(type)) {
                warn("Root type '" + type + "' is not supported; the root is always an object");
            }
            if (schema.containsKey("$ref")) {
                warn("Root $ref is not supported; ignored");
            }
            Object definitions = schema.get("definitions");
            if (definitions != null) {
                Map<String, Object> byName = JsonValues.asObject(definitions);
                if (byName == null) {
                    warn("'definitions' must be an object; ignored");
                } else {
                    for (var entry : byName.entrySet()) {
                        importDefinition(entry.getKey(), entry.getValue(), "#/definitions/" + entry.getKey());
                    }
                }
            }

            var patch = NodePatch.empty();
            String title = JsonValues.stringAt(schema, "title");
            if (title != null) {
                patch = patch.title(title);
            }
            String description = JsonValues.stringAt(schema, "description");
            if (description != null) {
                patch = patch.description(description);
            }
            for (var attribute : attributes(NodeKind.OBJECT, schema, "#").entrySet()) {
                patch = patch.set(attribute.getKey(), attribute.getValue());
            }
            graph = GraphMutations.updateNode(graph, SchemaGraph.ROOT_ID, patch);
            importObjectBody(SchemaGraph.ROOT_ID, schema, "#");
        }

        void resolveReferences() {
            for (var pending : pendingRefs.entrySet()) {
                String refId = pending.getKey();
                String name = pending.getValue();
                if (!graph.contains(refId)) {
                    continue;
                }
                String definitionId = graph.definitions().get(name);
                if (definitionId != null) {
                    graph = GraphMutations.updateNode(graph, refId,
                        NodePatch.empty().set("resolvedNodeId", definitionId));
                } else if (strictReferences) {
                    throw new SchemaImportException("Dangling reference '" + REF_PREFIX + name + "'");
                } else {
                    warn("Dangling reference '" + REF_PREFIX + name + "'; reference skipped");
                    graph = GraphMutations.removeNode(graph, refId);
                }
            }
        }

        private void importDefinition(String name, Object raw, String path) {
            Map<String, Object> schema = JsonValues.asObject(raw);
            if (schema == null) {
                warn("Definition at " + path + " is not an object; skipped");
                return;
            }
            if (schema.containsKey("$ref")) {
                String target = refName(schema, path);
                if (target == null) {
                    return;
                }
                NodeAdded added = GraphMutations.createDefinition(graph, name, refNode(name, target, schema, false));
                graph = added.graph();
                trackRef(added.nodeId(), target);
                return;
            }
            NodeKind kind = isPureConditional(schema) ? NodeKind.OBJECT : resolveKind(schema, path);
            if (kind == null) {
                return;
            }
            checkKeywords(schema, path);
            NodeAdded added = GraphMutations.createDefinition(graph, name, buildNode(kind, name, schema, false, path));
            graph = added.graph();
            populate(added.nodeId(), kind, schema, path);
        }

        /**
         * Imports one property schema under {@code parentId}. Returns the new node id, or null when skipped.
         */
        private String importNode(String parentId, EdgeType edgeType, String key, Object raw, List<String> required,
                                  String path) {
            Map<String, Object> schema = JsonValues.asObject(raw);
            if (schema == null) {
                warn("Schema at " + path + " is not an object; skipped");
                return null;
            }
            boolean isRequired = required.contains(key);
            if (schema.containsKey("$ref")) {
                return importRef(parentId, edgeType, key, schema, isRequired, path);
            }
            if (isPureConditional(schema)) {
                List<String> ids = importConditionals(parentId, edgeType, schema, path);
                return ids.isEmpty() ? null : ids.get(0);
            }
            NodeKind kind = resolveKind(schema, path);
            if (kind == null) {
                return null;
            }
            checkKeywords(schema, path);
            if (schema.containsKey("definitions")) {
                warn("Nested definitions at " + path + " are not supported; ignored");
            }
            NodeAdded added = GraphMutations.addNode(graph, buildNode(kind, key, schema, isRequired, path), parentId,
                edgeType);
            graph = added.graph();
            String actualKey = added.node().key();
            if (!Objects.equals(actualKey, key)) {
                warn("Key '" + key + "' at " + path + " collides with a sibling; imported as '" + actualKey + "'");
            }
            populate(added.nodeId(), kind, schema, path);
            return added.nodeId();
        }

        private void populate(String nodeId, NodeKind kind, Map<String, Object> schema, String path) {
            boolean conditional = hasConditionals(schema);
            if (kind == NodeKind.OBJECT) {
                importObjectBody(nodeId, schema, path);
                return;
            }
            if (kind == NodeKind.ARRAY) {
                Object items = schema.get("items");
                if (items instanceof List<?> tuple) {
                    warn("Tuple items at " + path + " are not supported; using the first item schema");
                    items = tuple.isEmpty() ? null : tuple.get(0);
                }
                if (items != null) {
                    importNode(nodeId, EdgeType.CHILD, "item", items, List.of(), path + "/items");
                }
            }
            if (conditional) {
                warn("Conditionals on a " + kind.tag() + " schema at " + path + " are not supported; ignored");
            }
        }

        private void importObjectBody(String nodeId, Map<String, Object> schema, String path) {
            importProperties(nodeId, EdgeType.CHILD, schema, path);
            importConditionals(nodeId, EdgeType.CHILD, schema, path);
        }

        /** Imports {@code properties}; returns the created ids in declaration order. */
        private List<String> importProperties(String parentId, EdgeType edgeType, Map<String, Object> schema,
                                              String path) {
            var ids = new ArrayList<String>();
            Object rawProperties = schema.get("properties");
            if (rawProperties == null) {
                return ids;
            }
            Map<String, Object> properties = JsonValues.asObject(rawProperties);
            if (properties == null) {
                warn("'properties' at " + path + " must be an object; ignored");
                return ids;
            }
            List<String> required = JsonValues.stringsAt(schema, "required");
            if (required == null) {
                required = List.of();
            }
            for (var entry : properties.entrySet()) {
                String id = importNode(parentId, edgeType, entry.getKey(), entry.getValue(), required,
                    path + "/properties/" + entry.getKey());
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        }

        private List<String> importConditionals(String parentId, EdgeType edgeType, Map<String, Object> schema,
                                                String path) {
            var ids = new ArrayList<String>();
            for (Combinator combinator : Combinator.values()) {
                Object raw = schema.get(combinator.keyword());
                if (raw == null) {
                    continue;
                }
                List<Object> entries = JsonValues.asArray(raw);
                if (entries == null) {
                    warn("'" + combinator.keyword() + "' at " + path + " must be an array; ignored");
                    continue;
                }
                ids.addAll(importCombinator(parentId, edgeType, combinator, entries,
                    path + "/" + combinator.keyword()));
            }
            if (schema.containsKey("if")) {
                String id = importIf(parentId, edgeType, schema, path);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        }

        private List<String> importCombinator(String parentId, EdgeType edgeType, Combinator combinator,
                                              List<Object> entries, String path) {
            var ids = new ArrayList<String>();
            var singles = new ArrayList<Entry>();
            for (int i = 0; i < entries.size(); i++) {
                String entryPath = path + "/" + i;
                Map<String, Object> entry = JsonValues.asObject(entries.get(i));
                if (entry == null) {
                    warn("Entry at " + entryPath + " is not an object; skipped");
                    continue;
                }
                if (entry.containsKey("if")) {
                    var predicates = PredicateCompiler.decompileCombined(JsonValues.objectAt(entry, "if"));
                    if (predicates.isEmpty()) {
                        warn("Unsupported condition at " + entryPath + "/if; entry skipped");
                        continue;
                    }
                    var set = predicates.get();
                    Map<String, Object> thenBranch = JsonValues.objectAt(entry, "then");
                    Map<String, Object> elseBranch = JsonValues.objectAt(entry, "else");
                    if (set.combinator() != null && set.predicates().size() > 1) {
                        ids.add(importSharedGroup(parentId, edgeType, set.combinator(), set.predicates(),
                            thenBranch, elseBranch, entryPath));
                    } else {
                        singles.add(new Entry(set.predicates().get(0), thenBranch, elseBranch, entryPath));
                    }
                } else if (isPureConditional(entry)) {
                    ids.addAll(importConditionals(parentId, edgeType, entry, entryPath));
                } else if (combinator == Combinator.ALL_OF && entry.containsKey("properties")) {
                    ids.addAll(importProperties(parentId, edgeType, entry, entryPath));
                    ids.addAll(importConditionals(parentId, edgeType, entry, entryPath));
                } else {
                    warn("Unsupported " + combinator.keyword() + " entry at " + entryPath + "; skipped");
                }
            }
            ids.addAll(importSingles(parentId, edgeType, combinator, singles));
            return ids;
        }

        private List<String> importSingles(String parentId, EdgeType edgeType, Combinator combinator,
                                           List<Entry> singles) {
            var ids = new ArrayList<String>();
            if (singles.isEmpty()) {
                return ids;
            }
            if (singles.size() == 1 || canShareGroup(singles)) {
                NodeAdded group = ConditionalGroups.addGroup(graph, combinator, parentId, edgeType);
                graph = group.graph();
                for (Entry entry : singles) {
                    String thenId = importBranch(group.nodeId(), EdgeType.THEN, entry.thenBranch(),
                        entry.path() + "/then");
                    String elseId = importBranch(group.nodeId(), EdgeType.ELSE, entry.elseBranch(),
                        entry.path() + "/else");
                    graph = ConditionalGroups.addCondition(graph, group.nodeId(),
                        new Condition(entry.predicate(), thenId, elseId));
                }
                ids.add(group.nodeId());
                return ids;
            }
            if (combinator.isStrict() && allBranchesEqual(singles)) {
                var predicates = new ArrayList<Predicate>();
                for (Entry entry : singles) {
                    predicates.add(entry.predicate());
                }
                Entry first = singles.get(0);
                ids.add(importSharedGroup(parentId, edgeType, combinator, predicates, first.thenBranch(),
                    first.elseBranch(), first.path()));
                return ids;
            }
            for (Entry entry : singles) {
                ids.addAll(importSingles(parentId, edgeType, combinator, List.of(entry)));
            }
            return ids;
        }

        /** A group whose conditions all point at the same imported then/else branches. */
        private String importSharedGroup(String parentId, EdgeType edgeType, Combinator combinator,
                                         List<Predicate> predicates, Map<String, Object> thenBranch,
                                         Map<String, Object> elseBranch, String path) {
            NodeAdded group = ConditionalGroups.addGroup(graph, combinator, parentId, edgeType);
            graph = group.graph();
            String thenId = importBranch(group.nodeId(), EdgeType.THEN, thenBranch, path + "/then");
            String elseId = importBranch(group.nodeId(), EdgeType.ELSE, elseBranch, path + "/else");
            for (Predicate predicate : predicates) {
                graph = ConditionalGroups.addCondition(graph, group.nodeId(), new Condition(predicate, thenId, elseId));
            }
            return group.nodeId();
        }

        /** Object-level {@code if}: an if-block, or a shared group when the {@code if} combines predicates. */
        private String importIf(String parentId, EdgeType edgeType, Map<String, Object> schema, String path) {
            var predicates = PredicateCompiler.decompileCombined(JsonValues.objectAt(schema, "if"));
            if (predicates.isEmpty()) {
                warn("Unsupported condition at " + path + "/if; skipped");
                return null;
            }
            var set = predicates.get();
            Map<String, Object> thenBranch = JsonValues.objectAt(schema, "then");
            Map<String, Object> elseBranch = JsonValues.objectAt(schema, "else");
            if (set.combinator() != null && set.predicates().size() > 1) {
                return importSharedGroup(parentId, edgeType, set.combinator(), set.predicates(), thenBranch,
                    elseBranch, path);
            }
            var block = SchemaNode.builder(new NodeDetails.IfBlock(set.predicates().get(0), null, null))
                .key("if_block")
                .title("If Block")
                .build();
            NodeAdded added = GraphMutations.addNode(graph, block, parentId, edgeType);
            graph = added.graph();
            importBranch(added.nodeId(), EdgeType.THEN, thenBranch, path + "/then");
            importBranch(added.nodeId(), EdgeType.ELSE, elseBranch, path + "/else");
            return added.nodeId();
        }

        /**
         * Imports the members of a then/else branch under {@code sourceId}. Returns the first member id, used as the
         * condition's branch pointer, or null when the branch adds nothing.
         */
        private String importBranch(String sourceId, EdgeType type, Map<String, Object> branch, String path) {
            if (branch == null || isFailingBranch(branch)) {
                return null;
            }
            if (branch.containsKey("$ref")) {
                return importRef(sourceId, type, type.wireName() + "_branch", branch, false, path);
            }
            checkKeywords(branch, path);
            var ids = new ArrayList<String>(importProperties(sourceId, type, branch, path));
            ids.addAll(importConditionals(sourceId, type, branch, path));
            List<String> required = JsonValues.stringsAt(branch, "required");
            Map<String, Object> properties = JsonValues.objectAt(branch, "properties");
            if (required != null) {
                for (String key : required) {
                    if (properties == null || !properties.containsKey(key)) {
                        warn("Branch at " + path + " requires '" + key + "' without declaring it; ignored");
                    }
                }
            }
            return ids.isEmpty() ? null : ids.get(0);
        }

        private String importRef(String parentId, EdgeType edgeType, String key, Map<String, Object> schema,
                                 boolean required, String path) {
            String target = refName(schema, path);
            if (target == null) {
                return null;
            }
            NodeAdded added = GraphMutations.addNode(graph, refNode(key, target, schema, required), parentId, edgeType);
            graph = added.graph();
            trackRef(added.nodeId(), target);
            return added.nodeId();
        }

        private SchemaNode refNode(String key, String target, Map<String, Object> schema, boolean required) {
            String title = JsonValues.stringAt(schema, "title");
            return SchemaNode.builder(new NodeDetails.Reference(target, graph.definitions().get(target)))
                .key(key)
                .title(title == null ? target : title)
                .description(JsonValues.stringAt(schema, "description"))
                .required(required)
                .build();
        }

        private void trackRef(String refId, String target) {
            if (!graph.definitions().containsKey(target)) {
                pendingRefs.put(refId, target);
            }
        }

        private String refName(Map<String, Object> schema, String path) {
            String ref = JsonValues.stringAt(schema, "$ref");
            if (ref == null || !ref.startsWith(REF_PREFIX) || ref.length() == REF_PREFIX.length()) {
                warn("Unsupported $ref '" + schema.get("$ref") + "' at " + path + "; skipped");
                return null;
            }
            return ref.substring(REF_PREFIX.length());
        }

        private SchemaNode buildNode(NodeKind kind, String key, Map<String, Object> schema, boolean required,
                                     String path) {
            return SchemaNode.builder(kind)
                .key(key)
                .title(JsonValues.stringAt(schema, "title"))
                .description(JsonValues.stringAt(schema, "description"))
                .required(required)
                .defaultValue(JsonValues.deepCopy(schema.get("default")))
                .attributes(attributes(kind, schema, path))
                .build();
        }

        /** Keyword attributes of {@code kind} present in the schema; malformed values are dropped with a warning. */
        private Map<String, Object> attributes(NodeKind kind, Map<String, Object> schema, String path) {
            Set<String> names = NodeDetails.attributeNames(kind);
            var accepted = new LinkedHashMap<String, Object>();
            NodeDetails template = NodeDetails.defaults(kind);
            for (String keyword : schema.keySet()) {
                if (!FIELD_KEYWORDS.contains(keyword) || schema.get(keyword) == null) {
                    continue;
                }
                if (!names.contains(keyword)) {
                    warn("Keyword '" + keyword + "' does not apply to " + kind.tag() + " at " + path + "; ignored");
                    continue;
                }
                var single = new LinkedHashMap<String, Object>();
                single.put(keyword, schema.get(keyword));
                try {
                    template.withAttributes(single);
                    accepted.put(keyword, schema.get(keyword));
                } catch (IllegalArgumentException e) {
                    warn(e.getMessage() + " at " + path + "; ignored");
                }
            }
            return accepted;
        }

        private NodeKind resolveKind(Map<String, Object> schema, String path) {
            Object type = schema.get("type");
            String name = null;
            if (type instanceof String text) {
                name = text;
            } else if (type instanceof List<?> union) {
                for (Object member : union) {
                    if (member instanceof String text && !"null".equals(text)) {
                        name = text;
                        break;
                    }
                }
                if (union.size() > 1) {
                    warn("Union type " + union + " at " + path + " reduced to '" + name + "'");
                }
                if (name == null) {
                    name = "null";
                }
            } else if (type != null) {
                warn("Unsupported type " + type + " at " + path + "; skipped");
                return null;
            }
            boolean hasEnum = schema.get("enum") instanceof List<?>;
            if (name == null) {
                if (hasEnum) {
                    return NodeKind.ENUM;
                }
                if (schema.containsKey("properties")) {
                    return NodeKind.OBJECT;
                }
                if (schema.containsKey("items")) {
                    return NodeKind.ARRAY;
                }
                warn("No type at " + path + "; imported as string");
                return NodeKind.STRING;
            }
            switch (name) {
                case "string":
                    return hasEnum ? NodeKind.ENUM : NodeKind.STRING;
                case "integer":
                case "number":
                    if ("integer".equals(name)) {
                        warn("Integer type at " + path + " imported as number");
                    }
                    return hasEnum ? NodeKind.ENUM : NodeKind.NUMBER;
                case "boolean":
                    return hasEnum ? NodeKind.ENUM : NodeKind.BOOLEAN;
                case "object":
                    return NodeKind.OBJECT;
                case "array":
                    return NodeKind.ARRAY;
                case "null":
                    warn("Null type at " + path + " is not supported; skipped");
                    return null;
                default:
                    warn("Unknown type '" + name + "' at " + path + "; skipped");
                    return null;
            }
        }

        private void checkKeywords(Map<String, Object> schema, String path) {
            for (String keyword : schema.keySet()) {
                if (!SUPPORTED_KEYWORDS.contains(keyword)) {
                    warn("Unsupported keyword '" + keyword + "' at " + path + "; ignored");
                }
            }
        }

        private void warn(String message) {
            warnings.add(message);
            LOG.warning(message);
        }
    }

    private static boolean hasConditionals(Map<String, Object> schema) {
        return schema.containsKey("allOf") || schema.containsKey("anyOf") || schema.containsKey("oneOf")
            || schema.containsKey("if");
    }

    /** Conditionals without a type or any structure of their own. */
    private static boolean isPureConditional(Map<String, Object> schema) {
        return hasConditionals(schema) && schema.get("type") == null && !schema.containsKey("properties")
            && !schema.containsKey("items") && !schema.containsKey("enum");
    }

    static boolean isFailingBranch(Map<String, Object> branch) {
        Map<String, Object> not = JsonValues.objectAt(branch, "not");
        return branch.size() == 1 && not != null && not.isEmpty();
    }

    /**
     * True when every branch adds at most one property and the keys stay distinct, so one group can carry all
     * entries with one branch node per condition.
     */
    private static boolean canShareGroup(List<Entry> singles) {
        var thenKeys = new HashSet<String>();
        var elseKeys = new HashSet<String>();
        for (Entry entry : singles) {
            if (!singleMemberBranch(entry.thenBranch(), thenKeys) || !singleMemberBranch(entry.elseBranch(), elseKeys)) {
                return false;
            }
        }
        return true;
    }

    private static boolean singleMemberBranch(Map<String, Object> branch, Set<String> keys) {
        if (branch == null || isFailingBranch(branch)) {
            return true;
        }
        if (branch.containsKey("$ref") || hasConditionals(branch)) {
            return false;
        }
        Map<String, Object> properties = JsonValues.objectAt(branch, "properties");
        if (properties == null || properties.isEmpty()) {
            return true;
        }
        return properties.size() == 1 && keys.add(properties.keySet().iterator().next());
    }

    private static boolean allBranchesEqual(List<Entry> singles) {
        Entry first = singles.get(0);
        for (Entry entry : singles) {
            if (!Objects.equals(normalized(entry.thenBranch()), normalized(first.thenBranch()))
                    || !Objects.equals(normalized(entry.elseBranch()), normalized(first.elseBranch()))) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> normalized(Map<String, Object> branch) {
        return branch == null || isFailingBranch(branch) ? null : branch;
    }

    private static Set<String> fieldKeywords() {
        var keywords = new HashSet<String>();
        for (NodeKind kind : List.of(NodeKind.STRING, NodeKind.NUMBER, NodeKind.ENUM, NodeKind.OBJECT,
                NodeKind.ARRAY)) {
            keywords.addAll(NodeDetails.attributeNames(kind));
        }
        return Set.copyOf(keywords);
    }
}

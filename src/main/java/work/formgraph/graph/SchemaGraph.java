package work.formgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable form graph: nodes, typed ordered edges and the definition registry, plus indices derived from them.
 *
 * <p>Every mutation in {@link GraphMutations} returns a new instance. Equality is identity, which is what the
 * compile and UI caches key on.
 */
public final class SchemaGraph {
    public static final String ROOT_ID = "root";

    private static final Comparator<Edge> BY_ORDER = Comparator.comparingInt(Edge::order);

    private final Map<String, SchemaNode> nodes;
    private final Map<String, Edge> edges;
    private final Map<String, String> definitions;
    private final long sequence;
    private final Map<String, String> parentIndex;
    private final Map<String, Map<EdgeType, List<Edge>>> childrenIndex;
    private final Map<String, List<Edge>> incomingIndex;

    SchemaGraph(Map<String, SchemaNode> nodes, Map<String, Edge> edges, Map<String, String> definitions,
                long sequence) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.sequence = sequence;

        var parents = new LinkedHashMap<String, String>();
        var children = new LinkedHashMap<String, Map<EdgeType, List<Edge>>>();
        var incoming = new LinkedHashMap<String, List<Edge>>();
        for (Edge edge : this.edges.values()) {
            if (edge.type() == EdgeType.CHILD) {
                parents.putIfAbsent(edge.targetId(), edge.sourceId());
            }
            children.computeIfAbsent(edge.sourceId(), ignored -> new EnumMap<>(EdgeType.class))
                .computeIfAbsent(edge.type(), ignored -> new ArrayList<>())
                .add(edge);
            incoming.computeIfAbsent(edge.targetId(), ignored -> new ArrayList<>()).add(edge);
        }
        for (var byType : children.values()) {
            for (var entry : byType.entrySet()) {
                var sorted = new ArrayList<>(entry.getValue());
                sorted.sort(BY_ORDER);
                entry.setValue(Collections.unmodifiableList(sorted));
            }
        }
        incoming.replaceAll((id, list) -> Collections.unmodifiableList(list));
        this.parentIndex = Collections.unmodifiableMap(parents);
        this.childrenIndex = children;
        this.incomingIndex = incoming;
    }

    /**
     * Graph holding only the root object node.
     */
    public static SchemaGraph empty() {
        var root = SchemaNode.builder(NodeKind.OBJECT).key(ROOT_ID).title("Root").build().withId(ROOT_ID);
        var nodes = new LinkedHashMap<String, SchemaNode>();
        nodes.put(ROOT_ID, root);
        return new SchemaGraph(nodes, Map.of(), Map.of(), 0);
    }

    public SchemaNode root() {
        return nodes.get(ROOT_ID);
    }

    public Map<String, SchemaNode> nodes() {
        return nodes;
    }

    public Map<String, Edge> edges() {
        return edges;
    }

    /** Definition name to node id. */
    public Map<String, String> definitions() {
        return definitions;
    }

    public boolean contains(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public Optional<SchemaNode> node(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodes.get(nodeId));
    }

    public SchemaNode requireNode(String nodeId) {
        SchemaNode node = nodeId == null ? null : nodes.get(nodeId);
        if (node == null) {
            throw new NodeNotFoundException("Node not found: " + nodeId);
        }
        return node;
    }

    /** Parent through the single incoming child edge, if any. */
    public Optional<String> parentOf(String nodeId) {
        return Optional.ofNullable(parentIndex.get(nodeId));
    }

    /** Outgoing edges of one type, sorted by order. */
    public List<Edge> outgoing(String sourceId, EdgeType type) {
        var byType = childrenIndex.get(sourceId);
        if (byType == null) {
            return List.of();
        }
        return byType.getOrDefault(type, List.of());
    }

    public List<SchemaNode> children(String sourceId, EdgeType type) {
        var out = new ArrayList<SchemaNode>();
        for (Edge edge : outgoing(sourceId, type)) {
            SchemaNode child = nodes.get(edge.targetId());
            if (child != null) {
                out.add(child);
            }
        }
        return out;
    }

    public List<SchemaNode> children(String sourceId) {
        return children(sourceId, EdgeType.CHILD);
    }

    public List<Edge> incoming(String targetId) {
        return incomingIndex.getOrDefault(targetId, List.of());
    }

    /** First incoming edge of any type: the edge placing the node in its structural bucket. */
    public Optional<Edge> placement(String nodeId) {
        List<Edge> in = incoming(nodeId);
        for (Edge edge : in) {
            if (edge.type() == EdgeType.CHILD) {
                return Optional.of(edge);
            }
        }
        return in.isEmpty() ? Optional.empty() : Optional.of(in.get(0));
    }

    /**
     * Ids reachable from {@code nodeId} over child, then and else edges, excluding the node itself.
     */
    public Set<String> descendants(String nodeId) {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(nodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            var byType = childrenIndex.get(current);
            if (byType == null) {
                continue;
            }
            for (List<Edge> bucket : byType.values()) {
                for (Edge edge : bucket) {
                    if (!edge.targetId().equals(nodeId) && seen.add(edge.targetId())) {
                        queue.add(edge.targetId());
                    }
                }
            }
        }
        return seen;
    }

    public boolean isDescendant(String ancestorId, String candidateId) {
        return descendants(ancestorId).contains(candidateId);
    }

    /** Keys of the nodes in the (source, type) bucket. */
    public Set<String> siblingKeys(String sourceId, EdgeType type) {
        var keys = new LinkedHashSet<String>();
        for (SchemaNode sibling : children(sourceId, type)) {
            if (sibling.key() != null) {
                keys.add(sibling.key());
            }
        }
        return keys;
    }

    public Optional<String> definitionNodeId(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /** Names under which {@code nodeId} is registered as a definition. */
    public List<String> definitionNames(String nodeId) {
        var names = new ArrayList<String>();
        for (var entry : definitions.entrySet()) {
            if (entry.getValue().equals(nodeId)) {
                names.add(entry.getKey());
            }
        }
        return names;
    }

    long sequence() {
        return sequence;
    }

    GraphDraft edit() {
        return new GraphDraft(nodes, edges, definitions, sequence);
    }

    @Override
    public String toString() {
        return "SchemaGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + ", definitions="
            + definitions.keySet() + "}";
    }
}

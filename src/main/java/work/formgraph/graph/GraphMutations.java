package work.formgraph.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import work.formgraph.shared.Keys;

/**
 * Copy-on-write mutation API over {@link SchemaGraph}.
 *
 * <p>Every operation returns a new graph value and leaves its input untouched, including when it throws.
 */
public final class GraphMutations {
    private static final Logger LOG = Logger.getLogger(GraphMutations.class.getName());

    private GraphMutations() {}

    public static NodeAdded addNode(SchemaGraph graph, SchemaNode data) {
        return addNode(graph, data, SchemaGraph.ROOT_ID, EdgeType.CHILD);
    }

    public static NodeAdded addNode(SchemaGraph graph, SchemaNode data, String parentId) {
        return addNode(graph, data, parentId, EdgeType.CHILD);
    }

    /**
     * Inserts {@code data} under {@code parentId} at the end of the (parent, edgeType) bucket. A blank or colliding key
     * is replaced by the slugified title, disambiguated with a numeric suffix.
     */
    public static NodeAdded addNode(SchemaGraph graph, SchemaNode data, String parentId, EdgeType edgeType) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(edgeType, "edgeType");
        SchemaNode parent = graph.requireNode(parentId);
        checkEdgeSource(parent, edgeType);

        var draft = graph.edit();
        String id = draft.nextNodeId();
        String key = deriveKey(data, graph.siblingKeys(parentId, edgeType));
        draft.putNode(data.withId(id).withKey(key));
        draft.appendEdge(parentId, id, edgeType);
        LOG.fine(() -> "Added " + data.kind().tag() + " node " + id + " (" + key + ") under " + parentId
            + " via " + edgeType.wireName());
        return new NodeAdded(draft.build(), id);
    }

    /**
     * Removes the node, every node reachable from it over child/then/else edges, every edge touching a removed node
     * and every definition entry naming one. Condition and if-block references to removed nodes are cleared.
     */
    public static SchemaGraph removeNode(SchemaGraph graph, String nodeId) {
        if (SchemaGraph.ROOT_ID.equals(nodeId)) {
            throw new RootRemovalException("Cannot remove root");
        }
        graph.requireNode(nodeId);
        var removed = new LinkedHashSet<String>();
        removed.add(nodeId);
        removed.addAll(graph.descendants(nodeId));
        removed.remove(SchemaGraph.ROOT_ID);

        var draft = graph.edit();
        draft.nodes().keySet().removeAll(removed);
        draft.edges().values().removeIf(edge -> removed.contains(edge.sourceId())
            || removed.contains(edge.targetId()));
        draft.definitions().values().removeIf(removed::contains);
        for (SchemaNode node : new ArrayList<>(draft.nodes().values())) {
            SchemaNode scrubbed = scrubReferences(node, removed);
            if (scrubbed != node) {
                draft.putNode(scrubbed);
            }
        }
        LOG.fine(() -> "Removed " + removed.size() + " node(s) starting at " + nodeId);
        return draft.build();
    }

    /**
     * Shallow-merges {@code patch} into the node. Edges are never touched.
     *
     * @throws GraphStructureException when the new key collides with a sibling, or when a kind change would leave the
     *     node's outgoing edges invalid
     */
    public static SchemaGraph updateNode(SchemaGraph graph, String nodeId, NodePatch patch) {
        Objects.requireNonNull(patch, "patch");
        SchemaNode current = graph.requireNode(nodeId);
        if (patch.isEmpty()) {
            return graph;
        }
        SchemaNode updated = patch.applyTo(current);
        if (SchemaGraph.ROOT_ID.equals(nodeId) && updated.kind() != NodeKind.OBJECT) {
            throw new GraphStructureException("root_kind", "The root node must stay an object");
        }
        if (updated.kind() != current.kind()) {
            for (EdgeType type : EdgeType.values()) {
                if (!graph.outgoing(nodeId, type).isEmpty()) {
                    checkEdgeSource(updated, type);
                }
            }
        }
        if (!Objects.equals(updated.key(), current.key()) && updated.key() != null) {
            var placement = graph.placement(nodeId);
            if (placement.isPresent()) {
                Set<String> taken = graph.siblingKeys(placement.get().sourceId(), placement.get().type());
                if (taken.contains(updated.key())) {
                    throw new GraphStructureException("duplicate_key",
                        "Key '" + updated.key() + "' is already used by a sibling of " + nodeId);
                }
            }
        }
        var draft = graph.edit();
        draft.putNode(updated);
        return draft.build();
    }

    public static SchemaGraph moveNode(SchemaGraph graph, String nodeId, String newParentId) {
        return moveNode(graph, nodeId, newParentId, EdgeType.CHILD);
    }

    /**
     * Detaches the node from its current structural parent and appends it to the (newParent, edgeType) bucket.
     *
     * @throws CycleException when {@code newParentId} is the node itself or one of its descendants
     */
    public static SchemaGraph moveNode(SchemaGraph graph, String nodeId, String newParentId, EdgeType edgeType) {
        Objects.requireNonNull(edgeType, "edgeType");
        SchemaNode node = graph.requireNode(nodeId);
        SchemaNode parent = graph.requireNode(newParentId);
        if (SchemaGraph.ROOT_ID.equals(nodeId)) {
            throw new InvalidEdgeException("The root node cannot be moved");
        }
        if (nodeId.equals(newParentId) || graph.isDescendant(nodeId, newParentId)) {
            throw new CycleException("Moving " + nodeId + " under " + newParentId + " would create a cycle");
        }
        checkEdgeSource(parent, edgeType);

        var draft = graph.edit();
        for (Edge edge : graph.incoming(nodeId)) {
            draft.edges().remove(edge.id());
            if (edge.type().isBranch()) {
                clearBranchReference(draft, edge.sourceId(), nodeId);
            }
        }
        var taken = new LinkedHashSet<>(graph.siblingKeys(newParentId, edgeType));
        if (graph.outgoing(newParentId, edgeType).stream().anyMatch(edge -> edge.targetId().equals(nodeId))) {
            taken.remove(node.key());
        }
        if (node.key() != null && taken.contains(node.key())) {
            draft.putNode(node.withKey(Keys.disambiguate(node.key(), taken)));
        }
        draft.appendEdge(newParentId, nodeId, edgeType);
        LOG.fine(() -> "Moved " + nodeId + " under " + newParentId + " via " + edgeType.wireName());
        return draft.build();
    }

    /**
     * Moves the node to {@code newIndex} within its current sibling list. The index is clamped to the list bounds.
     * A node without a structural parent is left where it is.
     */
    public static SchemaGraph reorderNode(SchemaGraph graph, String nodeId, int newIndex) {
        graph.requireNode(nodeId);
        var placement = graph.placement(nodeId);
        if (placement.isEmpty()) {
            return graph;
        }
        Edge edge = placement.get();
        var siblings = new ArrayList<>(graph.outgoing(edge.sourceId(), edge.type()));
        siblings.removeIf(candidate -> candidate.id().equals(edge.id()));
        int index = Math.max(0, Math.min(newIndex, siblings.size()));
        siblings.add(index, edge);
        var draft = graph.edit();
        draft.renumber(siblings);
        return draft.build();
    }

    /**
     * Registers {@code nodeId} under {@code name}. With {@code disconnect} the child edge attaching the node to its
     * parent is removed, leaving the node reachable only through the definition registry.
     */
    public static SchemaGraph saveAsDefinition(SchemaGraph graph, String name, String nodeId, boolean disconnect) {
        checkDefinitionName(graph, name);
        if (SchemaGraph.ROOT_ID.equals(nodeId)) {
            throw new GraphStructureException("root_definition", "The root node cannot be saved as a definition");
        }
        graph.requireNode(nodeId);
        var draft = graph.edit();
        draft.definitions().put(name, nodeId);
        if (disconnect) {
            draft.edges().values().removeIf(edge -> edge.type() == EdgeType.CHILD && edge.targetId().equals(nodeId));
        }
        LOG.fine(() -> "Saved " + nodeId + " as definition '" + name + "'" + (disconnect ? " (detached)" : ""));
        return draft.build();
    }

    /**
     * Inserts {@code data} as a detached node and registers it under {@code name}.
     */
    public static NodeAdded createDefinition(SchemaGraph graph, String name, SchemaNode data) {
        Objects.requireNonNull(data, "data");
        checkDefinitionName(graph, name);
        var draft = graph.edit();
        String id = draft.nextNodeId();
        String key = data.key() == null || data.key().isBlank() ? name : data.key();
        draft.putNode(data.withId(id).withKey(key));
        draft.definitions().put(name, id);
        return new NodeAdded(draft.build(), id);
    }

    public static NodeAdded createRefToDefinition(SchemaGraph graph, String name, String parentId) {
        return createRefToDefinition(graph, name, parentId, null);
    }

    /**
     * Adds a ref node pointing at definition {@code name} under {@code parentId}. The key defaults to the definition
     * name and the title to the definition node's title.
     */
    public static NodeAdded createRefToDefinition(SchemaGraph graph, String name, String parentId, String key) {
        String definitionId = graph.definitionNodeId(name)
            .orElseThrow(() -> new DefinitionNotFoundException("Definition not found: " + name));
        SchemaNode definition = graph.requireNode(definitionId);
        var ref = SchemaNode.builder(new NodeDetails.Reference(name, definitionId))
            .key(key == null || key.isBlank() ? name : key)
            .title(definition.title() == null ? name : definition.title())
            .description(definition.description())
            .build();
        return addNode(graph, ref, parentId, EdgeType.CHILD);
    }

    static void checkEdgeSource(SchemaNode source, EdgeType type) {
        if (type == EdgeType.CHILD) {
            NodeKind kind = source.kind();
            if (kind != NodeKind.OBJECT && kind != NodeKind.ARRAY && kind != NodeKind.DEFINITION) {
                throw new InvalidEdgeException(
                    "A " + kind.tag() + " node cannot hold child nodes (" + source.id() + ")");
            }
        } else if (!source.kind().isBranchSource()) {
            throw new InvalidEdgeException("A " + type.wireName() + " edge must start at a conditional group or "
                + "if block, not at " + source.kind().tag() + " node " + source.id());
        }
    }

    private static void checkDefinitionName(SchemaGraph graph, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Definition name must not be blank");
        }
        if (graph.definitions().containsKey(name)) {
            throw new DuplicateDefinitionException("Definition already exists: " + name);
        }
    }

    private static String deriveKey(SchemaNode data, Set<String> taken) {
        String key = data.key();
        if (key != null && !key.isBlank() && !taken.contains(key)) {
            return key;
        }
        String base = Keys.slugify(data.title());
        if (base.isEmpty()) {
            base = key != null && !key.isBlank() ? key : data.kind().tag();
        }
        return Keys.disambiguate(base, taken);
    }

    private static void clearBranchReference(GraphDraft draft, String sourceId, String nodeId) {
        SchemaNode source = draft.nodes().get(sourceId);
        if (source != null) {
            SchemaNode scrubbed = scrubReferences(source, Set.of(nodeId));
            if (scrubbed != source) {
                draft.putNode(scrubbed);
            }
        }
    }

    /** Returns the node with then/else/ref pointers into {@code removed} cleared, or the same instance. */
    private static SchemaNode scrubReferences(SchemaNode node, Set<String> removed) {
        NodeDetails details = node.details();
        if (details instanceof NodeDetails.ConditionalGroup group) {
            boolean changed = false;
            var conditions = new ArrayList<Condition>(group.conditions().size());
            for (Condition condition : group.conditions()) {
                Condition next = condition;
                if (next.thenId() != null && removed.contains(next.thenId())) {
                    next = next.withThen(null);
                }
                if (next.elseId() != null && removed.contains(next.elseId())) {
                    next = next.withElse(null);
                }
                changed |= next != condition;
                conditions.add(next);
            }
            return changed ? node.withDetails(group.withConditions(conditions)) : node;
        }
        if (details instanceof NodeDetails.IfBlock block) {
            List<String> thenIds = without(block.thenIds(), removed);
            List<String> elseIds = without(block.elseIds(), removed);
            if (thenIds.size() == block.thenIds().size() && elseIds.size() == block.elseIds().size()) {
                return node;
            }
            return node.withDetails(new NodeDetails.IfBlock(block.condition(), thenIds, elseIds));
        }
        if (details instanceof NodeDetails.Reference ref && ref.resolvedNodeId() != null
                && removed.contains(ref.resolvedNodeId())) {
            return node.withDetails(ref.withResolvedNodeId(null));
        }
        return node;
    }

    private static List<String> without(List<String> ids, Set<String> removed) {
        var out = new ArrayList<String>(ids.size());
        for (String id : ids) {
            if (!removed.contains(id)) {
                out.add(id);
            }
        }
        return out;
    }
}

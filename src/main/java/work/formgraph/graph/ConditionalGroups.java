package work.formgraph.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Editing helpers for allOf/anyOf/oneOf group nodes and their conditions.
 */
public final class ConditionalGroups {
    private ConditionalGroups() {}

    /**
     * Adds an empty group under {@code parentId}, keyed {@code <combinator>_group} and titled
     * {@code "<combinator> Group"}.
     */
    public static NodeAdded addGroup(SchemaGraph graph, Combinator combinator, String parentId) {
        return addGroup(graph, combinator, parentId, EdgeType.CHILD);
    }

    /** Same as {@link #addGroup(SchemaGraph, Combinator, String)}, nesting the group in a then/else branch. */
    public static NodeAdded addGroup(SchemaGraph graph, Combinator combinator, String parentId, EdgeType edgeType) {
        Objects.requireNonNull(combinator, "combinator");
        var group = SchemaNode.builder(NodeDetails.ConditionalGroup.empty(combinator))
            .key(combinator.keyword() + "_group")
            .title(combinator.keyword() + " Group")
            .build();
        return GraphMutations.addNode(graph, group, parentId, edgeType);
    }

    public static List<Condition> conditions(SchemaGraph graph, String groupId) {
        return requireGroup(graph, groupId).conditions();
    }

    /**
     * Appends a condition. Branch targets not yet linked from the group get a then/else edge; a target that already
     * sits elsewhere in the tree is rejected.
     */
    public static SchemaGraph addCondition(SchemaGraph graph, String groupId, Condition condition) {
        Objects.requireNonNull(condition, "condition");
        var group = requireGroup(graph, groupId);
        var conditions = new ArrayList<>(group.conditions());
        conditions.add(condition);
        var draft = graph.edit();
        linkBranch(graph, draft, groupId, condition.thenId(), EdgeType.THEN);
        linkBranch(graph, draft, groupId, condition.elseId(), EdgeType.ELSE);
        draft.putNode(graph.requireNode(groupId).withDetails(group.withConditions(conditions)));
        return draft.build();
    }

    public static SchemaGraph updateCondition(SchemaGraph graph, String groupId, int index, Condition condition) {
        Objects.requireNonNull(condition, "condition");
        var group = requireGroup(graph, groupId);
        checkIndex(group, index);
        var conditions = new ArrayList<>(group.conditions());
        conditions.set(index, condition);
        var draft = graph.edit();
        linkBranch(graph, draft, groupId, condition.thenId(), EdgeType.THEN);
        linkBranch(graph, draft, groupId, condition.elseId(), EdgeType.ELSE);
        draft.putNode(graph.requireNode(groupId).withDetails(group.withConditions(conditions)));
        return draft.build();
    }

    /** Removes the condition at {@code index}. Branch nodes stay attached to the group. */
    public static SchemaGraph removeCondition(SchemaGraph graph, String groupId, int index) {
        var group = requireGroup(graph, groupId);
        checkIndex(group, index);
        var conditions = new ArrayList<>(group.conditions());
        conditions.remove(index);
        var draft = graph.edit();
        draft.putNode(graph.requireNode(groupId).withDetails(group.withConditions(conditions)));
        return draft.build();
    }

    /**
     * Points every condition of the group at the same then/else nodes, which is the shape the compiler emits as a
     * single if/then/else. Returns the same graph when nothing changes.
     */
    public static SchemaGraph syncBranches(SchemaGraph graph, String groupId, String thenId, String elseId) {
        var group = requireGroup(graph, groupId);
        boolean changed = false;
        var conditions = new ArrayList<Condition>(group.conditions().size());
        for (Condition condition : group.conditions()) {
            var synced = new Condition(condition.when(), thenId, elseId);
            changed |= !synced.equals(condition);
            conditions.add(synced);
        }
        if (!changed) {
            return graph;
        }
        var draft = graph.edit();
        linkBranch(graph, draft, groupId, thenId, EdgeType.THEN);
        linkBranch(graph, draft, groupId, elseId, EdgeType.ELSE);
        draft.putNode(graph.requireNode(groupId).withDetails(group.withConditions(conditions)));
        return draft.build();
    }

    /** Nodes attached to the group by then edges, in order. */
    public static List<SchemaNode> thenBranch(SchemaGraph graph, String groupId) {
        graph.requireNode(groupId);
        return graph.children(groupId, EdgeType.THEN);
    }

    public static List<SchemaNode> elseBranch(SchemaGraph graph, String groupId) {
        graph.requireNode(groupId);
        return graph.children(groupId, EdgeType.ELSE);
    }

    public static Optional<NodeDetails.ConditionalGroup> asGroup(SchemaNode node) {
        return node.details() instanceof NodeDetails.ConditionalGroup group ? Optional.of(group) : Optional.empty();
    }

    private static NodeDetails.ConditionalGroup requireGroup(SchemaGraph graph, String groupId) {
        SchemaNode node = graph.requireNode(groupId);
        return asGroup(node).orElseThrow(() -> new InvalidEdgeException(
            "Node " + groupId + " is a " + node.kind().tag() + " node, not a conditional group"));
    }

    private static void checkIndex(NodeDetails.ConditionalGroup group, int index) {
        if (index < 0 || index >= group.conditions().size()) {
            throw new IllegalArgumentException("Condition index " + index + " out of bounds (size "
                + group.conditions().size() + ")");
        }
    }

    private static void linkBranch(SchemaGraph graph, GraphDraft draft, String groupId, String targetId,
                                   EdgeType type) {
        if (targetId == null) {
            return;
        }
        graph.requireNode(targetId);
        boolean linked = draft.bucket(groupId, type).stream().anyMatch(edge -> edge.targetId().equals(targetId));
        if (linked) {
            return;
        }
        if (targetId.equals(groupId) || SchemaGraph.ROOT_ID.equals(targetId)
                || graph.isDescendant(targetId, groupId)) {
            throw new CycleException("Linking " + targetId + " as a branch of " + groupId + " would create a cycle");
        }
        if (!graph.incoming(targetId).isEmpty()) {
            throw new InvalidEdgeException("Node " + targetId + " already has a structural parent");
        }
        draft.appendEdge(groupId, targetId, type);
    }
}

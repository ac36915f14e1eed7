package work.formgraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Explicit, advisory structural check of a graph. Mutations do not call it; hosts run it before export or on demand.
 */
public final class GraphValidator {
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    private GraphValidator() {}

    public static GraphValidation validate(SchemaGraph graph) {
        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();

        for (Edge edge : graph.edges().values()) {
            if (!graph.contains(edge.sourceId()) || !graph.contains(edge.targetId())) {
                errors.add("Edge " + edge.id() + " references a missing node");
                continue;
            }
            if (edge.type().isBranch() && !graph.requireNode(edge.sourceId()).kind().isBranchSource()) {
                errors.add("Edge " + edge.id() + ": " + edge.type().wireName()
                    + " edges must start at a conditional group or if block");
            }
        }
        for (var entry : graph.definitions().entrySet()) {
            if (!graph.contains(entry.getValue())) {
                errors.add("Definition '" + entry.getKey() + "' points at missing node " + entry.getValue());
            }
        }

        Set<String> reachable = reachable(graph);
        for (SchemaNode node : graph.nodes().values()) {
            if (!reachable.contains(node.id())) {
                errors.add("Orphaned node: " + FieldValidators.label(node));
            }
            if (countIncomingChildEdges(graph, node.id()) > 1) {
                errors.add("Node " + FieldValidators.label(node) + " has more than one parent");
            }
            if (node.details() instanceof NodeDetails.Reference ref
                    && (ref.refTarget() == null || !graph.definitions().containsKey(ref.refTarget()))) {
                errors.add("Unresolved reference '" + ref.refTarget() + "' at " + FieldValidators.label(node));
            }
            for (EdgeType type : EdgeType.values()) {
                var seen = new HashSet<String>();
                for (SchemaNode child : graph.children(node.id(), type)) {
                    if (child.key() != null && !seen.add(child.key())) {
                        errors.add("Duplicate key '" + child.key() + "' under " + FieldValidators.label(node)
                            + " (" + type.wireName() + ")");
                    }
                }
            }
            warnings.addAll(FieldValidators.validate(graph, node));
        }
        errors.addAll(childCycles(graph));
        return GraphValidation.of(errors, warnings);
    }

    /**
     * Nodes reachable from the root or from a definition over edges, condition branch ids and if-block id lists.
     */
    static Set<String> reachable(SchemaGraph graph) {
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(SchemaGraph.ROOT_ID);
        queue.addAll(graph.definitions().values());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!graph.contains(current) || !seen.add(current)) {
                continue;
            }
            for (EdgeType type : EdgeType.values()) {
                for (Edge edge : graph.outgoing(current, type)) {
                    queue.add(edge.targetId());
                }
            }
            NodeDetails details = graph.requireNode(current).details();
            if (details instanceof NodeDetails.ConditionalGroup group) {
                for (Condition condition : group.conditions()) {
                    if (condition.thenId() != null) {
                        queue.add(condition.thenId());
                    }
                    if (condition.elseId() != null) {
                        queue.add(condition.elseId());
                    }
                }
            } else if (details instanceof NodeDetails.IfBlock block) {
                queue.addAll(block.thenIds());
                queue.addAll(block.elseIds());
            }
        }
        return seen;
    }

    private static int countIncomingChildEdges(SchemaGraph graph, String nodeId) {
        int count = 0;
        for (Edge edge : graph.incoming(nodeId)) {
            if (edge.type() == EdgeType.CHILD) {
                count++;
            }
        }
        return count;
    }

    private static List<String> childCycles(SchemaGraph graph) {
        var problems = new ArrayList<String>();
        Map<String, Integer> state = new HashMap<>();
        for (String start : graph.nodes().keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            var stack = new ArrayDeque<Frame>();
            stack.push(new Frame(start));
            state.put(start, ON_STACK);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<Edge> out = graph.outgoing(frame.nodeId, EdgeType.CHILD);
                if (frame.next >= out.size()) {
                    state.put(frame.nodeId, DONE);
                    stack.pop();
                    continue;
                }
                String target = out.get(frame.next++).targetId();
                Integer seen = state.get(target);
                if (seen == null) {
                    state.put(target, ON_STACK);
                    stack.push(new Frame(target));
                } else if (seen == ON_STACK) {
                    problems.add("Cycle detected through node " + target);
                }
            }
        }
        return problems;
    }

    private static final class Frame {
        private final String nodeId;
        private int next;

        private Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }
}
